package it.netdicom.association;

import java.time.Duration;
import java.util.Set;

import it.netdicom.sop.Uids;
import lombok.Getter;
import lombok.Setter;

/**
 * Application entity configuration. Associations take a snapshot of the values they need when they start.
 */
@Getter
@Setter
public class AeSettings {

    private String aeTitle = "NETDICOM";
    private long maxPduLength = 16382;
    private int maxAssociations = 10;
    private Duration acseTimeout = Duration.ofSeconds(30);
    private Duration dimseTimeout = Duration.ofSeconds(30);
    private Duration networkTimeout = Duration.ofSeconds(60);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration artimTimeout = Duration.ofSeconds(30);
    private boolean requireCalledAeTitle;
    private Set<String> requiredCallingAeTitles = Set.of();
    private String implementationClassUid = Uids.IMPLEMENTATION_CLASS;
    private String implementationVersionName = Uids.IMPLEMENTATION_VERSION;
}
