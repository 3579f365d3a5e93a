package it.netdicom.api;

import java.util.List;
import java.util.Map;
import java.util.Set;

public record CapabilityResponse(
    String aeTitle,
    long maxPduLength,
    int maxAssociations,
    List<SupportedSopClass> supportedContexts,
    Map<String, Set<String>> services
) {

    public record SupportedSopClass(String sopClass, String uid, List<String> transferSyntaxes) {
    }
}
