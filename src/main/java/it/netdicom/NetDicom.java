package it.netdicom;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import javax.net.ssl.SSLContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import it.netdicom.association.AeSettings;
import it.netdicom.association.ApplicationEntity;
import it.netdicom.network.AssociationServer;
import it.netdicom.security.TLSContextFactory;
import it.netdicom.sop.SopClass;
import it.netdicom.sop.SopClassRegistry;

@SpringBootApplication
public class NetDicom {

    private static final Logger logger = LoggerFactory.getLogger(NetDicom.class);

    @Value("${dicom.ae-title:NETDICOM}")
    private String aeTitle;
    @Value("${dicom.server.enabled:true}")
    private boolean serverEnabled;
    @Value("${dicom.server.bind-address:0.0.0.0}")
    private String bindAddress;
    @Value("${dicom.server.port:11112}")
    private int serverPort;
    @Value("${dicom.max-pdu-length:16382}")
    private long maxPduLength;
    @Value("${dicom.max-associations:10}")
    private int maxAssociations;
    @Value("${dicom.timeouts.acse-seconds:30}")
    private long acseTimeoutSeconds;
    @Value("${dicom.timeouts.dimse-seconds:30}")
    private long dimseTimeoutSeconds;
    @Value("${dicom.timeouts.network-seconds:60}")
    private long networkTimeoutSeconds;
    @Value("${dicom.timeouts.connect-seconds:10}")
    private long connectTimeoutSeconds;
    @Value("${dicom.timeouts.artim-seconds:30}")
    private long artimTimeoutSeconds;
    @Value("${dicom.require-called-ae-title:false}")
    private boolean requireCalledAeTitle;
    @Value("${dicom.require-calling-ae-titles:}")
    private String requiredCallingAeTitles;
    @Value("${dicom.scp.transfer-syntaxes:1.2.840.10008.1.2.1,1.2.840.10008.1.2}")
    private String scpTransferSyntaxes;
    @Value("${dicom.scp.sop-classes:VerificationSOPClass}")
    private String scpSopClasses;
    @Value("${tls.keystore.path:}")
    private String keystorePath;
    @Value("${tls.keystore.password:}")
    private String keystorePassword;
    @Value("${tls.truststore.path:}")
    private String truststorePath;
    @Value("${tls.truststore.password:}")
    private String truststorePassword;
    @Value("${tls.pkix.revocation-enabled:false}")
    private boolean tlsRevocationEnabled;
    @Value("${tls.pkix.required-policy-oids:}")
    private String tlsRequiredPolicyOids;

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(NetDicom.class);
        app.setBanner((environment, sourceClass, out) -> out.println("NETDICOM UPPER LAYER SERVER"));
        app.run(args);
    }

    @Bean
    public AeSettings aeSettings() {
        AeSettings settings = new AeSettings();
        settings.setAeTitle(aeTitle);
        settings.setMaxPduLength(maxPduLength);
        settings.setMaxAssociations(maxAssociations);
        settings.setAcseTimeout(Duration.ofSeconds(acseTimeoutSeconds));
        settings.setDimseTimeout(Duration.ofSeconds(dimseTimeoutSeconds));
        settings.setNetworkTimeout(Duration.ofSeconds(networkTimeoutSeconds));
        settings.setConnectTimeout(Duration.ofSeconds(connectTimeoutSeconds));
        settings.setArtimTimeout(Duration.ofSeconds(artimTimeoutSeconds));
        settings.setRequireCalledAeTitle(requireCalledAeTitle);
        settings.setRequiredCallingAeTitles(parseCsv(requiredCallingAeTitles));
        return settings;
    }

    @Bean(destroyMethod = "shutdown")
    public ApplicationEntity applicationEntity(AeSettings settings, Optional<SSLContext> sslContext) {
        ApplicationEntity ae = new ApplicationEntity(settings);
        List<String> transferSyntaxes = parseList(scpTransferSyntaxes);
        for (String name : parseList(scpSopClasses)) {
            SopClass sopClass = SopClassRegistry.byName(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown SOP class in dicom.scp.sop-classes: " + name));
            ae.addSupportedContext(sopClass.uid(), transferSyntaxes);
            ae.addRequestedContext(sopClass.uid(), transferSyntaxes);
        }
        sslContext.ifPresent(ae::setSslContext);
        logger.info("AE {} supports {} SOP class(es) with transfer syntaxes {}", ae.aeTitle(), ae.supportedContexts().size(),
            transferSyntaxes);
        return ae;
    }

    @Bean
    @ConditionalOnProperty(name = "dicom.tls.enabled", havingValue = "true")
    public SSLContext sslContext(TLSContextFactory factory) {
        return factory.create(
            keystorePath,
            keystorePassword,
            truststorePath,
            truststorePassword,
            tlsRevocationEnabled,
            parseCsv(tlsRequiredPolicyOids)
        );
    }

    @Bean(destroyMethod = "stop")
    public AssociationServer associationServer(ApplicationEntity ae) {
        return new AssociationServer(ae, bindAddress, serverPort);
    }

    @Bean
    public CommandLineRunner startServer(AssociationServer server) {
        return args -> {
            if (!serverEnabled) {
                logger.info("DICOM server disabled");
                return;
            }
            server.bind();
            Thread acceptor = new Thread(() -> {
                try {
                    server.start();
                } catch (Exception e) {
                    logger.error("DICOM server stopped: {}", e.getMessage(), e);
                }
            }, "netdicom-server");
            acceptor.start();
        };
    }

    private static Set<String> parseCsv(String csv) {
        return Set.copyOf(parseList(csv));
    }

    private static List<String> parseList(String csv) {
        List<String> values = new ArrayList<>();
        if (!StringUtils.hasText(csv)) {
            return values;
        }
        Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(value -> !value.isEmpty())
            .forEach(values::add);
        return values;
    }
}
