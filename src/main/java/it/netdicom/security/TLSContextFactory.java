package it.netdicom.security;

import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.CertPathValidator;
import java.security.cert.PKIXBuilderParameters;
import java.security.cert.PKIXRevocationChecker;
import java.security.cert.X509CertSelector;
import java.util.Set;

import javax.net.ssl.CertPathTrustManagerParameters;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Builds the {@link SSLContext} used for DICOM TLS on both the listening and the requesting side.
 * The key store is PKCS12; the optional trust store is JKS and validated with PKIX.
 */
@Component
public class TLSContextFactory {

    private static final Logger logger = LoggerFactory.getLogger(TLSContextFactory.class);

    private final ResourceLoader resourceLoader;

    public TLSContextFactory(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public SSLContext create(
        String keyStorePath,
        String keyStorePassword,
        String trustStorePath,
        String trustStorePassword,
        boolean revocationEnabled,
        Set<String> requiredPolicyOids
    ) {
        if (!StringUtils.hasText(keyStorePath)) {
            throw new IllegalArgumentException("TLS requires a key store path");
        }
        try {
            KeyStore keyStore = loadStore(keyStorePath, keyStorePassword, "PKCS12");
            KeyManagerFactory keyManagers = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            keyManagers.init(keyStore, keyStorePassword == null ? new char[0] : keyStorePassword.toCharArray());

            TrustManagerFactory trustManagers = null;
            if (StringUtils.hasText(trustStorePath)) {
                trustManagers = pkixTrustManagers(loadStore(trustStorePath, trustStorePassword, "JKS"), revocationEnabled, requiredPolicyOids);
            }

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(keyManagers.getKeyManagers(), trustManagers == null ? null : trustManagers.getTrustManagers(), null);
            logger.info("TLS context created from key store {} (trust store: {}, revocation checks: {})",
                keyStorePath, StringUtils.hasText(trustStorePath) ? trustStorePath : "JVM default", revocationEnabled);
            return context;
        } catch (GeneralSecurityException | IOException e) {
            throw new IllegalStateException("Failed to initialize TLS context", e);
        }
    }

    private TrustManagerFactory pkixTrustManagers(KeyStore trustStore, boolean revocationEnabled, Set<String> requiredPolicyOids)
        throws GeneralSecurityException {
        PKIXBuilderParameters parameters = new PKIXBuilderParameters(trustStore, new X509CertSelector());
        parameters.setRevocationEnabled(revocationEnabled);
        if (requiredPolicyOids != null && !requiredPolicyOids.isEmpty()) {
            parameters.setExplicitPolicyRequired(true);
            parameters.setInitialPolicies(requiredPolicyOids);
        }
        if (revocationEnabled) {
            PKIXRevocationChecker checker = (PKIXRevocationChecker) CertPathValidator.getInstance("PKIX").getRevocationChecker();
            checker.setOptions(Set.of(PKIXRevocationChecker.Option.PREFER_CRLS));
            parameters.addCertPathChecker(checker);
        }
        TrustManagerFactory factory = TrustManagerFactory.getInstance("PKIX");
        factory.init(new CertPathTrustManagerParameters(parameters));
        return factory;
    }

    private KeyStore loadStore(String path, String password, String type) throws GeneralSecurityException, IOException {
        Resource resource = resourceLoader.getResource(path);
        try (InputStream is = resource.getInputStream()) {
            KeyStore keyStore = KeyStore.getInstance(type);
            keyStore.load(is, password == null ? null : password.toCharArray());
            return keyStore;
        }
    }
}
