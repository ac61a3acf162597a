package net.wizeops.tiercache.providers.redis;

import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.exceptions.InfrastructureException;
import net.wizeops.tiercache.security.SecurityConfig;

import javax.net.ssl.KeyManager;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;

/**
 * Builds the socket factory for TLS connections from PEM files: the CA bundle becomes the
 * trust store, the client certificate and PKCS#8 key become the key store. With
 * certificate verification off every server certificate is accepted.
 */
@Slf4j
public class TlsSocketFactoryBuilder {
    private static final char[] KEY_STORE_PASSWORD = new char[0];

    private final SecurityConfig security;

    public TlsSocketFactoryBuilder(SecurityConfig security) {
        this.security = security;
    }

    public SSLSocketFactory build() {
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(keyManagers(), trustManagers(), null);
            return context.getSocketFactory();
        } catch (GeneralSecurityException | IOException e) {
            throw new InfrastructureException("Failed to set up TLS for the remote tier", e);
        }
    }

    private KeyManager[] keyManagers() throws GeneralSecurityException, IOException {
        if (security.getTlsCertPath() == null || security.getTlsKeyPath() == null) {
            return null;
        }
        List<Certificate> chain = readCertificates(Path.of(security.getTlsCertPath()));
        PrivateKey key = readPrivateKey(Path.of(security.getTlsKeyPath()));

        KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
        store.load(null, null);
        store.setKeyEntry("client", key, KEY_STORE_PASSWORD, chain.toArray(new Certificate[0]));

        KeyManagerFactory factory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        factory.init(store, KEY_STORE_PASSWORD);
        return factory.getKeyManagers();
    }

    private TrustManager[] trustManagers() throws GeneralSecurityException, IOException {
        if (!security.isVerifyCertificates()) {
            log.warn("TLS certificate verification is disabled for the remote tier");
            return new TrustManager[]{new AcceptAllTrustManager()};
        }
        if (security.getTlsCaPath() == null) {
            return null;
        }
        KeyStore store = KeyStore.getInstance(KeyStore.getDefaultType());
        store.load(null, null);
        int index = 0;
        for (Certificate certificate : readCertificates(Path.of(security.getTlsCaPath()))) {
            store.setCertificateEntry("ca-" + index++, certificate);
        }
        TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        factory.init(store);
        return factory.getTrustManagers();
    }

    static List<Certificate> readCertificates(Path path) throws GeneralSecurityException, IOException {
        try (InputStream in = Files.newInputStream(path)) {
            Collection<? extends Certificate> certificates = CertificateFactory.getInstance("X.509").generateCertificates(in);
            if (certificates.isEmpty()) {
                throw new GeneralSecurityException("No certificate found in " + path);
            }
            return new ArrayList<>(certificates);
        }
    }

    static PrivateKey readPrivateKey(Path path) throws GeneralSecurityException, IOException {
        String pem = Files.readString(path, StandardCharsets.US_ASCII);
        if (pem.contains("BEGIN RSA PRIVATE KEY") || pem.contains("BEGIN EC PRIVATE KEY")) {
            throw new GeneralSecurityException("Key " + path + " must be in PKCS#8 format (BEGIN PRIVATE KEY)");
        }
        String base64 = pem
                .replaceAll("-----BEGIN [A-Z ]*PRIVATE KEY-----", "")
                .replaceAll("-----END [A-Z ]*PRIVATE KEY-----", "")
                .replaceAll("\\s", "");
        PKCS8EncodedKeySpec spec = new PKCS8EncodedKeySpec(Base64.getDecoder().decode(base64));
        try {
            return KeyFactory.getInstance("RSA").generatePrivate(spec);
        } catch (InvalidKeySpecException e) {
            log.debug("Key {} is not RSA, trying EC", path);
            return KeyFactory.getInstance("EC").generatePrivate(spec);
        }
    }

    private static final class AcceptAllTrustManager implements X509TrustManager {
        @Override
        public void checkClientTrusted(X509Certificate[] chain, String authType) {
            // accepts any client
        }

        @Override
        public void checkServerTrusted(X509Certificate[] chain, String authType) {
            // accepts any server
        }

        @Override
        public X509Certificate[] getAcceptedIssuers() {
            return new X509Certificate[0];
        }
    }
}
