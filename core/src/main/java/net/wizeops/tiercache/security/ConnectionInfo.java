package net.wizeops.tiercache.security;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What is known about a remote-tier connection when its security is assessed.
 */
@Value
@Builder
public class ConnectionInfo {
    String remoteUrl;
    boolean tlsEnabled;
    boolean verifyCertificates;
    boolean authenticated;
    String aclUsername;
    int passwordLength;
    /** {@code null} when no certificate is configured or it could not be read. */
    Instant certificateExpiry;

    public boolean usesAcl() {
        return aclUsername != null && !aclUsername.isBlank();
    }
}
