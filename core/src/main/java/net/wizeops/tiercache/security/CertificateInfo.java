package net.wizeops.tiercache.security;

import lombok.Value;

import java.time.Instant;

@Value
public class CertificateInfo {
    String path;
    String subject;
    Instant notAfter;
    long daysUntilExpiry;

    public boolean isExpired() {
        return daysUntilExpiry < 0;
    }
}
