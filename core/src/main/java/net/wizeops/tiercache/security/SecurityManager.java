package net.wizeops.tiercache.security;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores the security posture of the remote tier and reports on it.
 * <p>
 * Points: ACL credentials 30 (AUTH password alone 20), TLS 30, certificate verification
 * 20, and a certificate valid for more than {@value #CERTIFICATE_WARNING_DAYS} days 20
 * (10 when TLS is on but the expiry cannot be determined). HIGH from 80, MEDIUM from 60.
 */
@Slf4j
public class SecurityManager {
    public static final int CERTIFICATE_WARNING_DAYS = 30;
    static final int SECURE_SCORE = 70;

    @Getter
    private final SecurityConfig config;
    private final Clock clock;

    public SecurityManager(SecurityConfig config) {
        this(config, Clock.systemUTC());
    }

    public SecurityManager(SecurityConfig config, Clock clock) {
        this.config = config != null ? config : SecurityConfig.builder().build();
        this.clock = clock;
    }

    /**
     * Describes the connection this manager's configuration would open to {@code remoteUrl}.
     */
    public ConnectionInfo describeConnection(String remoteUrl) {
        boolean tls = config.isTlsEnabled() || (remoteUrl != null && remoteUrl.startsWith("rediss://"));
        String password = config.hasAcl() ? config.getAclPassword() : config.getAuthPassword();
        Instant expiry = tls && config.getTlsCertPath() != null
                ? inspectCertificate(Path.of(config.getTlsCertPath())).map(CertificateInfo::getNotAfter).orElse(null)
                : null;
        return ConnectionInfo.builder()
                .remoteUrl(remoteUrl)
                .tlsEnabled(tls)
                .verifyCertificates(config.isVerifyCertificates())
                .authenticated(config.hasAuthentication())
                .aclUsername(config.hasAcl() ? config.getAclUsername() : null)
                .passwordLength(password != null ? password.length() : 0)
                .certificateExpiry(expiry)
                .build();
    }

    public SecurityValidationResult validateConnectionSecurity(ConnectionInfo connection) {
        SecurityValidationResult.SecurityValidationResultBuilder result = SecurityValidationResult.builder();
        int score = 0;
        boolean critical = false;

        if (connection.isAuthenticated()) {
            score += connection.usesAcl() ? 30 : 20;
            if (connection.getPasswordLength() > 0 && connection.getPasswordLength() < SecurityConfig.MIN_PASSWORD_LENGTH) {
                result.vulnerability("Weak password: shorter than " + SecurityConfig.MIN_PASSWORD_LENGTH + " characters");
                result.recommendation(new SecurityRecommendation(RecommendationCategory.IMPORTANT,
                        "Use a password of at least 16 characters mixing case, digits and symbols"));
            }
            if (!connection.usesAcl()) {
                result.recommendation(new SecurityRecommendation(RecommendationCategory.OPTIMIZATION,
                        "Consider ACL users instead of a shared AUTH password"));
            }
        } else {
            critical = true;
            result.vulnerability("No authentication configured: the store accepts anonymous clients");
            result.recommendation(new SecurityRecommendation(RecommendationCategory.CRITICAL,
                    "Enable AUTH or ACL authentication"));
        }

        if (connection.isTlsEnabled()) {
            score += 30;
            if (connection.isVerifyCertificates()) {
                score += 20;
            } else {
                result.vulnerability("Certificate verification disabled: open to man-in-the-middle attacks");
                result.recommendation(new SecurityRecommendation(RecommendationCategory.IMPORTANT,
                        "Enable certificate verification"));
            }
            score += scoreCertificate(connection.getCertificateExpiry(), result);
            Instant expiry = connection.getCertificateExpiry();
            critical |= expiry != null && expiry.isBefore(clock.instant());
        } else {
            critical = true;
            result.vulnerability("Unencrypted connection: data travels in plain text");
            result.recommendation(new SecurityRecommendation(RecommendationCategory.CRITICAL,
                    "Enable TLS for the remote tier"));
        }

        result.recommendation(new SecurityRecommendation(RecommendationCategory.OPTIMIZATION,
                "Keep the store on a private network with firewall rules restricting access"));
        result.recommendation(new SecurityRecommendation(RecommendationCategory.OPTIMIZATION,
                "Monitor failed authentication attempts and the slow log"));

        int bounded = Math.min(100, score);
        return result
                .score(bounded)
                .level(levelFor(bounded))
                .secure(bounded >= SECURE_SCORE && !critical)
                .build();
    }

    public SecurityValidationResult validateConfiguredSecurity(String remoteUrl) {
        return validateConnectionSecurity(describeConnection(remoteUrl));
    }

    public Map<String, Object> getSecurityStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("securityLevel", config.getSecurityLevel().name());
        status.put("hasAuthentication", config.hasAuthentication());
        status.put("usesAcl", config.hasAcl());
        status.put("tlsEnabled", config.isTlsEnabled());
        status.put("verifyCertificates", config.isVerifyCertificates());
        status.put("encryptionEnabled", config.hasEncryption());
        if (config.isTlsEnabled() && config.getTlsCertPath() != null) {
            inspectCertificate(Path.of(config.getTlsCertPath())).ifPresent(cert -> {
                status.put("certificateSubject", cert.getSubject());
                status.put("certificateExpiry", cert.getNotAfter().toString());
                status.put("certificateDaysRemaining", cert.getDaysUntilExpiry());
            });
        }
        status.put("configuration", config.toRedactedMap());
        status.put("issues", config.validate().getIssues());
        status.put("timestamp", clock.instant().toString());
        return status;
    }

    public String generateSecurityReport(String remoteUrl) {
        SecurityValidationResult result = validateConfiguredSecurity(remoteUrl);
        StringBuilder report = new StringBuilder()
                .append("Remote Tier Security Report\n")
                .append("Generated: ").append(clock.instant()).append('\n')
                .append("Configured level: ").append(config.getSecurityLevel()).append("\n\n")
                .append(result.getSummary());
        List<String> issues = config.validate().getIssues();
        if (!issues.isEmpty()) {
            report.append("\nConfiguration issues (").append(issues.size()).append("):\n");
            issues.forEach(issue -> report.append("  - ").append(issue).append('\n'));
        }
        return report.toString();
    }

    /**
     * Reads the first X.509 certificate of a PEM or DER file.
     *
     * @return empty when the file is missing or unreadable
     */
    public Optional<CertificateInfo> inspectCertificate(Path path) {
        if (!Files.isReadable(path)) {
            return Optional.empty();
        }
        try (InputStream in = Files.newInputStream(path)) {
            X509Certificate certificate = (X509Certificate) CertificateFactory.getInstance("X.509").generateCertificate(in);
            Instant notAfter = certificate.getNotAfter().toInstant();
            long days = Duration.between(clock.instant(), notAfter).toDays();
            if (days < CERTIFICATE_WARNING_DAYS) {
                log.warn("TLS certificate {} expires in {} days", path, days);
            }
            return Optional.of(new CertificateInfo(path.toString(),
                    certificate.getSubjectX500Principal().getName(), notAfter, days));
        } catch (IOException | CertificateException | ClassCastException e) {
            log.warn("Could not read TLS certificate {}", path, e);
            return Optional.empty();
        }
    }

    private int scoreCertificate(Instant expiry, SecurityValidationResult.SecurityValidationResultBuilder result) {
        if (expiry == null) {
            result.recommendation(new SecurityRecommendation(RecommendationCategory.OPTIMIZATION,
                    "Monitor certificate expiration dates"));
            return 10;
        }
        Instant now = clock.instant();
        if (expiry.isBefore(now)) {
            result.vulnerability("TLS certificate expired " + Duration.between(expiry, now).toDays() + " days ago");
            result.recommendation(new SecurityRecommendation(RecommendationCategory.CRITICAL,
                    "Replace the expired TLS certificate"));
            return 0;
        }
        long days = Duration.between(now, expiry).toDays();
        if (days <= CERTIFICATE_WARNING_DAYS) {
            result.vulnerability("TLS certificate expires in " + days + " days");
            result.recommendation(new SecurityRecommendation(RecommendationCategory.IMPORTANT,
                    "Renew the TLS certificate before it expires"));
            return 0;
        }
        result.recommendation(new SecurityRecommendation(RecommendationCategory.OPTIMIZATION,
                "Rotate TLS certificates regularly"));
        return 20;
    }

    static SecurityLevel levelFor(int score) {
        if (score >= 80) {
            return SecurityLevel.HIGH;
        }
        if (score >= 60) {
            return SecurityLevel.MEDIUM;
        }
        return SecurityLevel.LOW;
    }
}
