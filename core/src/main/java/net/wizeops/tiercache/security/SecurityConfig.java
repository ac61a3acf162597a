package net.wizeops.tiercache.security;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;
import net.wizeops.tiercache.config.ValidationResult;
import net.wizeops.tiercache.encryption.AesGcmEncryptionStrategy;
import net.wizeops.tiercache.exceptions.ConfigurationException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Security for the remote tier: AUTH password and/or ACL credentials, TLS material,
 * certificate verification and the optional key that encrypts stored values.
 */
@Value
@Builder(toBuilder = true)
public class SecurityConfig {
    public static final int MIN_PASSWORD_LENGTH = 12;

    private static final Set<String> KNOWN_KEYS = Set.of("authPassword", "aclUsername", "aclPassword",
            "tlsEnabled", "tlsCertPath", "tlsKeyPath", "tlsCaPath", "verifyCertificates", "encryptionKey");

    @ToString.Exclude
    String authPassword;
    String aclUsername;
    @ToString.Exclude
    String aclPassword;
    boolean tlsEnabled;
    String tlsCertPath;
    String tlsKeyPath;
    String tlsCaPath;
    @Builder.Default
    boolean verifyCertificates = true;
    /** Base64 of a 256-bit AES key. */
    @ToString.Exclude
    String encryptionKey;

    public boolean hasAuthentication() {
        return notBlank(authPassword) || hasAcl();
    }

    public boolean hasAcl() {
        return notBlank(aclUsername) && notBlank(aclPassword);
    }

    public boolean hasEncryption() {
        return notBlank(encryptionKey);
    }

    public SecurityLevel getSecurityLevel() {
        if (tlsEnabled && hasAuthentication() && verifyCertificates) {
            return SecurityLevel.HIGH;
        }
        if (tlsEnabled || hasAuthentication()) {
            return SecurityLevel.MEDIUM;
        }
        return SecurityLevel.LOW;
    }

    public ValidationResult validate() {
        ValidationResult.ValidationResultBuilder result = ValidationResult.builder();

        if (notBlank(aclUsername) && !notBlank(aclPassword)) {
            result.error("securityConfig.aclPassword: required when aclUsername is set");
        }
        if (!notBlank(aclUsername) && notBlank(aclPassword)) {
            result.error("securityConfig.aclUsername: required when aclPassword is set");
        }
        if (!hasAuthentication()) {
            result.warning("securityConfig: no AUTH password or ACL credentials configured for the remote tier");
        }
        if (notBlank(authPassword) && authPassword.length() < MIN_PASSWORD_LENGTH) {
            result.warning("securityConfig.authPassword: shorter than " + MIN_PASSWORD_LENGTH + " characters");
        }

        if (tlsEnabled) {
            checkTlsPath(result, "tlsCertPath", tlsCertPath);
            checkTlsPath(result, "tlsKeyPath", tlsKeyPath);
            checkTlsPath(result, "tlsCaPath", tlsCaPath);
            if (!verifyCertificates) {
                result.warning("securityConfig.verifyCertificates: disabled, connections are open to man-in-the-middle attacks");
            }
        }

        if (hasEncryption()) {
            checkEncryptionKey(result);
        } else {
            result.warning("securityConfig.encryptionKey: not set, cached values are stored unencrypted");
        }
        return result.build();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        putIfPresent(map, "authPassword", authPassword);
        putIfPresent(map, "aclUsername", aclUsername);
        putIfPresent(map, "aclPassword", aclPassword);
        map.put("tlsEnabled", tlsEnabled);
        putIfPresent(map, "tlsCertPath", tlsCertPath);
        putIfPresent(map, "tlsKeyPath", tlsKeyPath);
        putIfPresent(map, "tlsCaPath", tlsCaPath);
        map.put("verifyCertificates", verifyCertificates);
        putIfPresent(map, "encryptionKey", encryptionKey);
        return map;
    }

    /**
     * Same shape as {@link #toMap()} with credentials masked, for status endpoints and logs.
     */
    public Map<String, Object> toRedactedMap() {
        Map<String, Object> map = toMap();
        map.computeIfPresent("authPassword", (k, v) -> "****");
        map.computeIfPresent("aclPassword", (k, v) -> "****");
        map.computeIfPresent("encryptionKey", (k, v) -> "****");
        return map;
    }

    public static SecurityConfig fromMap(Map<String, ?> map) {
        List<String> unknown = map.keySet().stream().filter(k -> !KNOWN_KEYS.contains(k)).sorted().toList();
        if (!unknown.isEmpty()) {
            throw new ConfigurationException("securityConfig: unknown fields " + unknown);
        }
        return SecurityConfig.builder()
                .authPassword(string(map, "authPassword"))
                .aclUsername(string(map, "aclUsername"))
                .aclPassword(string(map, "aclPassword"))
                .tlsEnabled(bool(map, "tlsEnabled", false))
                .tlsCertPath(string(map, "tlsCertPath"))
                .tlsKeyPath(string(map, "tlsKeyPath"))
                .tlsCaPath(string(map, "tlsCaPath"))
                .verifyCertificates(bool(map, "verifyCertificates", true))
                .encryptionKey(string(map, "encryptionKey"))
                .build();
    }

    /**
     * Reads {@code REDIS_*} variables. Returns {@code null} when none of the security
     * variables are set.
     */
    public static SecurityConfig fromEnvironment(Map<String, String> env) {
        boolean configured = List.of("REDIS_AUTH", "REDIS_USE_TLS", "REDIS_ACL_USERNAME", "REDIS_ACL_PASSWORD",
                        "REDIS_ENCRYPTION_KEY")
                .stream().anyMatch(name -> notBlank(env.get(name)));
        if (!configured) {
            return null;
        }
        return SecurityConfig.builder()
                .authPassword(env.get("REDIS_AUTH"))
                .aclUsername(env.get("REDIS_ACL_USERNAME"))
                .aclPassword(env.get("REDIS_ACL_PASSWORD"))
                .tlsEnabled(parseBoolean("REDIS_USE_TLS", env.get("REDIS_USE_TLS"), false))
                .tlsCertPath(env.get("REDIS_TLS_CERT_PATH"))
                .tlsKeyPath(env.get("REDIS_TLS_KEY_PATH"))
                .tlsCaPath(env.get("REDIS_TLS_CA_PATH"))
                .verifyCertificates(parseBoolean("REDIS_VERIFY_CERTIFICATES", env.get("REDIS_VERIFY_CERTIFICATES"), true))
                .encryptionKey(env.get("REDIS_ENCRYPTION_KEY"))
                .build();
    }

    public static boolean parseBoolean(String field, String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> throw new ConfigurationException(field + ": expected a boolean, got '" + value + "'");
        };
    }

    private static void checkTlsPath(ValidationResult.ValidationResultBuilder result, String field, String path) {
        if (!notBlank(path)) {
            result.error("securityConfig." + field + ": required when TLS is enabled");
        } else if (!Files.exists(Path.of(path))) {
            result.error("securityConfig." + field + ": file not found: " + path);
        }
    }

    private void checkEncryptionKey(ValidationResult.ValidationResultBuilder result) {
        try {
            int length = AesGcmEncryptionStrategy.decodeKey(encryptionKey).length;
            if (length != AesGcmEncryptionStrategy.KEY_LENGTH_BYTES) {
                result.error("securityConfig.encryptionKey: must decode to " + AesGcmEncryptionStrategy.KEY_LENGTH_BYTES
                        + " bytes, got " + length);
            }
        } catch (ConfigurationException e) {
            result.error(e.getMessage());
        }
    }

    private static String string(Map<String, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw new ConfigurationException("securityConfig." + key + ": expected a string, got " + value.getClass().getSimpleName());
        }
        return (String) value;
    }

    private static boolean bool(Map<String, ?> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return parseBoolean("securityConfig." + key, (String) value, defaultValue);
        }
        throw new ConfigurationException("securityConfig." + key + ": expected a boolean, got " + value.getClass().getSimpleName());
    }

    private static void putIfPresent(Map<String, Object> map, String key, String value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
