package net.wizeops.tiercache.encryption;

import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.exceptions.CacheException;
import net.wizeops.tiercache.exceptions.ConfigurationException;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.nio.ByteBuffer;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;

/**
 * AES-256-GCM with a random IV per value.
 * <p>
 * Output layout: {@code [IV (12 bytes)][ciphertext][auth tag (16 bytes)]}. The tag makes
 * tampered or foreign values fail to decrypt instead of deserializing garbage.
 */
@Slf4j
public class AesGcmEncryptionStrategy implements EncryptionStrategy {
    public static final int KEY_LENGTH_BYTES = 32;

    private static final String ALGORITHM = "AES/GCM/NoPadding";
    private static final int IV_LENGTH = 12;
    private static final int TAG_LENGTH_BITS = 128;

    private final SecretKey secretKey;
    private final SecureRandom secureRandom = new SecureRandom();

    public AesGcmEncryptionStrategy(byte[] key) {
        if (key == null || key.length != KEY_LENGTH_BYTES) {
            throw new ConfigurationException("securityConfig.encryptionKey: must be " + KEY_LENGTH_BYTES
                    + " bytes, got " + (key == null ? 0 : key.length));
        }
        this.secretKey = new SecretKeySpec(key, "AES");
    }

    /**
     * @throws ConfigurationException when the key is not Base64 or not 256 bits long
     */
    public static AesGcmEncryptionStrategy fromBase64(String encodedKey) {
        return new AesGcmEncryptionStrategy(decodeKey(encodedKey));
    }

    public static byte[] decodeKey(String encodedKey) {
        if (encodedKey == null || encodedKey.isBlank()) {
            throw new ConfigurationException("securityConfig.encryptionKey: must not be blank");
        }
        try {
            return Base64.getDecoder().decode(encodedKey.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("securityConfig.encryptionKey: not valid Base64", e);
        }
    }

    /**
     * New random key, Base64 encoded, for initial setup.
     */
    public static String generateKey() {
        byte[] key = new byte[KEY_LENGTH_BYTES];
        new SecureRandom().nextBytes(key);
        return Base64.getEncoder().encodeToString(key);
    }

    @Override
    public byte[] encrypt(byte[] data) {
        try {
            byte[] iv = new byte[IV_LENGTH];
            secureRandom.nextBytes(iv);
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, iv));
            byte[] ciphertext = cipher.doFinal(data);
            return ByteBuffer.allocate(IV_LENGTH + ciphertext.length).put(iv).put(ciphertext).array();
        } catch (GeneralSecurityException e) {
            throw new CacheException("Failed to encrypt cache value", e);
        }
    }

    @Override
    public byte[] decrypt(byte[] data) {
        if (data.length < IV_LENGTH + TAG_LENGTH_BITS / 8) {
            throw new CacheException("Encrypted cache value is truncated (" + data.length + " bytes)");
        }
        try {
            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_LENGTH_BITS, data, 0, IV_LENGTH));
            return cipher.doFinal(data, IV_LENGTH, data.length - IV_LENGTH);
        } catch (GeneralSecurityException e) {
            log.debug("Decryption of a {} byte cache value failed", data.length, e);
            throw new CacheException("Failed to decrypt cache value, was it written with a different key?", e);
        }
    }

    @Override
    public String getName() {
        return "aes-256-gcm";
    }
}
