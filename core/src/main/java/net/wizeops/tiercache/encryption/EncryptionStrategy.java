package net.wizeops.tiercache.encryption;

/**
 * Reversible transform applied to values before they leave the process.
 */
public interface EncryptionStrategy {
    byte[] encrypt(byte[] data);

    byte[] decrypt(byte[] data);

    String getName();
}
