package net.wizeops.tiercache.compression;

import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.config.CacheConfig;
import net.wizeops.tiercache.encryption.AesGcmEncryptionStrategy;
import net.wizeops.tiercache.encryption.EncryptionStrategy;
import net.wizeops.tiercache.exceptions.CacheException;
import net.wizeops.tiercache.security.SecurityConfig;
import net.wizeops.tiercache.utils.CacheUtil;

import java.util.Arrays;

/**
 * Turns cache values into remote-tier bytes and back.
 * <p>
 * Layout: one header byte of flags ({@link #COMPRESSED}, {@link #ENCRYPTED}, or
 * {@link #RAW} for neither) followed by the serialized value. Values larger than the
 * threshold are compressed; the compressed form is kept only when it is smaller. When an
 * encryption strategy is present the payload is encrypted after compression.
 */
@Slf4j
public class ValueCodec {
    public static final byte RAW = 0;
    public static final byte COMPRESSED = 1;
    public static final byte ENCRYPTED = 2;

    private static final int KNOWN_FLAGS = COMPRESSED | ENCRYPTED;

    private final int compressionThresholdBytes;
    private final CompressionStrategy compression;
    private final EncryptionStrategy encryption;

    public ValueCodec(int compressionThresholdBytes, CompressionStrategy compression) {
        this(compressionThresholdBytes, compression, null);
    }

    /**
     * @param encryption may be null, values are then stored in plaintext
     */
    public ValueCodec(int compressionThresholdBytes, CompressionStrategy compression, EncryptionStrategy encryption) {
        this.compressionThresholdBytes = compressionThresholdBytes;
        this.compression = compression;
        this.encryption = encryption;
    }

    /**
     * Deflate at the configured level, encrypting with the configured key when there is one.
     */
    public static ValueCodec forConfig(CacheConfig config) {
        SecurityConfig security = config.getSecurityConfig();
        EncryptionStrategy encryption = security != null && security.hasEncryption()
                ? AesGcmEncryptionStrategy.fromBase64(security.getEncryptionKey())
                : null;
        return new ValueCodec(config.getCompressionThresholdBytes(),
                new DeflateCompressionStrategy(config.getCompressionLevel()), encryption);
    }

    public EncodedValue encode(Object value) {
        byte[] serialized = CacheUtil.serialize(value);
        if (serialized.length <= compressionThresholdBytes) {
            return seal(serialized, serialized.length, false, null);
        }

        byte[] compressed;
        try {
            compressed = compression.compress(serialized);
        } catch (RuntimeException e) {
            log.warn("Compression with {} failed, storing {} bytes uncompressed", compression.getName(), serialized.length, e);
            return seal(serialized, serialized.length, false, null);
        }

        double ratio = (double) compressed.length / serialized.length;
        if (compressed.length >= serialized.length) {
            log.debug("Compression did not shrink a {} byte value, storing it uncompressed", serialized.length);
            return seal(serialized, serialized.length, false, ratio);
        }
        return seal(compressed, serialized.length, true, ratio);
    }

    public Object decode(byte[] stored) {
        if (stored == null || stored.length == 0) {
            throw new CacheException("Empty cache value");
        }
        byte header = stored[0];
        if ((header & ~KNOWN_FLAGS) != 0) {
            throw new CacheException("Unknown cache value header " + header);
        }
        byte[] payload = Arrays.copyOfRange(stored, 1, stored.length);
        if ((header & ENCRYPTED) != 0) {
            if (encryption == null) {
                throw new CacheException("Cache value is encrypted but no encryption key is configured");
            }
            payload = encryption.decrypt(payload);
        }
        if ((header & COMPRESSED) != 0) {
            payload = compression.decompress(payload);
        }
        return CacheUtil.deserialize(payload);
    }

    public static boolean isCompressed(byte[] stored) {
        return stored != null && stored.length > 0 && (stored[0] & COMPRESSED) != 0;
    }

    public static boolean isEncrypted(byte[] stored) {
        return stored != null && stored.length > 0 && (stored[0] & ENCRYPTED) != 0;
    }

    public boolean isEncryptionEnabled() {
        return encryption != null;
    }

    public int getCompressionThresholdBytes() {
        return compressionThresholdBytes;
    }

    private EncodedValue seal(byte[] payload, long originalSize, boolean compressed, Double ratio) {
        byte header = compressed ? COMPRESSED : RAW;
        if (encryption != null) {
            payload = encryption.encrypt(payload);
            header |= ENCRYPTED;
        }
        return new EncodedValue(withHeader(header, payload), originalSize, compressed, encryption != null, ratio);
    }

    private static byte[] withHeader(byte header, byte[] payload) {
        byte[] result = new byte[payload.length + 1];
        result[0] = header;
        System.arraycopy(payload, 0, result, 1, payload.length);
        return result;
    }
}
