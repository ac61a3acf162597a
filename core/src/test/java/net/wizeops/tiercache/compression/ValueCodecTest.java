package net.wizeops.tiercache.compression;

import net.wizeops.tiercache.encryption.AesGcmEncryptionStrategy;
import net.wizeops.tiercache.exceptions.CacheException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ValueCodecTest {

    private final ValueCodec codec = new ValueCodec(1024, new DeflateCompressionStrategy(6));

    @Test
    void shouldLeaveValuesAtOrBelowThresholdUncompressed() {
        // When
        EncodedValue encoded = codec.encode("short");

        // Then
        assertThat(encoded.isCompressed()).isFalse();
        assertThat(encoded.isCompressionAttempted()).isFalse();
        assertThat(codec.decode(encoded.getBytes())).isEqualTo("short");
    }

    @Test
    void shouldCompressRepetitiveValues() {
        // Given
        String value = "abc".repeat(2000);

        // When
        EncodedValue encoded = codec.encode(value);

        // Then
        assertThat(encoded.isCompressed()).isTrue();
        assertThat(encoded.getCompressionRatio()).isLessThan(0.5);
        assertThat(ValueCodec.isCompressed(encoded.getBytes())).isTrue();
        assertThat(codec.decode(encoded.getBytes())).isEqualTo(value);
    }

    @Test
    void shouldStoreRawWhenCompressionFails() {
        // Given
        CompressionStrategy broken = new CompressionStrategy() {
            @Override
            public byte[] compress(byte[] data) {
                throw new IllegalStateException("broken");
            }

            @Override
            public byte[] decompress(byte[] data) {
                throw new IllegalStateException("broken");
            }

            @Override
            public String getName() {
                return "broken";
            }
        };
        ValueCodec failing = new ValueCodec(10, broken);

        // When
        EncodedValue encoded = failing.encode("a value longer than ten bytes");

        // Then
        assertThat(encoded.isCompressed()).isFalse();
        assertThat(encoded.getCompressionRatio()).isNull();
        assertThat(failing.decode(encoded.getBytes())).isEqualTo("a value longer than ten bytes");
    }

    @Test
    void shouldEncryptAfterCompressing() {
        // Given
        ValueCodec encrypting = new ValueCodec(1024, new DeflateCompressionStrategy(6),
                AesGcmEncryptionStrategy.fromBase64(AesGcmEncryptionStrategy.generateKey()));
        String value = "abc".repeat(2000);

        // When
        EncodedValue encoded = encrypting.encode(value);

        // Then
        assertThat(encoded.isCompressed()).isTrue();
        assertThat(encoded.isEncrypted()).isTrue();
        assertThat(encoded.getBytes()[0]).isEqualTo((byte) (ValueCodec.COMPRESSED | ValueCodec.ENCRYPTED));
        assertThat(encoded.getStoredSize()).isLessThan(value.length());
        assertThat(encrypting.decode(encoded.getBytes())).isEqualTo(value);
    }

    @Test
    void shouldRefuseEncryptedValuesWithoutKey() {
        // Given
        ValueCodec encrypting = new ValueCodec(1024, new DeflateCompressionStrategy(6),
                AesGcmEncryptionStrategy.fromBase64(AesGcmEncryptionStrategy.generateKey()));
        byte[] stored = encrypting.encode("secret").getBytes();

        // Then
        assertThat(ValueCodec.isEncrypted(stored)).isTrue();
        assertThat(ValueCodec.isCompressed(stored)).isFalse();
        assertThatThrownBy(() -> codec.decode(stored))
                .isInstanceOf(CacheException.class)
                .hasMessageContaining("no encryption key");
    }

    @Test
    void shouldRejectUnknownHeaders() {
        assertThatThrownBy(() -> codec.decode(new byte[]{7, 1, 2})).isInstanceOf(CacheException.class);
        assertThatThrownBy(() -> codec.decode(new byte[0])).isInstanceOf(CacheException.class);
    }

    @Test
    void shouldRejectInvalidCompressionLevel() {
        assertThatThrownBy(() -> new DeflateCompressionStrategy(10)).isInstanceOf(IllegalArgumentException.class);
    }
}
