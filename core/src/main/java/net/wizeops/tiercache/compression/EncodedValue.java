package net.wizeops.tiercache.compression;

import lombok.Value;

/**
 * Bytes ready for the remote tier plus what the codec did to produce them.
 */
@Value
public class EncodedValue {
    byte[] bytes;
    long originalSize;
    boolean compressed;
    boolean encrypted;
    /** Set when compression was attempted, whether or not it was kept. */
    Double compressionRatio;

    public long getStoredSize() {
        return bytes.length;
    }

    public boolean isCompressionAttempted() {
        return compressionRatio != null;
    }
}
