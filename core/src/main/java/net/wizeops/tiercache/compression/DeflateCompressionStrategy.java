package net.wizeops.tiercache.compression;

import net.wizeops.tiercache.exceptions.CacheException;

import java.io.ByteArrayOutputStream;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * zlib compression at a fixed level (1 fastest, 9 smallest).
 */
public class DeflateCompressionStrategy implements CompressionStrategy {
    private static final int BUFFER_SIZE = 8192;

    private final int level;

    public DeflateCompressionStrategy(int level) {
        if (level < Deflater.BEST_SPEED || level > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("Compression level must be between 1 and 9, got " + level);
        }
        this.level = level;
    }

    @Override
    public byte[] compress(byte[] data) {
        Deflater deflater = new Deflater(level);
        try {
            deflater.setInput(data);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, data.length / 2));
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!deflater.finished()) {
                int written = deflater.deflate(buffer);
                out.write(buffer, 0, written);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    @Override
    public byte[] decompress(byte[] compressed) {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(compressed);
            ByteArrayOutputStream out = new ByteArrayOutputStream(compressed.length * 3);
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!inflater.finished()) {
                int read = inflater.inflate(buffer);
                if (read == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new CacheException("Truncated compressed cache value");
                }
                out.write(buffer, 0, read);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new CacheException("Corrupted compressed cache value", e);
        } finally {
            inflater.end();
        }
    }

    public int getLevel() {
        return level;
    }

    @Override
    public String getName() {
        return "deflate-" + level;
    }
}
