package net.wizeops.tiercache.compression;

public interface CompressionStrategy {
    byte[] compress(byte[] data);

    byte[] decompress(byte[] compressed);

    String getName();
}
