package net.wizeops.tiercache.utils;

import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.exceptions.CacheException;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.Serializable;

@Slf4j
public final class CacheUtil {

    private CacheUtil() {
    }

    public static byte[] serialize(Object value) {
        if (!(value instanceof Serializable)) {
            throw new CacheException("Cache value of type " + value.getClass().getName() + " is not Serializable");
        }
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             ObjectOutputStream oos = new ObjectOutputStream(baos)) {
            oos.writeObject(value);
            oos.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new CacheException("Failed to serialize cache value", e);
        }
    }

    public static Object deserialize(byte[] bytes) {
        try (ByteArrayInputStream bais = new ByteArrayInputStream(bytes);
             ObjectInputStream ois = new ObjectInputStream(bais)) {
            return ois.readObject();
        } catch (IOException | ClassNotFoundException e) {
            throw new CacheException("Failed to deserialize cache value", e);
        }
    }

    public static long estimateObjectSize(Object obj) {
        if (obj == null) {
            return 0;
        }
        if (obj instanceof byte[]) {
            return ((byte[]) obj).length;
        }
        if (obj instanceof String) {
            return 24 + ((String) obj).length() * 2L;
        }
        if (obj instanceof Serializable) {
            try {
                return serialize(obj).length;
            } catch (CacheException e) {
                log.debug("Could not estimate object size accurately, using default estimation", e);
            }
        }
        return estimateSizeByClass(obj);
    }

    private static long estimateSizeByClass(Object obj) {
        if (obj instanceof Number) {
            return 16;
        } else if (obj instanceof Boolean) {
            return 1;
        } else if (obj.getClass().isArray()) {
            int length = java.lang.reflect.Array.getLength(obj);
            return 16 + ((long) length * 8);
        }
        return 32;
    }
}
