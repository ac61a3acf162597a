package net.wizeops.tiercache.keys;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.wizeops.tiercache.exceptions.ValidationException;
import net.wizeops.tiercache.monitoring.MeasurementContext;
import net.wizeops.tiercache.monitoring.OperationCategory;
import net.wizeops.tiercache.monitoring.PerformanceMonitor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builds deterministic cache keys of the form
 * {@code operation:txt=<text>|hash=<digest>:opts=<digest>[:q=<question>|qhash=<digest>]}.
 * <p>
 * Text up to {@link #getTextHashThreshold()} characters is embedded verbatim, longer
 * text is streamed through SHA-256. Instances hold no mutable state and are safe to
 * share between threads.
 */
@Slf4j
public class KeyGenerator {
    public static final int DEFAULT_TEXT_HASH_THRESHOLD = 1000;
    public static final String QA_OPERATION = "qa";
    public static final String QUESTION_OPTION = "question";

    static final int CHUNK_SIZE = 8192;
    private static final int TEXT_DIGEST_LENGTH = 32;
    private static final int OPTIONS_DIGEST_LENGTH = 16;

    static final String NULL_OPTION_KEY = "null";

    private static final ObjectMapper CANONICAL_MAPPER = canonicalMapper();

    @Getter
    private final int textHashThreshold;
    private final PerformanceMonitor monitor;

    public KeyGenerator() {
        this(DEFAULT_TEXT_HASH_THRESHOLD, null);
    }

    public KeyGenerator(int textHashThreshold) {
        this(textHashThreshold, null);
    }

    public KeyGenerator(int textHashThreshold, PerformanceMonitor monitor) {
        if (textHashThreshold < 1) {
            throw new IllegalArgumentException("textHashThreshold must be positive");
        }
        this.textHashThreshold = textHashThreshold;
        this.monitor = PerformanceMonitor.orNoop(monitor);
    }

    public String generateKey(String operation, String text, Map<String, ?> options) {
        return generateKey(operation, text, options, null);
    }

    /**
     * @param question explicit question; when {@code null} and the operation is {@code qa},
     *                 the {@code question} entry of {@code options} is used instead. When both
     *                 are given and differ, the option stays part of the options digest.
     */
    public String generateKey(String operation, String text, Map<String, ?> options, String question) {
        if (operation == null || operation.isBlank()) {
            throw new ValidationException("operation", "must not be blank");
        }
        if (text == null) {
            throw new ValidationException("text", "must not be null");
        }
        long start = System.nanoTime();

        Map<String, Object> remaining = options != null ? new HashMap<>(options) : new HashMap<>();
        Object optionQuestion = remaining.remove(QUESTION_OPTION);
        if (optionQuestion != null) {
            if (!QA_OPERATION.equals(operation)) {
                remaining.put(QUESTION_OPTION, optionQuestion);
            } else if (question == null) {
                question = String.valueOf(optionQuestion);
            } else if (!question.equals(String.valueOf(optionQuestion))) {
                remaining.put(QUESTION_OPTION, optionQuestion);
            }
        }

        StringBuilder key = new StringBuilder(operation)
                .append(':')
                .append(textComponent("txt", "hash", text))
                .append(":opts=")
                .append(optionsDigest(remaining));
        if (question != null) {
            key.append(':').append(textComponent("q", "qhash", question));
        }

        report(operation, text.length(), Duration.ofNanos(System.nanoTime() - start));
        return key.toString();
    }

    public boolean shouldHash(String text) {
        return text.length() > textHashThreshold;
    }

    /**
     * SHA-256 hex digest of {@code text}, fed to the digest in fixed size chunks followed by
     * a length marker.
     */
    public static String streamingDigest(String text) {
        MessageDigest digest = sha256();
        int length = text.length();
        int offset = 0;
        while (offset < length) {
            int end = Math.min(offset + CHUNK_SIZE, length);
            if (end < length && Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            digest.update(text.substring(offset, end).getBytes(StandardCharsets.UTF_8));
            offset = end;
        }
        digest.update(("|len=" + length).getBytes(StandardCharsets.UTF_8));
        return toHex(digest.digest());
    }

    private String textComponent(String embeddedPrefix, String hashedPrefix, String text) {
        if (shouldHash(text)) {
            return hashedPrefix + "=" + streamingDigest(text).substring(0, TEXT_DIGEST_LENGTH);
        }
        return embeddedPrefix + "=" + sanitize(text);
    }

    static String sanitize(String text) {
        return text.replace(':', '_').replace('|', '_');
    }

    static String optionsDigest(Map<String, Object> options) {
        String canonical = canonicalJson(options);
        MessageDigest digest = sha256();
        digest.update(canonical.getBytes(StandardCharsets.UTF_8));
        return toHex(digest.digest()).substring(0, OPTIONS_DIGEST_LENGTH);
    }

    /**
     * Sorted-key JSON of the options. A {@code null} key is written as {@code "null"}. Options
     * Jackson cannot write fall back to their string forms sorted by key.
     */
    static String canonicalJson(Map<String, Object> options) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(options);
        } catch (JsonProcessingException e) {
            log.debug("Options are not JSON serializable, falling back to their string form", e);
            Map<String, String> sorted = new TreeMap<>();
            options.forEach((name, value) -> sorted.put(String.valueOf(name), String.valueOf(value)));
            return sorted.toString();
        }
    }

    private static ObjectMapper canonicalMapper() {
        ObjectMapper mapper = new ObjectMapper()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.getSerializerProvider().setNullKeySerializer(new JsonSerializer<Object>() {
            @Override
            public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                gen.writeFieldName(NULL_OPTION_KEY);
            }
        });
        return mapper;
    }

    private void report(String operation, int textLength, Duration duration) {
        try {
            monitor.record(OperationCategory.KEY_GENERATION, duration, MeasurementContext.builder()
                    .operation(operation)
                    .textLength(textLength)
                    .textTier(TextTier.of(textLength).getValue())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Performance monitor rejected key generation measurement for {}", operation, e);
        }
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder hex = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            hex.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        }
        return hex.toString();
    }
}
