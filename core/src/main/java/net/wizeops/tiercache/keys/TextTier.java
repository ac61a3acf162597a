package net.wizeops.tiercache.keys;

import java.util.Locale;

/**
 * Size class of a text payload, used to break down key-generation and AI cache metrics.
 */
public enum TextTier {
    SMALL(500),
    MEDIUM(5_000),
    LARGE(50_000),
    XLARGE(Integer.MAX_VALUE);

    private final int upperBoundExclusive;

    TextTier(int upperBoundExclusive) {
        this.upperBoundExclusive = upperBoundExclusive;
    }

    public static TextTier of(int length) {
        for (TextTier tier : values()) {
            if (length < tier.upperBoundExclusive) {
                return tier;
            }
        }
        return XLARGE;
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
