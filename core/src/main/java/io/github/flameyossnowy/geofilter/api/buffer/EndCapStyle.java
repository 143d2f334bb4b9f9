package io.github.flameyossnowy.geofilter.api.buffer;

import java.util.Locale;

public enum EndCapStyle {
    ROUND,
    FLAT,
    SQUARE;

    /**
     * Keyword used in buffer style parameters, e.g. {@code endcap=flat}.
     */
    public String keyword() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Host-side numeric code: 0 round, 1 flat, 2 square.
     */
    public static EndCapStyle fromCode(int code) {
        return switch (code) {
            case 0 -> ROUND;
            case 1 -> FLAT;
            case 2 -> SQUARE;
            default -> throw new IllegalArgumentException("Unknown end cap style code: " + code);
        };
    }
}
