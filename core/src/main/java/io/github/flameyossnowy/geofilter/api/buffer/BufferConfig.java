package io.github.flameyossnowy.geofilter.api.buffer;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Buffer settings of a filter request.
 * <p>
 * When {@code expression} is non-null it is the live driver and {@code distance} is zero.
 * A negative distance erodes and is passed to the buffer call unchanged.
 */
public record BufferConfig(
    double distance,
    @Nullable String expression,
    boolean active,
    int segments,
    @NotNull EndCapStyle endCapStyle,
    @NotNull JoinStyle joinStyle
) {
    public static final int DEFAULT_SEGMENTS = 5;

    private static final BufferConfig NONE = new BufferConfig(0.0, null, false, DEFAULT_SEGMENTS, EndCapStyle.ROUND, JoinStyle.ROUND);

    public BufferConfig {
        Objects.requireNonNull(endCapStyle, "End cap style cannot be null");
        Objects.requireNonNull(joinStyle, "Join style cannot be null");
        if (segments < 1) {
            throw new IllegalArgumentException("Buffer segments must be positive: " + segments);
        }
        if (expression != null && distance != 0.0) {
            throw new IllegalArgumentException("A buffer expression and a non-zero distance cannot both be live");
        }
    }

    public static BufferConfig none() {
        return NONE;
    }

    public static BufferConfig distance(double distance) {
        return new BufferConfig(BufferResolver.clean(distance), null, true, DEFAULT_SEGMENTS, EndCapStyle.ROUND, JoinStyle.ROUND);
    }

    /**
     * Builds a config from raw host inputs through {@link BufferResolver}.
     */
    public static BufferConfig resolve(
        @Nullable String expressionText,
        double numericValue,
        boolean overrideActive,
        int segments,
        @NotNull EndCapStyle endCapStyle,
        @NotNull JoinStyle joinStyle
    ) {
        ResolvedBuffer resolved = BufferResolver.resolve(expressionText, numericValue, overrideActive);
        boolean active = resolved.expressionLive() || resolved.value() != 0.0;
        return new BufferConfig(resolved.value(), resolved.expression(), active, segments, endCapStyle, joinStyle);
    }

    public BufferConfig withSegments(int segments) {
        return new BufferConfig(distance, expression, active, segments, endCapStyle, joinStyle);
    }

    public BufferConfig withEndCapStyle(@NotNull EndCapStyle endCapStyle) {
        return new BufferConfig(distance, expression, active, segments, endCapStyle, joinStyle);
    }

    public BufferConfig withJoinStyle(@NotNull JoinStyle joinStyle) {
        return new BufferConfig(distance, expression, active, segments, endCapStyle, joinStyle);
    }

    /**
     * Whether a buffer call must be emitted at all.
     */
    public boolean effective() {
        return active && (expression != null || distance != 0.0);
    }

    public boolean dynamic() {
        return active && expression != null;
    }

    public boolean erodes() {
        return effective() && expression == null && distance < 0.0;
    }

    /**
     * Simplification tolerance applied to large sources before buffering: a tenth of the
     * distance, clamped to [0.5, 10]. Uses the absolute distance.
     */
    public double simplifyTolerance() {
        double tolerance = Math.abs(distance) * 0.1;
        return Math.max(0.5, Math.min(10.0, tolerance));
    }

    public BufferExpression parsedExpression() {
        if (expression == null) {
            throw new IllegalStateException("Buffer is driven by a fixed distance");
        }
        return BufferExpression.parse(expression);
    }
}
