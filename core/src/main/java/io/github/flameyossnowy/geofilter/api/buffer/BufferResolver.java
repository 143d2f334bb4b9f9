package io.github.flameyossnowy.geofilter.api.buffer;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decides whether a fixed distance or a per-feature expression drives a buffer.
 * <ol>
 *     <li>override inactive: the numeric value wins, any expression is discarded</li>
 *     <li>override active, expression blank: the numeric value</li>
 *     <li>override active, expression is a bare number: that number, no expression</li>
 *     <li>otherwise: the expression verbatim, value forced to zero</li>
 * </ol>
 */
public final class BufferResolver {
    public static final int DECIMALS = 6;

    private BufferResolver() {}

    @NotNull
    public static ResolvedBuffer resolve(@Nullable String expressionText, double numericValue, boolean overrideActive) {
        if (!overrideActive) {
            return new ResolvedBuffer(clean(numericValue), null);
        }

        if (expressionText == null || expressionText.isBlank()) {
            return new ResolvedBuffer(clean(numericValue), null);
        }

        Double literal = parseNumber(expressionText);
        if (literal != null) {
            return new ResolvedBuffer(clean(literal), null);
        }

        return new ResolvedBuffer(0.0, expressionText);
    }

    /**
     * Rounds to {@value #DECIMALS} decimals so float noise from UI spin boxes never reaches SQL.
     */
    public static double clean(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Buffer distance must be finite: " + value);
        }
        return BigDecimal.valueOf(value).setScale(DECIMALS, RoundingMode.HALF_UP).doubleValue();
    }

    @Nullable
    static Double parseNumber(String text) {
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return null;
        }

        char first = trimmed.charAt(0);
        if (!Character.isDigit(first) && first != '-' && first != '+' && first != '.') {
            return null;
        }

        try {
            double value = Double.parseDouble(trimmed);
            return Double.isFinite(value) ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
