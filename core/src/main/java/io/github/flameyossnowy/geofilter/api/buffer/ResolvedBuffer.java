package io.github.flameyossnowy.geofilter.api.buffer;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of {@link BufferResolver#resolve}. Exactly one of the two fields drives buffering:
 * the expression when it is non-null, the value otherwise.
 */
public record ResolvedBuffer(double value, @Nullable String expression) {
    public boolean expressionLive() {
        return expression != null;
    }

    public boolean distanceLive() {
        return expression == null;
    }
}
