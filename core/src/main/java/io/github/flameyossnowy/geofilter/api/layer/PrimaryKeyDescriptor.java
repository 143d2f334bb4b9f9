package io.github.flameyossnowy.geofilter.api.layer;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.math.BigInteger;
import java.util.Objects;

/**
 * @param name    column name, exactly as cataloged
 * @param numeric whether key values can be rendered unquoted
 */
public record PrimaryKeyDescriptor(@NotNull String name, boolean numeric) {
    public PrimaryKeyDescriptor {
        Objects.requireNonNull(name, "Primary key name cannot be null");
    }

    public static PrimaryKeyDescriptor numeric(String name) {
        return new PrimaryKeyDescriptor(name, true);
    }

    public static PrimaryKeyDescriptor text(String name) {
        return new PrimaryKeyDescriptor(name, false);
    }

    /**
     * Brings a key value read from any store to one representation: integral numbers of a
     * numeric key become {@code Long}, everything else of a text key becomes {@code String}.
     */
    @Nullable
    public Object normalize(@Nullable Object value) {
        if (value == null) {
            return null;
        }
        if (!numeric) {
            return value.toString();
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big) {
            return big.longValueExact();
        }
        if (value instanceof Number) {
            return value;
        }
        return Long.parseLong(value.toString().trim());
    }
}
