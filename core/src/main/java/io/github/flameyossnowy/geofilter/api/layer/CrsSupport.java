package io.github.flameyossnowy.geofilter.api.layer;

import org.jetbrains.annotations.NotNull;

import java.util.Locale;
import java.util.Set;

public final class CrsSupport {
    public static final int WEB_MERCATOR = 3857;
    public static final int WGS84 = 4326;

    // Geographic 2D and 3D systems (degrees). The 4000 range also holds projected and
    // geocentric systems such as 4087 and 4978, so membership is explicit.
    private static final Set<Integer> GEOGRAPHIC = Set.of(
        4019, 4030, 4047, 4052, 4055, 4148, 4152, 4167, 4171, 4190, 4202, 4203, 4204, 4210,
        4214, 4230, 4231, 4236, 4240, 4242, 4244, 4248, 4258, 4267, 4269, 4272, 4275, 4277,
        4283, 4284, 4289, 4291, 4301, 4312, 4313, 4314, 4322, 4324, 4326, 4490, 4612, 4617,
        4619, 4623, 4624, 4659, 4670, 4674, 4678, 4686, 4687, 4755, 4818, 4937, 4979
    );

    private CrsSupport() {}

    /**
     * Parses {@code EPSG:4326}, {@code epsg:4326} or a bare {@code 4326}.
     */
    public static int srid(@NotNull String crsCode) {
        String code = crsCode.trim();
        int colon = code.lastIndexOf(':');
        if (colon >= 0) {
            String authority = code.substring(0, colon).toUpperCase(Locale.ROOT);
            if (!authority.equals("EPSG")) {
                throw new IllegalArgumentException("Unsupported CRS authority: " + crsCode);
            }
            code = code.substring(colon + 1);
        }

        try {
            return Integer.parseInt(code);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed CRS code: " + crsCode, e);
        }
    }

    public static String code(int srid) {
        return "EPSG:" + srid;
    }

    /**
     * Whether coordinates of this CRS are in degrees. Buffers must never be computed in such a system.
     */
    public static boolean isGeographic(int srid) {
        return GEOGRAPHIC.contains(srid);
    }
}
