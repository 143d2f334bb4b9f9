import io.github.flameyossnowy.geofilter.api.buffer.BufferConfig;
import io.github.flameyossnowy.geofilter.api.buffer.BufferResolver;
import io.github.flameyossnowy.geofilter.api.buffer.EndCapStyle;
import io.github.flameyossnowy.geofilter.api.buffer.JoinStyle;
import io.github.flameyossnowy.geofilter.api.buffer.ResolvedBuffer;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BufferResolverTest {

    @Test
    void inactive_override_keeps_the_numeric_value() {
        ResolvedBuffer resolved = BufferResolver.resolve("dist_field", 75, false);
        assertEquals(75.0, resolved.value());
        assertNull(resolved.expression());
        assertTrue(resolved.distanceLive());
    }

    @Test
    void blank_expression_falls_back_to_the_numeric_value() {
        ResolvedBuffer resolved = BufferResolver.resolve("   ", 12.5, true);
        assertEquals(12.5, resolved.value());
        assertNull(resolved.expression());
    }

    @Test
    void numeric_expression_text_becomes_a_fixed_distance() {
        ResolvedBuffer resolved = BufferResolver.resolve(" -20.5 ", 100, true);
        assertEquals(-20.5, resolved.value());
        assertNull(resolved.expression());
    }

    @Test
    void field_expression_is_kept_verbatim_and_zeroes_the_value() {
        ResolvedBuffer resolved = BufferResolver.resolve("\"width\" * 2", 100, true);
        assertEquals(0.0, resolved.value());
        assertEquals("\"width\" * 2", resolved.expression());
        assertTrue(resolved.expressionLive());
        assertFalse(resolved.distanceLive());
    }

    @Test
    void values_are_rounded_to_six_decimals() {
        assertEquals(0.1, BufferResolver.clean(0.1 + 0.2 - 0.2));
        assertEquals(1.000001, BufferResolver.clean(1.0000005));
        assertThrows(IllegalArgumentException.class, () -> BufferResolver.clean(Double.NaN));
    }

    @Test
    void exactly_one_driver_is_ever_live() {
        Random random = new Random(7);
        String[] expressions = {null, "", " ", "10", "-3.5", "field", "\"a b\" + 1", "1e3", "abc12"};

        for (int i = 0; i < 500; i++) {
            String expression = expressions[random.nextInt(expressions.length)];
            double value = Math.round((random.nextDouble() * 200 - 100) * 1000) / 1000.0;
            boolean override = random.nextBoolean();

            ResolvedBuffer resolved = BufferResolver.resolve(expression, value, override);
            assertFalse(resolved.expressionLive() && resolved.value() != 0.0,
                () -> "both drivers live for " + expression + ", " + value + ", " + override);
        }
    }

    @Test
    void config_is_inactive_without_distance_or_expression() {
        BufferConfig config = BufferConfig.resolve(null, 0, false, 5, EndCapStyle.ROUND, JoinStyle.ROUND);
        assertFalse(config.active());
        assertFalse(config.effective());
    }

    @Test
    void negative_distance_erodes() {
        BufferConfig config = BufferConfig.distance(-10);
        assertTrue(config.effective());
        assertTrue(config.erodes());
        assertFalse(config.dynamic());
    }

    @Test
    void config_rejects_two_live_drivers() {
        assertThrows(IllegalArgumentException.class,
            () -> new BufferConfig(5, "width", true, 5, EndCapStyle.ROUND, JoinStyle.ROUND));
    }

    @Test
    void simplify_tolerance_is_clamped() {
        assertEquals(0.5, BufferConfig.distance(1).simplifyTolerance());
        assertEquals(5.0, BufferConfig.distance(50).simplifyTolerance());
        assertEquals(10.0, BufferConfig.distance(-5000).simplifyTolerance());
    }
}
