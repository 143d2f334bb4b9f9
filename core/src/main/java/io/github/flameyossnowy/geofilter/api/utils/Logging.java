package io.github.flameyossnowy.geofilter.api.utils;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Small logging facade over SLF4J.
 * <p>
 * {@link #ENABLED} gates informational output, {@link #DEEP} additionally gates the
 * per-row and per-cache-lookup chatter. Warnings and errors are always forwarded.
 */
public final class Logging {
    private static final Logger LOGGER = LoggerFactory.getLogger("geofilter");

    public static volatile boolean ENABLED = false;
    public static volatile boolean DEEP = false;

    private Logging() {}

    public static void info(@NotNull Supplier<String> message) {
        if (ENABLED && LOGGER.isInfoEnabled()) {
            LOGGER.info(message.get());
        }
    }

    public static void info(String message) {
        if (ENABLED) {
            LOGGER.info(message);
        }
    }

    public static void deepInfo(@NotNull Supplier<String> message) {
        if (ENABLED && DEEP && LOGGER.isDebugEnabled()) {
            LOGGER.debug(message.get());
        }
    }

    public static void warn(String message) {
        LOGGER.warn(message);
    }

    public static void warn(String message, Throwable cause) {
        LOGGER.warn(message, cause);
    }

    public static void error(String message) {
        LOGGER.error(message);
    }

    public static void error(String message, Throwable cause) {
        LOGGER.error(message, cause);
    }
}
