package com.locksmith.lease;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Utility class shared by the locksmith client.
 * <p>
 * Holds the package logger and the environment driven defaults.
 * </p>
 */
public final class LocksmithUtils {

    /**
     * Logger instance for lease lifecycle events and errors.
     */
    @SuppressWarnings("all")
    static final Logger LOGGER = LoggerFactory.getLogger(Locksmith.class.getName());

    // Environment variable key for overriding the default round-trip timeout in milliseconds.
    public static final String SOCKET_TIMEOUT_MILLIS_KEY = "LOCKSMITH_SOCKET_TIMEOUT_MILLIS";

    // Default round-trip timeout in milliseconds if no environment variable is provided.
    public static final long DEFAULT_SOCKET_TIMEOUT_MILLIS = 1000;

    // Minimum allowable round-trip timeout in milliseconds.
    static final long MIN_SOCKET_TIMEOUT_MILLIS = 100;

    private LocksmithUtils() {
    }

    /**
     * Retrieves the effective round-trip timeout in milliseconds.
     * <p>
     * The value of the {@code LOCKSMITH_SOCKET_TIMEOUT_MILLIS} environment variable is used when set,
     * raised to {@link #MIN_SOCKET_TIMEOUT_MILLIS} if needed. Invalid content is logged and the default is used.
     * </p>
     *
     * @return the effective round-trip timeout in milliseconds.
     */
    public static long getEffectiveSocketTimeoutMillis() {
        return getEffectiveMillis(SOCKET_TIMEOUT_MILLIS_KEY, DEFAULT_SOCKET_TIMEOUT_MILLIS, MIN_SOCKET_TIMEOUT_MILLIS);
    }

    /**
     * Reads a duration in milliseconds from an environment variable.
     *
     * @param key           the environment variable name.
     * @param defaultMillis the value used when the variable is not set or cannot be parsed.
     * @param minMillis     the lower bound applied to a parsed value.
     * @return the effective value in milliseconds.
     */
    public static long getEffectiveMillis(String key, long defaultMillis, long minMillis) {
        long effectiveMillis = defaultMillis;
        try {
            var envValue = System.getenv(key);
            if (envValue != null) {
                effectiveMillis = Math.max(Long.parseLong(envValue.trim()), minMillis);
            }
        } catch (RuntimeException ex) {
            LOGGER.error("Could not parse `" + key + "' environment variable content", ex);
        }
        return effectiveMillis;
    }

    /**
     * Reads a non-blank string from an environment variable.
     *
     * @param key          the environment variable name.
     * @param defaultValue the value used when the variable is not set or blank.
     * @return the effective value.
     */
    public static String getEffectiveString(String key, String defaultValue) {
        var envValue = System.getenv(key);
        return envValue == null || envValue.isBlank() ? defaultValue : envValue.trim();
    }

    /**
     * Converts a duration to the fractional seconds used on the wire, with millisecond precision.
     *
     * @param duration the duration.
     * @param unit     the unit of {@code duration}.
     * @return the duration in seconds.
     */
    static double toSeconds(long duration, TimeUnit unit) {
        return unit.toMillis(duration) / 1000.0;
    }

}
