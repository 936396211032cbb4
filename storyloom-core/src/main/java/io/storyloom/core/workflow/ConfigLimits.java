package io.storyloom.core.workflow;

import java.util.logging.Logger;

/// Numeric bounds shared by the configuration validator and the run-time clamps.
public final class ConfigLimits {

    private static final Logger logger = Logger.getLogger(ConfigLimits.class.getName());

    public static final int MIN_ITERATIONS = 1;
    public static final int MAX_ITERATIONS = 50;
    public static final int MIN_CONCURRENCY = 1;
    public static final int MAX_CONCURRENCY = 10;
    public static final int DEFAULT_CONCURRENCY = 3;
    public static final int MIN_RETRY = 0;
    public static final int MAX_RETRY = 5;

    private ConfigLimits() {}

    public static boolean inRange(int value, int min, int max) {
        return value >= min && value <= max;
    }

    /// Clamps a value into `[min, max]`, logging a warning when it had to move.
    ///
    /// @param what human-readable name of the setting, used in the log message
    public static int clamp(String what, int value, int min, int max) {
        if (value < min || value > max) {
            int clamped = Math.max(min, Math.min(max, value));
            logger.warning(
                    what + " " + value + " outside [" + min + ", " + max + "], using " + clamped);
            return clamped;
        }
        return value;
    }
}
