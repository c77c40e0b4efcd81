package io.rollcron.core;

import java.util.Locale;

/**
 * What happens when a job's trigger fires while a previous run of the same job is still executing.
 */
public enum Concurrency {
    /** Drop the new trigger. */
    SKIP,
    /** Start the new trigger right after the in-flight run ends; at most one trigger is kept. */
    QUEUE,
    /** Start the new trigger immediately alongside the in-flight run. */
    PARALLEL;

    public static Concurrency parse(String value) {
        if (value == null || value.isBlank()) {
            return SKIP;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "skip" -> SKIP;
            case "queue", "wait" -> QUEUE;
            case "parallel", "allow" -> PARALLEL;
            default -> throw new IllegalArgumentException(
                    "Unknown concurrency '" + value + "' (expected skip, queue or parallel)");
        };
    }
}
