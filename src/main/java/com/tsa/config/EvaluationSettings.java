package com.tsa.config;

import java.time.Duration;

/**
 * Evaluation settings.
 *
 * @param gapToleranceMinutes Longest time an observation stays valid without a successor
 * @param threads             Number of evaluation threads
 */
public record EvaluationSettings(
        int gapToleranceMinutes,
        int threads
) {
    public static EvaluationSettings defaults() {
        return new EvaluationSettings(
                30,          // gapToleranceMinutes
                4            // threads
        );
    }

    public Duration gapTolerance() {
        return Duration.ofMinutes(gapToleranceMinutes);
    }
}
