package com.lohika.morning.risk.spark.driver.orchestrator;

/**
 * Decides whether the deployed model has drifted. A working score equal to the baseline is not drift.
 */
public final class DriftPolicy {

    private DriftPolicy() {
    }

    public static boolean isDrift(double baselineScore, double workingScore) {
        return workingScore < baselineScore;
    }
}
