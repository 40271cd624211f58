package com.verityngn.orchestrator.progress;

/**
 * Maps (stage index, fraction within stage) to an overall percentage.
 *
 * The value depends only on the stage index and the fraction, never on retry
 * counts, so a retried stage cannot push overall progress backwards once the
 * store applies its max(). 100 is reserved for COMPLETED.
 */
public final class ProgressCalculator {

    static final int MAX_IN_FLIGHT = 99;

    private ProgressCalculator() {}

    public static int overall(int stageIndex, double fraction, int totalStages) {
        if (totalStages <= 0) {
            return 0;
        }
        double f = Double.isNaN(fraction) ? 0.0 : Math.max(0.0, Math.min(1.0, fraction));
        int idx = Math.max(0, Math.min(stageIndex, totalStages));
        int percent = (int) Math.floor((idx + f) * 100.0 / totalStages);
        return Math.min(MAX_IN_FLIGHT, percent);
    }

    /** Progress at the start of stage {@code stageIndex}. */
    public static int stageFloor(int stageIndex, int totalStages) {
        return overall(stageIndex, 0.0, totalStages);
    }
}
