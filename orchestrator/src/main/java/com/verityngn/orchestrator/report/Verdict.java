package com.verityngn.orchestrator.report;

import java.util.Locale;
import java.util.Optional;

/** Per-claim verdict, strongest true to strongest false. */
public enum Verdict {
    HIGHLY_LIKELY_TRUE,
    LIKELY_TRUE,
    LEANING_TRUE,
    UNCERTAIN,
    LEANING_FALSE,
    LIKELY_FALSE,
    HIGHLY_LIKELY_FALSE;

    /**
     * Map a TRUE / FALSE / UNCERTAIN distribution to a verdict.
     * Inputs are fractions in [0, 1]; the thresholds below are in percent and
     * checked top to bottom, first match wins.
     */
    public static Verdict fromProbabilities(double pTrue, double pFalse, double pUncertain) {
        double t = pTrue * 100;
        double f = pFalse * 100;
        double u = pUncertain * 100;

        if (t > 70 && f < 10)           return HIGHLY_LIKELY_TRUE;
        if (t + u > 65 && f < 35)       return LIKELY_TRUE;
        if (f + u > 65 && t < 35)       return LIKELY_FALSE;
        if (f > 75)                     return HIGHLY_LIKELY_FALSE;
        if (t > 50 && f < 20)           return LIKELY_TRUE;
        if (f > 45 && t < 25)           return LIKELY_FALSE;
        if (t > 40 && f < 35)           return LEANING_TRUE;
        if (f > 35 && t < 30)           return LEANING_FALSE;
        if (Math.abs(t - f) < 10)       return UNCERTAIN;
        return t > f ? LEANING_TRUE : LEANING_FALSE;
    }

    /** Parse a provider label such as "Likely True" or "HIGHLY_LIKELY_FALSE". */
    public static Optional<Verdict> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String key = label.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z]+", "_");
        switch (key) {
            case "TRUE":  return Optional.of(HIGHLY_LIKELY_TRUE);
            case "FALSE": return Optional.of(HIGHLY_LIKELY_FALSE);
            default:
                for (Verdict v : values()) {
                    if (v.name().equals(key)) {
                        return Optional.of(v);
                    }
                }
                return Optional.empty();
        }
    }

    public boolean countsAsTrue() {
        return this == HIGHLY_LIKELY_TRUE || this == LIKELY_TRUE;
    }

    public boolean countsAsFalse() {
        return this == HIGHLY_LIKELY_FALSE || this == LIKELY_FALSE;
    }
}
