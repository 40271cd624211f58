package com.verityngn.orchestrator.report;

import java.util.List;

/**
 * Report assembly was asked for before every required stage had succeeded.
 * The executor never does this on a healthy path, so it signals a bug.
 */
public class IncompleteInputException extends RuntimeException {

    private final List<String> missingStages;

    public IncompleteInputException(List<String> missingStages) {
        super("Cannot assemble report, missing required stage results: " + missingStages);
        this.missingStages = List.copyOf(missingStages);
    }

    public List<String> getMissingStages() { return missingStages; }
}
