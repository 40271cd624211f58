package com.verityngn.orchestrator.provider;

import java.util.List;

public record EvidenceResult(List<EvidenceItem> items) {

    public EvidenceResult {
        items = items == null ? List.of() : List.copyOf(items);
    }
}
