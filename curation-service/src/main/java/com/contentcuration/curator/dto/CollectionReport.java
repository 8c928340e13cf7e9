package com.contentcuration.curator.dto;

import java.util.List;

public record CollectionReport(List<FetchOutcome> outcomes) {

    public CollectionReport {
        outcomes = List.copyOf(outcomes);
    }

    public int totalNew() {
        return outcomes.stream().mapToInt(FetchOutcome::newCount).sum();
    }

    public int totalSkipped() {
        return outcomes.stream().mapToInt(FetchOutcome::skippedCount).sum();
    }
}
