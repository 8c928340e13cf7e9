package com.contentcuration.curator.dto;

import java.util.List;

/**
 * Per-item results of one rating batch. Failed items stay unrated for a later run.
 */
public record RatingReport(List<ItemOutcome> outcomes) {

    public RatingReport {
        outcomes = List.copyOf(outcomes);
    }

    public long ratedCount() {
        return outcomes.stream().filter(ItemOutcome::succeeded).count();
    }

    public long failedCount() {
        return outcomes.size() - ratedCount();
    }

    public record ItemOutcome(Long itemId, String title, RatingResult result, String errorCode, String errorMessage) {

        public static ItemOutcome rated(Long itemId, String title, RatingResult result) {
            return new ItemOutcome(itemId, title, result, null, null);
        }

        public static ItemOutcome failed(Long itemId, String title, String errorCode, String errorMessage) {
            return new ItemOutcome(itemId, title, null, errorCode, errorMessage);
        }

        public boolean succeeded() {
            return result != null;
        }
    }
}
