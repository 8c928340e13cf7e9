package com.contentcuration.curator.dto;

import com.contentcuration.curator.entity.Source;

/**
 * Result of one source's fetch pass.
 */
public record FetchOutcome(
        Long sourceId,
        String sourceName,
        Status status,
        int newCount,
        int skippedCount,
        String errorMessage
) {

    public enum Status {
        COMPLETED,
        NOT_SUPPORTED,
        TIMED_OUT,
        FAILED
    }

    public static FetchOutcome completed(Source source, IngestionResult result) {
        return new FetchOutcome(source.getId(), source.getName(), Status.COMPLETED,
                result.newCount(), result.skippedCount(), null);
    }

    public static FetchOutcome notSupported(Source source) {
        return new FetchOutcome(source.getId(), source.getName(), Status.NOT_SUPPORTED, 0, 0,
                "No fetcher registered for source type " + source.getType().getValue());
    }

    public static FetchOutcome timedOut(Source source, String errorMessage) {
        return new FetchOutcome(source.getId(), source.getName(), Status.TIMED_OUT, 0, 0, errorMessage);
    }

    public static FetchOutcome failed(Source source, String errorMessage) {
        return new FetchOutcome(source.getId(), source.getName(), Status.FAILED, 0, 0, errorMessage);
    }
}
