package com.contentcuration.curator.dto;

/**
 * Counts of one ingestion pass. Duplicates, including late constraint violations, are skipped.
 */
public record IngestionResult(int newCount, int skippedCount, int failedCount) {}
