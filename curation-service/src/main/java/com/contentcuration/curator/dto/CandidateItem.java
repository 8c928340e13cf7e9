package com.contentcuration.curator.dto;

import java.time.LocalDateTime;

/**
 * A fetched item ready for ingestion: transcript normalized, description bounded.
 */
public record CandidateItem(
        String title,
        String url,
        String description,
        String transcript,
        LocalDateTime publishedDate,
        Integer durationMinutes
) {}
