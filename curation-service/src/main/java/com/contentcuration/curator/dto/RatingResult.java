package com.contentcuration.curator.dto;

import com.contentcuration.curator.entity.Rating;

/**
 * Structured outcome of one rating-tool response.
 */
public record RatingResult(Rating rating, String reasoning) {}
