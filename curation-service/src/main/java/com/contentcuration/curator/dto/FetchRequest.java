package com.contentcuration.curator.dto;

import java.time.Duration;

/**
 * Lookback window, item cap and time bound handed to a fetch collaborator.
 */
public record FetchRequest(int daysBack, int maxItems, Duration timeout) {}
