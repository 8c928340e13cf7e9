package com.contentcuration.curator.service.digest;

import java.time.LocalDateTime;

/**
 * Trailing selection window, inclusive at both ends.
 */
public record DigestWindow(LocalDateTime start, LocalDateTime end) {

    public DigestWindow {
        if (start == null || end == null || start.isAfter(end)) {
            throw new IllegalArgumentException("Invalid digest window: " + start + " .. " + end);
        }
    }

    public static DigestWindow trailingDays(LocalDateTime now, int days) {
        if (days <= 0) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
        return new DigestWindow(now.minusDays(days), now);
    }

    public boolean contains(LocalDateTime timestamp) {
        return timestamp != null && !timestamp.isBefore(start) && !timestamp.isAfter(end);
    }
}
