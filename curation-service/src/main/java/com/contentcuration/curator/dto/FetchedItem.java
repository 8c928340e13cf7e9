package com.contentcuration.curator.dto;

import java.time.LocalDateTime;
import java.util.List;

/**
 * A candidate as delivered by a fetch collaborator, before transcript normalization.
 * Caption lines are the raw cue text, header and timing lines included.
 */
public record FetchedItem(
        String title,
        String url,
        String description,
        List<String> captionLines,
        LocalDateTime uploadedAt,
        Integer durationSeconds
) {
    public FetchedItem {
        captionLines = captionLines != null ? List.copyOf(captionLines) : List.of();
    }

    public boolean hasCaptions() {
        return !captionLines.isEmpty();
    }
}
