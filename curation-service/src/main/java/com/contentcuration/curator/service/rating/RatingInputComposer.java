package com.contentcuration.curator.service.rating;

import com.contentcuration.curator.config.CuratorProperties;
import com.contentcuration.curator.entity.ContentItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the text sent to the rating tool: title, truncated description, transcript.
 */
@Component
@RequiredArgsConstructor
public class RatingInputComposer {

    private final CuratorProperties properties;

    public String compose(ContentItem item) {
        List<String> parts = new ArrayList<>();
        parts.add("Title: " + item.getTitle());

        String description = item.getDescription();
        if (description != null && !description.isBlank()) {
            int limit = properties.getRating().getDescriptionChars();
            parts.add("Description: " + (description.length() > limit ? description.substring(0, limit) : description));
        }

        String transcript = item.getTranscript();
        if (transcript != null && !transcript.isBlank()) {
            parts.add("Transcript: " + transcript);
        }

        return String.join("\n\n", parts);
    }
}
