package com.contentcuration.curator.service.digest;

import com.contentcuration.curator.entity.ContentItem;
import com.contentcuration.curator.entity.Rating;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * Obsidian-flavoured markdown: heading, counts, then one section per tier.
 */
@Component
public class MarkdownDigestRenderer implements DigestRenderer {

    private static final DateTimeFormatter DAY = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final String UNKNOWN_SOURCE = "Unknown source";

    @Override
    public String render(List<ContentItem> items, Map<Long, String> sourceNames, LocalDate date) {
        int sCount = DigestSelector.countTier(items, Rating.S);
        int aCount = DigestSelector.countTier(items, Rating.A);

        StringBuilder md = new StringBuilder();
        md.append("# Curated Digest ").append(date.format(DAY)).append("\n\n");
        md.append("**").append(items.size()).append(" item(s)**: ")
                .append(sCount).append(" S-tier, ")
                .append(aCount).append(" A-tier\n");

        appendSection(md, "S-Tier", Rating.S, items, sourceNames);
        appendSection(md, "A-Tier", Rating.A, items, sourceNames);
        return md.toString();
    }

    private void appendSection(StringBuilder md, String heading, Rating tier,
                               List<ContentItem> items, Map<Long, String> sourceNames) {
        List<ContentItem> tierItems = items.stream().filter(item -> item.getRating() == tier).toList();
        if (tierItems.isEmpty()) {
            return;
        }
        md.append("\n## ").append(heading).append("\n");
        for (ContentItem item : tierItems) {
            md.append("\n### [").append(escape(item.getTitle())).append("](").append(item.getUrl()).append(")\n\n");
            md.append("- **Source:** ").append(sourceNames.getOrDefault(item.getSourceId(), UNKNOWN_SOURCE)).append("\n");
            if (item.getPublishedDate() != null) {
                md.append("- **Published:** ").append(item.getPublishedDate().toLocalDate().format(DAY)).append("\n");
            }
            if (item.getDurationMinutes() != null) {
                md.append("- **Duration:** ").append(item.getDurationMinutes()).append(" min\n");
            }
            if (item.getRatingReasoning() != null && !item.getRatingReasoning().isBlank()) {
                md.append("\n> ").append(item.getRatingReasoning().strip()).append("\n");
            }
        }
    }

    // brackets would end the link text early
    private static String escape(String title) {
        return title.replace("[", "\\[").replace("]", "\\]");
    }
}
