package com.contentcuration.curator.service.digest;

import com.contentcuration.curator.entity.ContentItem;
import com.contentcuration.curator.entity.Rating;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class MarkdownDigestRendererTest {

    private final MarkdownDigestRenderer renderer = new MarkdownDigestRenderer();

    @Test
    @DisplayName("Digest lists counts and one section per tier in selection order")
    void rendersTierSections() {
        // given
        ContentItem sItem = ContentItem.builder()
                .id(1L).sourceId(10L).title("Parsing [Part 1]").url("https://youtu.be/s")
                .rating(Rating.S).ratingReasoning("Excellent walkthrough")
                .publishedDate(LocalDateTime.of(2024, 1, 5, 0, 0)).durationMinutes(42)
                .build();
        ContentItem aItem = ContentItem.builder()
                .id(2L).sourceId(11L).title("Weekly notes").url("https://blog.example.com/notes")
                .rating(Rating.A).ratingReasoning("Useful roundup")
                .build();

        // when
        String markdown = renderer.render(List.of(sItem, aItem), Map.of(10L, "Fireship"), LocalDate.of(2024, 1, 15));

        // then
        assertThat(markdown).startsWith("# Curated Digest 2024-01-15\n");
        assertThat(markdown).contains("**2 item(s)**: 1 S-tier, 1 A-tier");
        assertThat(markdown).contains("### [Parsing \\[Part 1\\]](https://youtu.be/s)");
        assertThat(markdown).contains("- **Source:** Fireship");
        assertThat(markdown).contains("- **Published:** 2024-01-05");
        assertThat(markdown).contains("- **Duration:** 42 min");
        assertThat(markdown).contains("> Excellent walkthrough");
        assertThat(markdown).contains("- **Source:** Unknown source");
        assertThat(markdown.indexOf("## S-Tier")).isLessThan(markdown.indexOf("## A-Tier"));
        assertThat(markdown.indexOf("Parsing")).isLessThan(markdown.indexOf("Weekly notes"));
    }

    @Test
    @DisplayName("Tiers without items get no section")
    void omitsEmptyTier() {
        ContentItem aItem = ContentItem.builder()
                .id(2L).sourceId(11L).title("Only A").url("https://a").rating(Rating.A).build();

        String markdown = renderer.render(List.of(aItem), Map.of(), LocalDate.of(2024, 1, 15));

        assertThat(markdown).doesNotContain("## S-Tier").contains("## A-Tier");
    }
}
