package com.contentcuration.curator.service.digest;

import com.contentcuration.curator.entity.ContentItem;
import com.contentcuration.curator.entity.Rating;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DigestSelectorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 15, 12, 0);

    private final DigestSelector selector = new DigestSelector();

    @Test
    @DisplayName("S before A, then newest published date, undated last")
    void ordersByTierThenPublishedDate() {
        // given
        ContentItem sItem = item(1L, Rating.S, LocalDateTime.of(2024, 1, 5, 0, 0), NOW.minusDays(1));
        ContentItem datedA = item(2L, Rating.A, LocalDateTime.of(2024, 1, 10, 0, 0), NOW.minusDays(1));
        ContentItem undatedA = item(3L, Rating.A, null, NOW.minusDays(1));

        // when
        List<ContentItem> selected = selector.select(List.of(undatedA, datedA, sItem), DigestWindow.trailingDays(NOW, 7));

        // then
        assertThat(selected).containsExactly(sItem, datedA, undatedA);
    }

    @Test
    @DisplayName("Undated items keep their relative order")
    void undatedOrderIsStable() {
        // given
        ContentItem first = item(1L, Rating.A, null, NOW.minusHours(1));
        ContentItem second = item(2L, Rating.A, null, NOW.minusHours(2));
        ContentItem third = item(3L, Rating.A, null, NOW.minusHours(3));

        // when
        List<ContentItem> selected = selector.select(List.of(second, first, third), DigestWindow.trailingDays(NOW, 7));

        // then
        assertThat(selected).containsExactly(second, first, third);
    }

    @Test
    @DisplayName("An item fetched exactly N days ago is included; one microsecond earlier is not")
    void windowStartIsInclusive() {
        // given
        ContentItem onBoundary = item(1L, Rating.S, null, NOW.minusDays(7));
        ContentItem justOutside = item(2L, Rating.S, null, NOW.minusDays(7).minusNanos(1_000));
        ContentItem atNow = item(3L, Rating.S, null, NOW);
        ContentItem future = item(4L, Rating.S, null, NOW.plusNanos(1_000));

        // when
        List<ContentItem> selected = selector.select(
                List.of(onBoundary, justOutside, atNow, future), DigestWindow.trailingDays(NOW, 7));

        // then
        assertThat(selected).containsExactlyInAnyOrder(onBoundary, atNow);
    }

    @Test
    @DisplayName("Lower tiers, unrated and published items are never selected")
    void filtersIneligibleItems() {
        // given
        ContentItem bTier = item(1L, Rating.B, null, NOW);
        ContentItem unrated = item(2L, null, null, NOW);
        ContentItem published = item(3L, Rating.S, null, NOW);
        published.setPublished(true);
        published.setDigestId(99L);

        // when
        List<ContentItem> selected = selector.select(List.of(bTier, unrated, published), DigestWindow.trailingDays(NOW, 7));

        // then
        assertThat(selected).isEmpty();
    }

    private static ContentItem item(Long id, Rating rating, LocalDateTime publishedDate, LocalDateTime fetchedAt) {
        return ContentItem.builder()
                .id(id)
                .sourceId(1L)
                .title("Item " + id)
                .url("https://example.com/" + id)
                .rating(rating)
                .publishedDate(publishedDate)
                .fetchedAt(fetchedAt)
                .build();
    }
}
