package com.contentcuration.curator.service.digest;

import com.contentcuration.curator.entity.ContentItem;
import com.contentcuration.curator.entity.ContentState;
import com.contentcuration.curator.entity.Rating;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Picks the rated, unpublished S and A items ingested inside the window and orders them.
 *
 * <p>S comes before A. Within a tier the newest published date comes first and undated items
 * follow the dated ones, keeping their relative order.
 */
@Component
public class DigestSelector {

    private static final Comparator<ContentItem> DIGEST_ORDER =
            Comparator.comparing((ContentItem item) -> item.getRating().ordinal())
                    .thenComparing(ContentItem::getPublishedDate, Comparator.nullsLast(Comparator.reverseOrder()));

    public List<ContentItem> select(List<ContentItem> candidates, DigestWindow window) {
        return candidates.stream()
                .filter(item -> item.getState() == ContentState.RATED)
                .filter(item -> item.getRating().isTopTier())
                .filter(item -> window.contains(item.getFetchedAt()))
                .sorted(DIGEST_ORDER)
                .toList();
    }

    public static int countTier(List<ContentItem> items, Rating rating) {
        return (int) items.stream().filter(item -> item.getRating() == rating).count();
    }
}
