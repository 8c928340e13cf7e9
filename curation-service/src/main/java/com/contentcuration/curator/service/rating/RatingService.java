package com.contentcuration.curator.service.rating;

import com.contentcuration.curator.config.CuratorProperties;
import com.contentcuration.curator.dto.RatingReport;
import com.contentcuration.curator.dto.RatingReport.ItemOutcome;
import com.contentcuration.curator.dto.RatingResult;
import com.contentcuration.curator.entity.ContentItem;
import com.contentcuration.curator.exception.CollaboratorTimeoutException;
import com.contentcuration.curator.exception.CuratorException;
import com.contentcuration.curator.exception.RatingParseException;
import com.contentcuration.curator.repository.ContentItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Rates unrated items one at a time through the {@link RatingClient}.
 *
 * <p>Each successful verdict is applied in its own transaction (UNRATED to RATED). Parse errors,
 * timeouts and transport failures leave the item unrated for a later run; nothing is retried.
 * Calls are spaced by the configured delay, except after the last item.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RatingService {

    private final ContentItemRepository contentItemRepository;
    private final RatingClient ratingClient;
    private final RatingExtractor ratingExtractor;
    private final RatingInputComposer inputComposer;
    private final RatingPacer ratingPacer;
    private final TransactionTemplate transactionTemplate;
    private final CuratorProperties properties;
    private final Clock clock;

    public RatingReport rateUnrated(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        List<ContentItem> items = contentItemRepository.findByRatingIsNullOrderByFetchedAtDesc(PageRequest.of(0, limit));
        if (items.isEmpty()) {
            log.info("No unrated items to process");
            return new RatingReport(List.of());
        }

        log.info("Rating {} item(s)", items.size());
        Duration delay = properties.getRating().getDelay();
        List<ItemOutcome> outcomes = new ArrayList<>();

        for (int i = 0; i < items.size(); i++) {
            ContentItem item = items.get(i);
            outcomes.add(rateOne(item));

            boolean last = i == items.size() - 1;
            if (!last && !ratingPacer.pause(delay)) {
                break;
            }
        }

        RatingReport report = new RatingReport(outcomes);
        log.info("Rating batch finished: rated={}, failed={}", report.ratedCount(), report.failedCount());
        return report;
    }

    private ItemOutcome rateOne(ContentItem item) {
        try {
            String output = ratingClient.rate(inputComposer.compose(item));
            RatingResult result = ratingExtractor.extract(output);
            applyRating(item.getId(), result);
            log.info("Rated item {} '{}': {}", item.getId(), item.getTitle(), result.rating());
            return ItemOutcome.rated(item.getId(), item.getTitle(), result);

        } catch (RatingParseException e) {
            log.warn("Unparseable rating for item {} '{}': {}", item.getId(), item.getTitle(), e.getExcerpt());
            return ItemOutcome.failed(item.getId(), item.getTitle(), e.getErrorCode(), e.getMessage());
        } catch (CollaboratorTimeoutException e) {
            log.warn("Rating timed out for item {} '{}': {}", item.getId(), item.getTitle(), e.getMessage());
            return ItemOutcome.failed(item.getId(), item.getTitle(), e.getErrorCode(), e.getMessage());
        } catch (CuratorException e) {
            log.error("Rating failed for item {} '{}': {}", item.getId(), item.getTitle(), e.getMessage());
            return ItemOutcome.failed(item.getId(), item.getTitle(), e.getErrorCode(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error rating item {} '{}': {}", item.getId(), item.getTitle(), e.getMessage(), e);
            return ItemOutcome.failed(item.getId(), item.getTitle(), "INTERNAL_ERROR", e.getMessage());
        }
    }

    private void applyRating(Long itemId, RatingResult result) {
        transactionTemplate.executeWithoutResult(status -> {
            ContentItem item = contentItemRepository.findById(itemId)
                    .orElseThrow(() -> new IllegalStateException("Content item disappeared: " + itemId));
            item.applyRating(result, LocalDateTime.now(clock));
            contentItemRepository.save(item);
        });
    }
}
