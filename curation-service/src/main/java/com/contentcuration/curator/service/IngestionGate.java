package com.contentcuration.curator.service;

import com.contentcuration.curator.dto.CandidateItem;
import com.contentcuration.curator.dto.IngestionResult;
import com.contentcuration.curator.entity.ContentItem;
import com.contentcuration.curator.entity.FetchLog;
import com.contentcuration.curator.entity.Source;
import com.contentcuration.curator.exception.SourceNotFoundException;
import com.contentcuration.curator.repository.ContentItemRepository;
import com.contentcuration.curator.repository.FetchLogRepository;
import com.contentcuration.curator.repository.SourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Deduplicating writer for fetched candidates.
 *
 * <p>The canonical URL is the identity. A URL already stored is skipped; re-running over
 * overlapping fetch windows never adds a second row. Each insert runs in its own transaction, and
 * a unique-constraint violation raised by the insert itself (a concurrent writer got there
 * between check and insert) counts as a duplicate too.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IngestionGate {

    private final ContentItemRepository contentItemRepository;
    private final SourceRepository sourceRepository;
    private final FetchLogRepository fetchLogRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private enum InsertOutcome { INSERTED, DUPLICATE }

    /**
     * Stores the new candidates of one source pass, then stamps the source and appends a fetch log.
     */
    public IngestionResult ingest(Source source, List<CandidateItem> candidates, LocalDateTime startedAt) {
        int newCount = 0;
        int skipped = 0;
        int failed = 0;

        for (CandidateItem candidate : candidates) {
            try {
                InsertOutcome outcome = insertIfAbsent(source.getId(), candidate);
                if (outcome == InsertOutcome.INSERTED) {
                    newCount++;
                } else {
                    skipped++;
                }
            } catch (DataIntegrityViolationException e) {
                log.debug("Late duplicate for {}: {}", candidate.url(), e.getMostSpecificCause().getMessage());
                skipped++;
            } catch (RuntimeException e) {
                log.error("Error inserting '{}' ({}): {}", candidate.title(), candidate.url(), e.getMessage(), e);
                failed++;
            }
        }

        recordSuccess(source.getId(), newCount, startedAt);

        log.info("Ingested source {}: {} new, {} skipped (duplicates), {} failed",
                source.getName(), newCount, skipped, failed);
        return new IngestionResult(newCount, skipped, failed);
    }

    /**
     * Fetch pass that produced nothing to ingest. {@code last_fetch_at} stays as it was.
     */
    public void recordFailure(Source source, String errorMessage, LocalDateTime startedAt) {
        transactionTemplate.executeWithoutResult(status ->
                fetchLogRepository.save(FetchLog.failed(source.getId(), errorMessage, startedAt, now())));
    }

    private InsertOutcome insertIfAbsent(Long sourceId, CandidateItem candidate) {
        return transactionTemplate.execute(status -> {
            if (contentItemRepository.existsByUrl(candidate.url())) {
                log.debug("Duplicate content skipped: {}", candidate.url());
                return InsertOutcome.DUPLICATE;
            }
            contentItemRepository.save(ContentItem.builder()
                    .sourceId(sourceId)
                    .title(candidate.title())
                    .url(candidate.url())
                    .description(candidate.description())
                    .transcript(candidate.transcript())
                    .publishedDate(candidate.publishedDate())
                    .durationMinutes(candidate.durationMinutes())
                    .published(false)
                    .fetchedAt(now())
                    .build());
            return InsertOutcome.INSERTED;
        });
    }

    private void recordSuccess(Long sourceId, int newCount, LocalDateTime startedAt) {
        transactionTemplate.executeWithoutResult(status -> {
            LocalDateTime completedAt = now();
            Source stored = sourceRepository.findById(sourceId)
                    .orElseThrow(() -> SourceNotFoundException.byId(sourceId));
            stored.setLastFetchAt(completedAt);
            sourceRepository.save(stored);
            fetchLogRepository.save(FetchLog.succeeded(sourceId, newCount, startedAt, completedAt));
        });
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
