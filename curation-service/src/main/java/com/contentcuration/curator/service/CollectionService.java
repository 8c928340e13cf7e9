package com.contentcuration.curator.service;

import com.contentcuration.curator.config.CuratorProperties;
import com.contentcuration.curator.dto.CandidateItem;
import com.contentcuration.curator.dto.CollectionReport;
import com.contentcuration.curator.dto.FetchOutcome;
import com.contentcuration.curator.dto.FetchRequest;
import com.contentcuration.curator.dto.FetchedItem;
import com.contentcuration.curator.dto.IngestionResult;
import com.contentcuration.curator.entity.Source;
import com.contentcuration.curator.entity.SourceType;
import com.contentcuration.curator.exception.CollaboratorTimeoutException;
import com.contentcuration.curator.exception.SourceNotFoundException;
import com.contentcuration.curator.service.fetch.ContentFetcher;
import com.contentcuration.curator.service.fetch.FetcherRegistry;
import com.contentcuration.curator.service.transcript.TranscriptNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fetches sources one after another and hands their items to the {@link IngestionGate}.
 *
 * <p>A timeout or transport failure is recorded for that source and the pass moves on to the
 * next one. An error while ingesting or logging one source ends only that source. Nothing is
 * retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CollectionService {

    private final SourceService sourceService;
    private final FetcherRegistry fetcherRegistry;
    private final IngestionGate ingestionGate;
    private final CuratorProperties properties;
    private final Clock clock;

    public CollectionReport collectSource(String name) {
        Source source = sourceService.findByName(name)
                .orElseThrow(() -> SourceNotFoundException.byName(name));
        return new CollectionReport(List.of(collect(source)));
    }

    public CollectionReport collectAll() {
        return collectEach(sourceService.findEnabled());
    }

    public CollectionReport collectByType(SourceType type) {
        return collectEach(sourceService.findEnabledByType(type));
    }

    private CollectionReport collectEach(List<Source> sources) {
        if (sources.isEmpty()) {
            log.info("No enabled sources to fetch");
        }
        List<FetchOutcome> outcomes = new ArrayList<>();
        for (Source source : sources) {
            outcomes.add(collect(source));
        }
        CollectionReport report = new CollectionReport(outcomes);
        log.info("Fetch pass finished: {} source(s), {} new, {} skipped",
                outcomes.size(), report.totalNew(), report.totalSkipped());
        return report;
    }

    private FetchOutcome collect(Source source) {
        Optional<ContentFetcher> fetcher = fetcherRegistry.fetcherFor(source.getType());
        if (fetcher.isEmpty()) {
            log.warn("Source type {} not supported yet, skipping {}", source.getType().getValue(), source.getName());
            return FetchOutcome.notSupported(source);
        }

        LocalDateTime startedAt = LocalDateTime.now(clock);
        CuratorProperties.Fetch settings = properties.getFetch();
        FetchRequest request = new FetchRequest(settings.getDaysBack(), settings.getMaxItems(), settings.getTimeout());
        log.info("Fetching {} ({})", source.getName(), source.getType().getValue());

        List<FetchedItem> fetched;
        try {
            fetched = fetcher.get().fetch(source, request);
        } catch (CollaboratorTimeoutException e) {
            log.warn("Fetch timed out for {}: {}", source.getName(), e.getMessage());
            recordFailure(source, e.getMessage(), startedAt);
            return FetchOutcome.timedOut(source, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error fetching {}: {}", source.getName(), e.getMessage(), e);
            recordFailure(source, e.getMessage(), startedAt);
            return FetchOutcome.failed(source, e.getMessage());
        }

        try {
            List<CandidateItem> candidates = fetched.stream()
                    .map(item -> toCandidate(item, settings))
                    .toList();
            IngestionResult result = ingestionGate.ingest(source, candidates, startedAt);
            return FetchOutcome.completed(source, result);
        } catch (RuntimeException e) {
            log.error("Error ingesting {}: {}", source.getName(), e.getMessage(), e);
            return FetchOutcome.failed(source, e.getMessage());
        }
    }

    private void recordFailure(Source source, String message, LocalDateTime startedAt) {
        try {
            ingestionGate.recordFailure(source, message, startedAt);
        } catch (RuntimeException e) {
            log.error("Could not record failed fetch for {}: {}", source.getName(), e.getMessage(), e);
        }
    }

    CandidateItem toCandidate(FetchedItem item, CuratorProperties.Fetch settings) {
        String transcript = item.hasCaptions()
                ? TranscriptNormalizer.normalize(item.captionLines(), settings.getMaxTranscriptChars())
                : null;
        if (transcript != null && transcript.isEmpty()) {
            transcript = null;
        }
        return new CandidateItem(
                item.title(),
                item.url(),
                truncate(item.description(), settings.getMaxDescriptionChars()),
                transcript,
                item.uploadedAt(),
                item.durationSeconds() != null ? item.durationSeconds() / 60 : null);
    }

    private static String truncate(String text, int maxChars) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return text.length() > maxChars ? text.substring(0, maxChars) : text;
    }
}
