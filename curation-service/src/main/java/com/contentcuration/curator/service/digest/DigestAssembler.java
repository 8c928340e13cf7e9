package com.contentcuration.curator.service.digest;

import com.contentcuration.curator.dto.DigestReport;
import com.contentcuration.curator.entity.ContentItem;
import com.contentcuration.curator.entity.Digest;
import com.contentcuration.curator.entity.Rating;
import com.contentcuration.curator.entity.Source;
import com.contentcuration.curator.repository.ContentItemRepository;
import com.contentcuration.curator.repository.SourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Selects, renders, writes and publishes one digest.
 *
 * <p>An empty selection produces neither an artifact nor a record. If the publication step
 * fails, the artifact already written is discarded and the failure propagates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DigestAssembler {

    private static final List<Rating> TOP_TIERS = List.of(Rating.S, Rating.A);

    private final ContentItemRepository contentItemRepository;
    private final SourceRepository sourceRepository;
    private final DigestSelector selector;
    private final DigestRenderer renderer;
    private final DigestWriter writer;
    private final DigestPublisher publisher;
    private final Clock clock;

    public Optional<DigestReport> assemble(int days) {
        LocalDateTime now = LocalDateTime.now(clock);
        DigestWindow window = DigestWindow.trailingDays(now, days);

        List<ContentItem> selection = selector.select(
                contentItemRepository.findByPublishedAndRatingIn(false, TOP_TIERS), window);
        if (selection.isEmpty()) {
            log.info("No S/A-tier content to publish in the last {} day(s)", days);
            return Optional.empty();
        }

        log.info("Generating digest with {} item(s)", selection.size());
        String body = renderer.render(selection, sourceNames(), now.toLocalDate());
        Path artifact = writer.write(body, now.toLocalDate());

        Digest digest;
        try {
            digest = publisher.publish(selection, window, artifact);
        } catch (RuntimeException e) {
            log.error("Publication of {} failed, discarding it: {}", artifact, e.getMessage());
            writer.discard(artifact);
            throw e;
        }

        return Optional.of(new DigestReport(digest.getId(), artifact,
                digest.getItemCount(), digest.getSTierCount(), digest.getATierCount()));
    }

    private Map<Long, String> sourceNames() {
        return sourceRepository.findAll().stream()
                .collect(Collectors.toMap(Source::getId, Source::getName));
    }
}
