package com.contentcuration.curator.service.digest;

import com.contentcuration.curator.entity.ContentItem;
import com.contentcuration.curator.entity.Digest;
import com.contentcuration.curator.entity.Rating;
import com.contentcuration.curator.exception.DigestPublicationException;
import com.contentcuration.curator.repository.ContentItemRepository;
import com.contentcuration.curator.repository.DigestRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.util.List;

/**
 * The publication step: digest record and item marking commit together or not at all.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DigestPublisher {

    private final DigestRepository digestRepository;
    private final ContentItemRepository contentItemRepository;
    private final TransactionTemplate transactionTemplate;

    /**
     * Inserts the digest and links every selected item to it.
     *
     * @throws DigestPublicationException when fewer items than selected could be marked; nothing
     *                                    of the step is committed
     */
    public Digest publish(List<ContentItem> selection, DigestWindow window, Path artifact) {
        if (selection.isEmpty()) {
            throw new IllegalArgumentException("Nothing selected to publish");
        }
        List<Long> ids = selection.stream().map(ContentItem::getId).toList();

        return transactionTemplate.execute(status -> {
            Digest digest = digestRepository.save(Digest.builder()
                    .windowStart(window.start())
                    .windowEnd(window.end())
                    .itemCount(selection.size())
                    .sTierCount(DigestSelector.countTier(selection, Rating.S))
                    .aTierCount(DigestSelector.countTier(selection, Rating.A))
                    .vaultPath(artifact.toString())
                    .build());

            int marked = contentItemRepository.markPublished(ids, digest.getId(), true, false);
            if (marked != selection.size()) {
                throw DigestPublicationException.partialMarking(selection.size(), marked);
            }

            log.info("Published digest {} with {} item(s)", digest.getId(), marked);
            return digest;
        });
    }
}
