package com.contentcuration.curator.service;

import com.contentcuration.curator.dto.CurationStatsDTO;
import com.contentcuration.curator.entity.Rating;
import com.contentcuration.curator.repository.ContentItemRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class CurationStatsService {

    private final ContentItemRepository contentItemRepository;

    /**
     * Item totals; {@code byRating} lists only tiers that occur, in S to D order.
     */
    @Transactional(readOnly = true)
    public CurationStatsDTO getStats() {
        Map<Rating, Long> byRating = new EnumMap<>(Rating.class);
        for (Object[] row : contentItemRepository.countGroupedByRating()) {
            byRating.put((Rating) row[0], ((Number) row[1]).longValue());
        }

        return CurationStatsDTO.builder()
                .totalItems(contentItemRepository.count())
                .ratedItems(contentItemRepository.countByRatingIsNotNull())
                .byRating(byRating)
                .unpublishedTopTier(contentItemRepository.countByPublishedAndRatingIn(false, List.of(Rating.S, Rating.A)))
                .build();
    }
}
