package com.contentcuration.curator.dto;

import com.contentcuration.curator.entity.Rating;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CurationStatsDTO {
    private Long totalItems;
    private Long ratedItems;
    private Map<Rating, Long> byRating;
    private Long unpublishedTopTier;
}
