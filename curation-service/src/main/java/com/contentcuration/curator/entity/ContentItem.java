package com.contentcuration.curator.entity;

import com.contentcuration.curator.converter.IntegerBooleanConverter;
import com.contentcuration.curator.converter.IsoTimestampConverter;
import com.contentcuration.curator.dto.RatingResult;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One video, episode or post moving through UNRATED, RATED and PUBLISHED.
 *
 * <p>The canonical URL is globally unique. Rating fields are written together by
 * {@link #applyRating}. Publication fields are only written by the guarded bulk update
 * {@code ContentItemRepository.markPublished}, which skips unrated and already published rows.
 */
@Entity
@Table(name = "content_items", indexes = {
    @Index(name = "idx_content_url", columnList = "url"),
    @Index(name = "idx_content_rating", columnList = "rating"),
    @Index(name = "idx_content_published", columnList = "published_to_obsidian"),
    @Index(name = "idx_content_date", columnList = "published_date"),
    @Index(name = "idx_content_source", columnList = "source_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContentItem {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    @Column(name = "title", nullable = false)
    private String title;

    @Column(name = "url", nullable = false, unique = true)
    private String url;

    @Column(name = "description")
    private String description;

    @Column(name = "transcript")
    private String transcript;

    @Convert(converter = IsoTimestampConverter.class)
    @Column(name = "published_date")
    private LocalDateTime publishedDate;

    @Column(name = "duration_minutes")
    private Integer durationMinutes;

    // Rating data
    @Enumerated(EnumType.STRING)
    @Column(name = "rating", length = 1)
    private Rating rating;

    @Column(name = "rating_reasoning")
    private String ratingReasoning;

    @Convert(converter = IsoTimestampConverter.class)
    @Column(name = "rated_at")
    private LocalDateTime ratedAt;

    // Output tracking
    @Convert(converter = IntegerBooleanConverter.class)
    @Column(name = "published_to_obsidian", nullable = false)
    @Builder.Default
    private Boolean published = false;

    @Column(name = "digest_id")
    private Long digestId;

    /**
     * Ingestion timestamp; the digest window is measured against it.
     */
    @Convert(converter = IsoTimestampConverter.class)
    @Column(name = "fetched_at", nullable = false, updatable = false)
    private LocalDateTime fetchedAt;

    @PrePersist
    void onCreate() {
        if (fetchedAt == null) {
            throw new IllegalStateException("fetched_at is required for content item " + url);
        }
        if (published == null) {
            published = false;
        }
    }

    public ContentState getState() {
        if (Boolean.TRUE.equals(published)) {
            return ContentState.PUBLISHED;
        }
        return rating != null ? ContentState.RATED : ContentState.UNRATED;
    }

    /**
     * UNRATED -> RATED. Rating, reasoning and timestamp are set in one step.
     */
    public void applyRating(RatingResult result, LocalDateTime ratedAt) {
        if (getState() != ContentState.UNRATED) {
            throw new IllegalStateException("Content item " + id + " is already " + getState());
        }
        this.rating = result.rating();
        this.ratingReasoning = result.reasoning();
        this.ratedAt = ratedAt;
    }
}
