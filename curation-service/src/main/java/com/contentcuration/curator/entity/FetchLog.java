package com.contentcuration.curator.entity;

import com.contentcuration.curator.converter.IntegerBooleanConverter;
import com.contentcuration.curator.converter.IsoTimestampConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Audit record of one fetch attempt against a source.
 */
@Entity
@Table(name = "fetch_logs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FetchLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_id", nullable = false)
    private Long sourceId;

    /**
     * New items stored by the attempt; duplicates are not counted.
     */
    @Column(name = "items_fetched")
    @Builder.Default
    private Integer itemsFetched = 0;

    @Convert(converter = IntegerBooleanConverter.class)
    @Column(name = "success")
    private Boolean success;

    @Column(name = "error_message")
    private String errorMessage;

    @Convert(converter = IsoTimestampConverter.class)
    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Convert(converter = IsoTimestampConverter.class)
    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public static FetchLog succeeded(Long sourceId, int newItems, LocalDateTime startedAt, LocalDateTime completedAt) {
        return FetchLog.builder()
                .sourceId(sourceId)
                .itemsFetched(newItems)
                .success(true)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }

    public static FetchLog failed(Long sourceId, String errorMessage, LocalDateTime startedAt, LocalDateTime completedAt) {
        return FetchLog.builder()
                .sourceId(sourceId)
                .itemsFetched(0)
                .success(false)
                .errorMessage(errorMessage)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .build();
    }
}
