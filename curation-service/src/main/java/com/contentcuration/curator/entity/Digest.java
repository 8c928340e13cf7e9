package com.contentcuration.curator.entity;

import com.contentcuration.curator.converter.IsoTimestampConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A published batch of top-tier items. {@code itemCount} always equals the number of
 * content items carrying this digest's id.
 */
@Entity
@Table(name = "digests")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Digest {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Convert(converter = IsoTimestampConverter.class)
    @Column(name = "week_start_date", nullable = false)
    private LocalDateTime windowStart;

    @Convert(converter = IsoTimestampConverter.class)
    @Column(name = "week_end_date", nullable = false)
    private LocalDateTime windowEnd;

    @Column(name = "item_count")
    private Integer itemCount;

    @Column(name = "s_tier_count")
    private Integer sTierCount;

    @Column(name = "a_tier_count")
    private Integer aTierCount;

    @Column(name = "obsidian_path")
    private String vaultPath;

    @Convert(converter = IsoTimestampConverter.class)
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
