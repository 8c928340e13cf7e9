package com.contentcuration.curator.entity;

import com.contentcuration.curator.converter.IntegerBooleanConverter;
import com.contentcuration.curator.converter.IsoTimestampConverter;
import com.contentcuration.curator.converter.SourceTypeConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "sources")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Source {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, unique = true)
    private String name;

    @Convert(converter = SourceTypeConverter.class)
    @Column(name = "type", nullable = false)
    private SourceType type;

    @Column(name = "url", nullable = false)
    private String url;

    @Convert(converter = IntegerBooleanConverter.class)
    @Column(name = "enabled", nullable = false)
    @Builder.Default
    private Boolean enabled = true;

    /**
     * Set after every completed fetch pass; failed passes leave it untouched.
     */
    @Convert(converter = IsoTimestampConverter.class)
    @Column(name = "last_fetch_at")
    private LocalDateTime lastFetchAt;

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
