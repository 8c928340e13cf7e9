package com.contentcuration.curator.dto;

import com.contentcuration.curator.entity.SourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceDTO {
    private Long id;
    private String name;
    private SourceType type;
    private String url;
    private Boolean enabled;
    private LocalDateTime lastFetchAt;
}
