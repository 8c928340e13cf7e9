package com.contentcuration.curator.mapper;

import com.contentcuration.curator.dto.SourceDTO;
import com.contentcuration.curator.entity.Source;
import org.springframework.stereotype.Component;

@Component
public class EntityMapper {

    public SourceDTO toDTO(Source source) {
        return SourceDTO.builder()
                .id(source.getId())
                .name(source.getName())
                .type(source.getType())
                .url(source.getUrl())
                .enabled(source.getEnabled())
                .lastFetchAt(source.getLastFetchAt())
                .build();
    }
}
