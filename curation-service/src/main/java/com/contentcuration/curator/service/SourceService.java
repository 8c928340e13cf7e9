package com.contentcuration.curator.service;

import com.contentcuration.curator.dto.SourceDTO;
import com.contentcuration.curator.entity.Source;
import com.contentcuration.curator.entity.SourceType;
import com.contentcuration.curator.mapper.EntityMapper;
import com.contentcuration.curator.repository.SourceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class SourceService {

    private final SourceRepository sourceRepository;
    private final EntityMapper entityMapper;

    /**
     * All configured sources, disabled ones included, ordered by name.
     */
    @Transactional(readOnly = true)
    public List<SourceDTO> listSources() {
        return sourceRepository.findAllByOrderByNameAsc().stream()
                .map(entityMapper::toDTO)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Optional<Source> findByName(String name) {
        return sourceRepository.findByName(name);
    }

    @Transactional(readOnly = true)
    public List<Source> findEnabled() {
        return sourceRepository.findByEnabledOrderByNameAsc(true);
    }

    @Transactional(readOnly = true)
    public List<Source> findEnabledByType(SourceType type) {
        return sourceRepository.findByEnabledAndTypeOrderByNameAsc(true, type);
    }
}
