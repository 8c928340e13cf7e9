package com.contentcuration.curator.repository;

import com.contentcuration.curator.entity.Source;
import com.contentcuration.curator.entity.SourceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SourceRepository extends JpaRepository<Source, Long> {

    List<Source> findByEnabledOrderByNameAsc(Boolean enabled);

    List<Source> findByEnabledAndTypeOrderByNameAsc(Boolean enabled, SourceType type);

    List<Source> findAllByOrderByNameAsc();

    Optional<Source> findByName(String name);

    Optional<Source> findByUrl(String url);
}
