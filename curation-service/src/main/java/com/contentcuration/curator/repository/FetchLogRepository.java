package com.contentcuration.curator.repository;

import com.contentcuration.curator.entity.FetchLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface FetchLogRepository extends JpaRepository<FetchLog, Long> {

    List<FetchLog> findBySourceIdOrderByIdDesc(Long sourceId);
}
