package com.contentcuration.curator.repository;

import com.contentcuration.curator.entity.Digest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface DigestRepository extends JpaRepository<Digest, Long> {
}
