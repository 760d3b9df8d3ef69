package com.community.kolokwa.repository;

import com.community.kolokwa.entity.EntryEmbedding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EntryEmbeddingRepository extends JpaRepository<EntryEmbedding, Long> {
}
