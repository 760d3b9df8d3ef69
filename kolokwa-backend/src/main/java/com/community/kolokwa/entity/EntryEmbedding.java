package com.community.kolokwa.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Semantic-search vector of a published entry. Written after commit, never inside a ledger transaction.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "entry_embeddings")
public class EntryEmbedding {

    @Id
    @Column(name = "entry_id")
    private Long entryId;

    @Column(name = "model", nullable = false, length = 100)
    private String model;

    @Column(name = "dimensions", nullable = false)
    private Integer dimensions;

    /** vector_json: the float vector serialized as a JSON array */
    @Lob
    @Column(name = "vector_json", nullable = false)
    private String vectorJson;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
