package com.community.kolokwa.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One member's judgement of one entry. Resubmission overwrites type and comments.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "entry_verifications",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_verification_entry_verifier", columnNames = {"entry_id", "verifier_id"})
        },
        indexes = {
                @Index(name = "idx_verification_entry_type", columnList = "entry_id, verification_type")
        })
public class EntryVerification {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "verification_id")
    private Long id;

    @Column(name = "entry_id", nullable = false)
    private Long entryId;

    @Column(name = "verifier_id", nullable = false)
    private Long verifierId;

    @Enumerated(EnumType.STRING)
    @Column(name = "verification_type", nullable = false, length = 20)
    private VerificationType verificationType;

    @Column(name = "comments", length = 2000)
    private String comments;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
