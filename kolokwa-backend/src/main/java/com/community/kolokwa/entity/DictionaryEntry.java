package com.community.kolokwa.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * DictionaryEntry Entity: a Kolokwa word or phrase with its English translation and review state.
 * upvotes / downvotes / verification_count are materialized counters kept in step with the
 * vote and verification ledgers inside the same transaction.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "koloqua_entries",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_entry_text_contributor", columnNames = {"koloqua_text", "contributor_id"})
        },
        indexes = {
                @Index(name = "idx_entry_text_status", columnList = "koloqua_text, status"),
                @Index(name = "idx_entry_status_created", columnList = "status, created_at")
        })
public class DictionaryEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "entry_id")
    private Long id;

    // --- Core fields ---

    @Column(name = "koloqua_text", nullable = false, length = 255)
    private String koloquaText;

    @Column(name = "english_translation", nullable = false, length = 2000)
    private String englishTranslation;

    /** literal_translation: word-for-word translation if different from the meaning */
    @Column(name = "literal_translation", length = 2000)
    private String literalTranslation;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, length = 20)
    @Builder.Default
    private EntryType entryType = EntryType.WORD;

    // --- Context and usage ---

    @Column(name = "context_explanation", length = 2000)
    private String contextExplanation;

    @Column(name = "example_sentence_koloqua", length = 1000)
    private String exampleSentenceKoloqua;

    @Column(name = "example_sentence_english", length = 1000)
    private String exampleSentenceEnglish;

    @Column(name = "cultural_notes", length = 2000)
    private String culturalNotes;

    @Column(name = "pronunciation_guide", length = 255)
    private String pronunciationGuide;

    @Column(name = "region_specific", length = 100)
    private String regionSpecific;

    // --- Review state ---

    /** contributor_id: nullable once the contributing member is gone */
    @Column(name = "contributor_id")
    private Long contributorId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private EntryStatus status = EntryStatus.PENDING;

    /** verification_count: number of "accurate" verifications */
    @Column(name = "verification_count", nullable = false)
    @Builder.Default
    private Integer verificationCount = 0;

    @Column(name = "upvotes", nullable = false)
    @Builder.Default
    private Integer upvotes = 0;

    @Column(name = "downvotes", nullable = false)
    @Builder.Default
    private Integer downvotes = 0;

    // --- Timestamps ---

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /** verified_at: set once, on the transition into verified */
    @Column(name = "verified_at")
    private LocalDateTime verifiedAt;

    /**
     * Ranking score: upvotes - downvotes + verification_count * 2. Never persisted.
     */
    public int calculateScore() {
        return upvotes - downvotes + verificationCount * 2;
    }
}
