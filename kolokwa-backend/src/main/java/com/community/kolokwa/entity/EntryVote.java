package com.community.kolokwa.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One member's vote on one entry. Changing one's mind updates this row instead of adding one.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "entry_votes",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_vote_entry_voter", columnNames = {"entry_id", "voter_id"})
        },
        indexes = {
                @Index(name = "idx_vote_entry", columnList = "entry_id")
        })
public class EntryVote {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "vote_id")
    private Long id;

    @Column(name = "entry_id", nullable = false)
    private Long entryId;

    @Column(name = "voter_id", nullable = false)
    private Long voterId;

    /** vote_type: +1 upvote, -1 downvote */
    @Column(name = "vote_type", nullable = false)
    private Integer voteType;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
