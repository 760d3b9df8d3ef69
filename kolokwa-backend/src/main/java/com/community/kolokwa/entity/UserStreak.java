package com.community.kolokwa.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * UserStreak Entity: daily contribution streak and daily challenge progress of one member.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "user_streaks")
public class UserStreak {

    @Id
    @Column(name = "member_id")
    private Long memberId;

    @Column(name = "current_streak", nullable = false)
    @Builder.Default
    private Integer currentStreak = 0;

    @Column(name = "longest_streak", nullable = false)
    @Builder.Default
    private Integer longestStreak = 0;

    @Column(name = "last_contribution_date")
    private LocalDate lastContributionDate;

    // --- Daily challenge progress ---

    @Column(name = "accepted_challenge_id")
    private Long acceptedChallengeId;

    @Column(name = "challenge_accepted_date")
    private LocalDate challengeAcceptedDate;

    @Column(name = "completed_challenge_id")
    private Long completedChallengeId;

    @Column(name = "challenge_completed_date")
    private LocalDate challengeCompletedDate;
}
