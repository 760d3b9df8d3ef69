package com.community.kolokwa.dto;

import lombok.Data;

import java.time.LocalDate;
import java.util.List;

/**
 * Profile of one member: balance, level progress, counters, badges, recent activity, streak.
 */
@Data
public class MemberStatsDTO {

    private Long memberId;

    private String name;

    private Integer points;

    private LevelInfoDTO levelInfo;

    private Integer contributionsCount;

    private Integer verificationsCount;

    private Long rank;

    private List<EarnedBadgeDTO> badges;

    // 20 most recent, newest first
    private List<PointTransactionDTO> recentTransactions;

    private Integer currentStreak;

    private Integer longestStreak;

    private LocalDate lastContributionDate;
}
