package com.community.kolokwa.dto;

import lombok.Data;

import java.time.LocalDate;

@Data
public class DailyChallengeDTO {

    private Long challengeId;

    private String title;

    private String description;

    private Integer pointsReward;

    private Integer targetCount;

    private LocalDate challengeDate;

    // caller has accepted / completed it today
    private boolean accepted;

    private boolean completed;
}
