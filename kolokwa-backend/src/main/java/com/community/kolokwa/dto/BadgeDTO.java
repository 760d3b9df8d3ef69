package com.community.kolokwa.dto;

import lombok.Data;

/**
 * Badge catalog row with how many members hold it.
 */
@Data
public class BadgeDTO {

    private String badgeKey;

    private String name;

    // badge_type: contribution | verification | streak | special
    private String category;

    private String description;

    private Integer earnedCount;

    // earned_count / total members
    private Double completionRate;

    // only set by the ranking
    private Integer rank;
}
