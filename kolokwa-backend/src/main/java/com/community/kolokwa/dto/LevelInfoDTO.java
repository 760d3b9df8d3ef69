package com.community.kolokwa.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LevelInfoDTO {

    private String currentLevel;

    private String currentLevelName;

    // null at the top level
    private String nextLevel;

    private String nextLevelName;

    private Integer pointsToNext;

    // 0..100 within the current level
    private Integer progressPercent;
}
