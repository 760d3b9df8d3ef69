package com.community.kolokwa.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LeaderboardEntryDTO {

    private Integer rank;

    private Long memberId;

    private String name;

    private Integer points;

    private String level;
}
