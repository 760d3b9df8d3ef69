package com.community.kolokwa.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MemberRankDTO {

    private Long memberId;

    private Integer points;

    // members with more points + 1
    private Long rank;

    private Long totalMembers;
}
