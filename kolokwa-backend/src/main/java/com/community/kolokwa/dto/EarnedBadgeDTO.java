package com.community.kolokwa.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class EarnedBadgeDTO {

    private String badgeKey;

    private String name;

    private LocalDateTime earnedAt;
}
