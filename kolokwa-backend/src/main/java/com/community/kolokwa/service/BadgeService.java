package com.community.kolokwa.service;

import com.community.kolokwa.dto.BadgeDTO;

import java.util.List;

public interface BadgeService {

    /**
     * Every badge with its earned count and completion rate.
     */
    List<BadgeDTO> getBadgeList();

    /**
     * Badges ranked by earned count.
     * @param count number of results (default 1)
     * @param sortOrder "asc" or "desc" (default "desc")
     */
    List<BadgeDTO> getBadgeRanking(Integer count, String sortOrder);
}
