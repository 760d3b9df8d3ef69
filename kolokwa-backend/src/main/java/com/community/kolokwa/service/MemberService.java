package com.community.kolokwa.service;

import com.community.kolokwa.dto.LeaderboardEntryDTO;
import com.community.kolokwa.dto.MemberRankDTO;
import com.community.kolokwa.dto.MemberStatsDTO;

import java.util.List;

public interface MemberService {

    MemberStatsDTO getMemberStats(Long memberId);

    /**
     * Top members by points.
     * @param count number of results, clamped to 1..100 (default 10)
     */
    List<LeaderboardEntryDTO> getLeaderboard(Integer count);

    MemberRankDTO getMemberRank(Long memberId);
}
