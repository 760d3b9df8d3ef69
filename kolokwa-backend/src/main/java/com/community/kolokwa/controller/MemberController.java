package com.community.kolokwa.controller;

import com.community.kolokwa.dto.CommonResponse;
import com.community.kolokwa.dto.LeaderboardEntryDTO;
import com.community.kolokwa.dto.MemberRankDTO;
import com.community.kolokwa.dto.MemberStatsDTO;
import com.community.kolokwa.service.MemberService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/members")
public class MemberController {

    private final MemberService memberService;

    public MemberController(MemberService memberService) {
        this.memberService = memberService;
    }

    @GetMapping("/{memberId}/stats")
    public ResponseEntity<CommonResponse<MemberStatsDTO>> getMemberStats(@PathVariable Long memberId) {
        return ResponseEntity.ok(CommonResponse.success(memberService.getMemberStats(memberId)));
    }

    /**
     * GET /api/members/leaderboard?count=10
     */
    @GetMapping("/leaderboard")
    public ResponseEntity<CommonResponse<List<LeaderboardEntryDTO>>> getLeaderboard(
            @RequestParam(value = "count", required = false) Integer count) {
        return ResponseEntity.ok(CommonResponse.success(memberService.getLeaderboard(count)));
    }

    @GetMapping("/{memberId}/rank")
    public ResponseEntity<CommonResponse<MemberRankDTO>> getMemberRank(@PathVariable Long memberId) {
        return ResponseEntity.ok(CommonResponse.success(memberService.getMemberRank(memberId)));
    }
}
