package com.community.kolokwa.controller;

import com.community.kolokwa.dto.BadgeDTO;
import com.community.kolokwa.dto.CommonResponse;
import com.community.kolokwa.service.BadgeService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/badges")
public class BadgeController {

    private final BadgeService badgeService;

    public BadgeController(BadgeService badgeService) {
        this.badgeService = badgeService;
    }

    /**
     * GET /api/badges: every badge with earned count and completion rate
     */
    @GetMapping
    public ResponseEntity<CommonResponse<List<BadgeDTO>>> getBadgeList() {
        return ResponseEntity.ok(CommonResponse.success(badgeService.getBadgeList()));
    }

    /**
     * GET /api/badges/ranking?count=5&sort_order=desc
     */
    @GetMapping("/ranking")
    public ResponseEntity<CommonResponse<List<BadgeDTO>>> getBadgeRanking(
            @RequestParam(value = "count", required = false) Integer count,
            @RequestParam(value = "sort_order", required = false) String sortOrder) {
        return ResponseEntity.ok(CommonResponse.success(badgeService.getBadgeRanking(count, sortOrder)));
    }
}
