package com.community.kolokwa.controller;

import com.community.kolokwa.dto.CommonResponse;
import com.community.kolokwa.dto.DailyChallengeDTO;
import com.community.kolokwa.service.DailyChallengeService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/challenges")
public class DailyChallengeController {

    private final DailyChallengeService challengeService;

    public DailyChallengeController(DailyChallengeService challengeService) {
        this.challengeService = challengeService;
    }

    @GetMapping("/today")
    public ResponseEntity<CommonResponse<DailyChallengeDTO>> today(
            @RequestHeader(value = EntryController.MEMBER_HEADER, required = false) Long memberId) {
        return ResponseEntity.ok(CommonResponse.success(challengeService.getToday(memberId)));
    }

    @PostMapping("/{challengeId}/accept")
    public ResponseEntity<CommonResponse<DailyChallengeDTO>> accept(
            @PathVariable Long challengeId,
            @RequestHeader(EntryController.MEMBER_HEADER) Long memberId) {
        DailyChallengeDTO challenge = challengeService.accept(challengeId, memberId);
        return ResponseEntity.ok(CommonResponse.success(challenge, "Challenge \"" + challenge.getTitle() + "\" accepted!"));
    }

    @PostMapping("/{challengeId}/complete")
    public ResponseEntity<CommonResponse<DailyChallengeDTO>> complete(
            @PathVariable Long challengeId,
            @RequestHeader(EntryController.MEMBER_HEADER) Long memberId) {
        DailyChallengeDTO challenge = challengeService.complete(challengeId, memberId);
        return ResponseEntity.ok(CommonResponse.success(challenge,
                "Challenge \"" + challenge.getTitle() + "\" completed! Points awarded."));
    }
}
