package com.community.kolokwa.controller;

import com.community.kolokwa.dto.CommonResponse;
import com.community.kolokwa.dto.EntryDTO;
import com.community.kolokwa.dto.EntryRequest;
import com.community.kolokwa.dto.ModerationRequest;
import com.community.kolokwa.dto.VerificationRequest;
import com.community.kolokwa.dto.VerificationResultDTO;
import com.community.kolokwa.dto.VoteRequest;
import com.community.kolokwa.dto.VoteResultDTO;
import com.community.kolokwa.dto.WithdrawResultDTO;
import com.community.kolokwa.service.ContributionService;
import com.community.kolokwa.service.EntryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Dictionary entries. The acting member comes from the {@code X-Member-Id} header set by
 * the auth layer.
 */
@RestController
@RequestMapping("/api/entries")
public class EntryController {

    static final String MEMBER_HEADER = "X-Member-Id";

    private final ContributionService contributionService;
    private final EntryService entryService;

    public EntryController(ContributionService contributionService, EntryService entryService) {
        this.contributionService = contributionService;
        this.entryService = entryService;
    }

    /**
     * POST /api/entries: submit a new entry (status pending)
     */
    @PostMapping
    public ResponseEntity<CommonResponse<EntryDTO>> submitEntry(
            @RequestHeader(MEMBER_HEADER) Long memberId,
            @Valid @RequestBody EntryRequest request) {
        EntryDTO entry = contributionService.submitEntry(memberId, request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CommonResponse.success(entry, "Thank you! Your entry is pending review."));
    }

    /**
     * GET /api/entries/ranking?count=10&sort_order=desc
     */
    @GetMapping("/ranking")
    public ResponseEntity<CommonResponse<List<EntryDTO>>> getEntryRanking(
            @RequestParam(value = "count", required = false) Integer count,
            @RequestParam(value = "sort_order", required = false) String sortOrder) {
        return ResponseEntity.ok(CommonResponse.success(entryService.getEntryRanking(count, sortOrder)));
    }

    /**
     * GET /api/entries/pending?count=20: review queue
     */
    @GetMapping("/pending")
    public ResponseEntity<CommonResponse<List<EntryDTO>>> getPendingEntries(
            @RequestParam(value = "count", required = false) Integer count) {
        return ResponseEntity.ok(CommonResponse.success(entryService.getPendingEntries(count)));
    }

    @GetMapping("/{entryId}")
    public ResponseEntity<CommonResponse<EntryDTO>> getEntry(
            @PathVariable Long entryId,
            @RequestHeader(value = MEMBER_HEADER, required = false) Long memberId) {
        return ResponseEntity.ok(CommonResponse.success(entryService.getEntry(entryId, memberId)));
    }

    @PutMapping("/{entryId}")
    public ResponseEntity<CommonResponse<EntryDTO>> updateEntry(
            @PathVariable Long entryId,
            @RequestHeader(MEMBER_HEADER) Long memberId,
            @Valid @RequestBody EntryRequest request) {
        return ResponseEntity.ok(CommonResponse.success(contributionService.updateEntry(entryId, memberId, request)));
    }

    @DeleteMapping("/{entryId}")
    public ResponseEntity<CommonResponse<WithdrawResultDTO>> withdrawEntry(
            @PathVariable Long entryId,
            @RequestHeader(MEMBER_HEADER) Long memberId) {
        return ResponseEntity.ok(CommonResponse.success(contributionService.withdrawEntry(entryId, memberId)));
    }

    /**
     * POST /api/entries/{id}/vote {"vote_type": 1 | -1}; repeating a vote removes it
     */
    @PostMapping("/{entryId}/vote")
    public ResponseEntity<CommonResponse<VoteResultDTO>> vote(
            @PathVariable Long entryId,
            @RequestHeader(MEMBER_HEADER) Long memberId,
            @Valid @RequestBody VoteRequest request) {
        return ResponseEntity.ok(CommonResponse.success(contributionService.castVote(entryId, memberId, request)));
    }

    /**
     * POST /api/entries/{id}/verify {"verification_type": "accurate", "comments": "..."}
     */
    @PostMapping("/{entryId}/verify")
    public ResponseEntity<CommonResponse<VerificationResultDTO>> verify(
            @PathVariable Long entryId,
            @RequestHeader(MEMBER_HEADER) Long memberId,
            @Valid @RequestBody VerificationRequest request) {
        VerificationResultDTO result = contributionService.submitVerification(entryId, memberId, request);
        return ResponseEntity.ok(CommonResponse.success(result, result.getMessage()));
    }

    @PostMapping("/{entryId}/moderate")
    public ResponseEntity<CommonResponse<EntryDTO>> moderate(
            @PathVariable Long entryId,
            @RequestHeader(MEMBER_HEADER) Long memberId,
            @Valid @RequestBody ModerationRequest request) {
        return ResponseEntity.ok(CommonResponse.success(contributionService.moderateEntry(entryId, memberId, request)));
    }
}
