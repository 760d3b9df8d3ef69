package com.community.kolokwa.controller;

import com.community.kolokwa.dto.CommonResponse;
import com.community.kolokwa.dto.ReconciliationReportDTO;
import com.community.kolokwa.service.ReconciliationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/admin")
public class AdminController {

    private final ReconciliationService reconciliationService;

    public AdminController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    /**
     * POST /api/admin/reconcile?dry_run=true: staff only; mutating requests get 423 meanwhile
     */
    @PostMapping("/reconcile")
    public ResponseEntity<CommonResponse<ReconciliationReportDTO>> reconcile(
            @RequestHeader(EntryController.MEMBER_HEADER) Long memberId,
            @RequestParam(value = "dry_run", defaultValue = "false") boolean dryRun) {
        return ResponseEntity.ok(CommonResponse.success(reconciliationService.reconcileAs(memberId, dryRun)));
    }
}
