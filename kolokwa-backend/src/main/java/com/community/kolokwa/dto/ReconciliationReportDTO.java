package com.community.kolokwa.dto;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Outcome of one reconciliation run. In a dry run the counts are what would have been corrected.
 */
@Data
@Builder
public class ReconciliationReportDTO {

    private boolean dryRun;

    private LocalDateTime startedAt;

    private Long durationMs;

    // step 1: entries whose upvotes/downvotes/verification_count drifted
    private Integer entriesCorrected;

    // step 2: verified entries missing their contribution_verified grant
    private Integer rewardsRepaired;

    // step 3: members whose contribution/verification counters drifted
    private Integer memberCountersCorrected;

    // step 4: members whose balance or level drifted from the ledger
    private Integer balancesCorrected;

    // badges granted by re-evaluation after corrections
    private Integer badgesGranted;
}
