package com.community.kolokwa.service;

import com.community.kolokwa.dto.ReconciliationReportDTO;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.exception.ConflictException;
import com.community.kolokwa.exception.ForbiddenException;
import com.community.kolokwa.exception.NotFoundException;
import com.community.kolokwa.repository.MemberRepository;
import com.community.kolokwa.util.ReconciliationStatusManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Runs {@link CounterReconciler} nightly and on demand. While a run is active the web layer
 * refuses mutating requests with 423.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final CounterReconciler counterReconciler;
    private final ReconciliationStatusManager statusManager;
    private final MemberRepository memberRepository;

    public ReconciliationService(CounterReconciler counterReconciler,
                                 ReconciliationStatusManager statusManager,
                                 MemberRepository memberRepository) {
        this.counterReconciler = counterReconciler;
        this.statusManager = statusManager;
        this.memberRepository = memberRepository;
    }

    @Scheduled(cron = "${kolokwa.reconciliation.cron}")
    public void scheduledReconciliation() {
        log.info("--- Nightly reconciliation started ---");
        try {
            reconcile(false);
        } catch (ConflictException ex) {
            log.warn("Nightly reconciliation skipped: {}", ex.getMessage());
        } catch (RuntimeException ex) {
            log.error("Nightly reconciliation failed: {}", ex.getMessage(), ex);
        }
    }

    /**
     * On-demand run, staff only.
     */
    public ReconciliationReportDTO reconcileAs(Long actorId, boolean dryRun) {
        Member actor = memberRepository.findById(actorId)
                .orElseThrow(() -> new NotFoundException("Member not found: " + actorId));
        if (!actor.isStaff()) {
            log.warn("Member {} is not staff, reconciliation refused", actorId);
            throw new ForbiddenException("Only staff can run reconciliation");
        }
        return reconcile(dryRun);
    }

    public ReconciliationReportDTO reconcile(boolean dryRun) {
        if (!statusManager.tryStart()) {
            throw new ConflictException("Reconciliation is already running");
        }
        try {
            return counterReconciler.run(dryRun);
        } finally {
            statusManager.finish();
        }
    }
}
