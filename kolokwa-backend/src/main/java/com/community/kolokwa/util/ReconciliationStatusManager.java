package com.community.kolokwa.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-wide flag telling the web layer that reconciliation is rewriting counters.
 */
@Component
public class ReconciliationStatusManager {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationStatusManager.class);

    private final AtomicBoolean inProgress = new AtomicBoolean(false);

    /**
     * @return false when another run already holds the flag
     */
    public boolean tryStart() {
        boolean started = inProgress.compareAndSet(false, true);
        if (started) {
            log.info("Reconciliation status set to: running");
        }
        return started;
    }

    public void finish() {
        inProgress.set(false);
        log.info("Reconciliation status set to: idle");
    }

    public boolean isReconciliationInProgress() {
        return inProgress.get();
    }
}
