package com.community.kolokwa.service;

import com.community.kolokwa.config.KolokwaProperties;
import com.community.kolokwa.entity.DictionaryEntry;
import com.community.kolokwa.entity.EntryStatus;
import com.community.kolokwa.event.EntryPublishedEvent;
import com.community.kolokwa.exception.ConflictException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Status transitions of a dictionary entry. Rewards are the caller's business.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntryStateMachine {

    private final KolokwaProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public boolean shouldAutoVerify(DictionaryEntry entry) {
        return entry.getStatus() == EntryStatus.PENDING
                && entry.getVerificationCount() >= properties.getThresholds().getVerify();
    }

    public boolean shouldAutoReject(DictionaryEntry entry, long incorrectCount) {
        return entry.getStatus() == EntryStatus.PENDING
                && incorrectCount >= properties.getThresholds().getReject();
    }

    /**
     * Moves the entry to verified; verified_at is only ever set here, and only once.
     */
    public void markVerified(DictionaryEntry entry) {
        transition(entry, EntryStatus.VERIFIED);
        if (entry.getVerifiedAt() == null) {
            entry.setVerifiedAt(LocalDateTime.now(clock));
        }
        eventPublisher.publishEvent(new EntryPublishedEvent(entry.getId()));
    }

    public void markRejected(DictionaryEntry entry) {
        transition(entry, EntryStatus.REJECTED);
    }

    public void transition(DictionaryEntry entry, EntryStatus target) {
        EntryStatus current = entry.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new ConflictException("Cannot change entry status from " + current.getCode()
                    + " to " + target.getCode());
        }
        entry.setStatus(target);
        entry.setUpdatedAt(LocalDateTime.now(clock));
        log.info("Entry {} status {} -> {}", entry.getId(), current.getCode(), target.getCode());
    }

    /**
     * A published entry's text changed; its search vector must be rebuilt.
     */
    public void contentChanged(DictionaryEntry entry) {
        if (entry.getStatus() == EntryStatus.VERIFIED) {
            eventPublisher.publishEvent(new EntryPublishedEvent(entry.getId()));
        }
    }
}
