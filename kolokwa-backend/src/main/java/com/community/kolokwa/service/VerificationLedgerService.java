package com.community.kolokwa.service;

import com.community.kolokwa.dto.VerificationResultDTO;
import com.community.kolokwa.entity.DictionaryEntry;
import com.community.kolokwa.entity.EntryVerification;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.VerificationType;
import com.community.kolokwa.exception.ForbiddenException;
import com.community.kolokwa.repository.EntryVerificationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * One verification per (entry, verifier); a resubmission overwrites the previous one.
 * Every grant carries an idempotency key derived from (entry, verifier, classification),
 * so replaying the same verification pays nothing twice.
 * The caller holds the entry lock and the verifier and contributor locks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class VerificationLedgerService {

    static final String MESSAGE_VERIFIED = "Entry has been verified!";
    static final String MESSAGE_REJECTED = "Entry has been rejected due to multiple negative verifications.";
    static final String MESSAGE_THANKS = "Thank you for your verification!";

    private final EntryVerificationRepository verificationRepository;
    private final EntryStateMachine stateMachine;
    private final RewardService rewardService;
    private final StreakService streakService;
    private final Clock clock;

    /**
     * @param contributor null when the entry has no contributor
     */
    public VerificationResultDTO submit(DictionaryEntry entry, Member verifier, Member contributor,
                                        VerificationType type, String comments) {
        if (entry.getContributorId() != null && entry.getContributorId().equals(verifier.getMemberId())) {
            throw new ForbiddenException("You cannot verify your own entry");
        }

        // 1. upsert the ledger row
        boolean changed = upsert(entry, verifier, type, comments);

        // 2. accurate count always comes from the ledger
        int accurate = (int) verificationRepository.countByEntryIdAndVerificationType(entry.getId(), VerificationType.ACCURATE);
        if (accurate != entry.getVerificationCount()) {
            entry.setVerificationCount(accurate);
            changed = true;
        }

        // 3. transitions and rewards
        String keyBase = entry.getId() + ":" + verifier.getMemberId() + ":" + type.getCode();
        String verifierKey = "verification:" + keyBase;
        String text = entry.getKoloquaText();
        String message = MESSAGE_THANKS;

        switch (type) {
            case ACCURATE -> {
                if (stateMachine.shouldAutoVerify(entry)) {
                    stateMachine.markVerified(entry);
                    rewardService.award(verifier, RewardRule.VERIFYING_VERIFICATION,
                            "Your verification published '" + text + "'", verifierKey);
                    if (contributor != null) {
                        rewardContributorForVerifiedEntry(entry, contributor);
                    }
                    message = MESSAGE_VERIFIED;
                    changed = true;
                } else {
                    boolean granted = rewardService.award(verifier, RewardRule.ACCURATE_VERIFICATION,
                            "Verified '" + text + "' as accurate", verifierKey);
                    if (granted && contributor != null) {
                        rewardService.award(contributor, RewardRule.VERIFICATION_RECEIVED,
                                "Your entry '" + text + "' was confirmed by a reviewer",
                                "verification_received:" + keyBase);
                    }
                }
            }
            case INCORRECT -> {
                long incorrect = verificationRepository.countByEntryIdAndVerificationType(entry.getId(), VerificationType.INCORRECT);
                if (stateMachine.shouldAutoReject(entry, incorrect)) {
                    stateMachine.markRejected(entry);
                    message = MESSAGE_REJECTED;
                    changed = true;
                }
                rewardService.award(verifier, RewardRule.REVIEW, "Reviewed '" + text + "'", verifierKey);
            }
            case NEEDS_REVISION -> rewardService.award(verifier, RewardRule.REVIEW,
                    "Reviewed '" + text + "'", verifierKey);
        }

        if (changed) {
            entry.setUpdatedAt(LocalDateTime.now(clock));
        }
        log.debug("Entry {} verified as {} by member {}: status {}, accurate {}", entry.getId(), type.getCode(),
                verifier.getMemberId(), entry.getStatus().getCode(), entry.getVerificationCount());
        return new VerificationResultDTO(entry.getVerificationCount(), entry.getStatus().getCode(), message);
    }

    /**
     * Applies the verify and reject thresholds to an entry that has just re-entered review.
     * Verifications recorded while the entry was in needs_revision count toward both.
     * If both thresholds hold, verification wins.
     *
     * @param contributor null when the entry has no contributor
     * @return true if the entry left the pending state
     */
    public boolean recheckThresholds(DictionaryEntry entry, Member contributor) {
        // 1. counters from the ledger
        int accurate = (int) verificationRepository.countByEntryIdAndVerificationType(entry.getId(), VerificationType.ACCURATE);
        entry.setVerificationCount(accurate);

        // 2. verify
        if (stateMachine.shouldAutoVerify(entry)) {
            stateMachine.markVerified(entry);
            if (contributor != null) {
                rewardContributorForVerifiedEntry(entry, contributor);
            }
            log.info("Entry {} verified on re-entering review ({} accurate)", entry.getId(), accurate);
            return true;
        }

        // 3. reject
        long incorrect = verificationRepository.countByEntryIdAndVerificationType(entry.getId(), VerificationType.INCORRECT);
        if (stateMachine.shouldAutoReject(entry, incorrect)) {
            stateMachine.markRejected(entry);
            log.info("Entry {} rejected on re-entering review ({} incorrect)", entry.getId(), incorrect);
            return true;
        }
        return false;
    }

    /**
     * Streak touch and the once-per-entry contribution_verified grant. Also used by moderation.
     */
    public void rewardContributorForVerifiedEntry(DictionaryEntry entry, Member contributor) {
        streakService.touch(contributor);
        rewardService.award(contributor, RewardRule.CONTRIBUTION_VERIFIED,
                "Your contribution '" + entry.getKoloquaText() + "' was verified",
                contributionVerifiedKey(entry.getId()));
    }

    public static String contributionVerifiedKey(Long entryId) {
        return "contribution_verified:" + entryId;
    }

    private boolean upsert(DictionaryEntry entry, Member verifier, VerificationType type, String comments) {
        LocalDateTime now = LocalDateTime.now(clock);
        EntryVerification existing = verificationRepository
                .findByEntryIdAndVerifierId(entry.getId(), verifier.getMemberId())
                .orElse(null);

        if (existing == null) {
            verificationRepository.save(EntryVerification.builder()
                    .entryId(entry.getId())
                    .verifierId(verifier.getMemberId())
                    .verificationType(type)
                    .comments(comments)
                    .createdAt(now)
                    .updatedAt(now)
                    .build());
            verifier.setVerificationsCount(verifier.getVerificationsCount() + 1);
            return true;
        }

        if (existing.getVerificationType() == type && Objects.equals(existing.getComments(), comments)) {
            return false;
        }
        existing.setVerificationType(type);
        existing.setComments(comments);
        existing.setUpdatedAt(now);
        verificationRepository.save(existing);
        return true;
    }
}
