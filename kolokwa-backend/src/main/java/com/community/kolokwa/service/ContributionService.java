package com.community.kolokwa.service;

import com.community.kolokwa.dto.EntryDTO;
import com.community.kolokwa.dto.EntryRequest;
import com.community.kolokwa.dto.ModerationRequest;
import com.community.kolokwa.dto.VerificationRequest;
import com.community.kolokwa.dto.VerificationResultDTO;
import com.community.kolokwa.dto.VoteRequest;
import com.community.kolokwa.dto.VoteResultDTO;
import com.community.kolokwa.dto.WithdrawResultDTO;
import com.community.kolokwa.entity.DictionaryEntry;
import com.community.kolokwa.entity.EntryStatus;
import com.community.kolokwa.entity.EntryType;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.VerificationType;
import com.community.kolokwa.entity.VoteType;
import com.community.kolokwa.exception.ConflictException;
import com.community.kolokwa.exception.DependencyException;
import com.community.kolokwa.exception.ForbiddenException;
import com.community.kolokwa.exception.KolokwaException;
import com.community.kolokwa.exception.NotFoundException;
import com.community.kolokwa.exception.ValidationException;
import com.community.kolokwa.repository.DictionaryEntryRepository;
import com.community.kolokwa.repository.EntryEmbeddingRepository;
import com.community.kolokwa.repository.EntryVerificationRepository;
import com.community.kolokwa.repository.EntryVoteRepository;
import com.community.kolokwa.repository.MemberRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Every dictionary mutation goes through here, one database transaction per call.
 * Lock order: the entry row first, then member rows by ascending id.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional
public class ContributionService {

    private final DictionaryEntryRepository entryRepository;
    private final MemberRepository memberRepository;
    private final EntryVoteRepository voteRepository;
    private final EntryVerificationRepository verificationRepository;
    private final EntryEmbeddingRepository embeddingRepository;
    private final VoteLedgerService voteLedgerService;
    private final VerificationLedgerService verificationLedgerService;
    private final RewardService rewardService;
    private final StreakService streakService;
    private final EntryStateMachine stateMachine;
    private final Clock clock;

    // ===== Submit =====

    public EntryDTO submitEntry(Long contributorId, EntryRequest request) {
        // 1. validate before taking any lock
        String text = required(request.getKoloquaText(), "Kolokwa text is required");
        String translation = required(request.getEnglishTranslation(), "English translation is required");
        EntryType entryType = EntryType.fromCode(request.getEntryType());

        Member contributor = lockMember(contributorId);

        // 2. duplicate check among live entries
        checkDuplicate(text, contributorId, null);

        // 3. create
        LocalDateTime now = LocalDateTime.now(clock);
        DictionaryEntry entry = DictionaryEntry.builder()
                .koloquaText(text)
                .englishTranslation(translation)
                .entryType(entryType)
                .contributorId(contributorId)
                .status(EntryStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        applyOptionalFields(entry, request);
        entry = saveEntry(entry, "You have already submitted '" + text + "'.");

        contributor.setContributionsCount(contributor.getContributionsCount() + 1);

        // 4. streak first so badge checks see it, then the reward
        DictionaryEntry created = entry;
        inRewardPipeline("submit entry " + created.getId(), () -> {
            streakService.touch(contributor);
            return rewardService.award(contributor, RewardRule.NEW_CONTRIBUTION,
                    "New contribution: '" + text + "'", "contribution:" + created.getId());
        });

        log.info("Member {} submitted entry {} '{}'", contributorId, created.getId(), text);
        return EntryMapper.toDTO(created);
    }

    // ===== Vote =====

    public VoteResultDTO castVote(Long entryId, Long voterId, VoteRequest request) {
        VoteType voteType = VoteType.fromValue(request.getVoteType());

        DictionaryEntry entry = lockEntry(entryId);
        if (entry.getStatus() == EntryStatus.REJECTED) {
            throw new NotFoundException("Entry not found: " + entryId);
        }

        Map<Long, Member> members = lockMembers(voterId, entry.getContributorId());
        Member voter = requireMember(members, voterId);
        Member contributor = members.get(entry.getContributorId());

        return inRewardPipeline("vote on entry " + entryId,
                () -> voteLedgerService.castVote(entry, voter, contributor, voteType));
    }

    // ===== Verify =====

    public VerificationResultDTO submitVerification(Long entryId, Long verifierId, VerificationRequest request) {
        VerificationType type = VerificationType.fromCode(request.getVerificationType());

        DictionaryEntry entry = lockEntry(entryId);
        if (Objects.equals(entry.getContributorId(), verifierId)) {
            log.warn("Member {} tried to verify own entry {}", verifierId, entryId);
            throw new ForbiddenException("You cannot verify your own entry");
        }

        Map<Long, Member> members = lockMembers(verifierId, entry.getContributorId());
        Member verifier = requireMember(members, verifierId);
        Member contributor = members.get(entry.getContributorId());

        return inRewardPipeline("verify entry " + entryId,
                () -> verificationLedgerService.submit(entry, verifier, contributor, type, request.getComments()));
    }

    // ===== Edit =====

    public EntryDTO updateEntry(Long entryId, Long actorId, EntryRequest request) {
        String text = required(request.getKoloquaText(), "Kolokwa text is required");
        String translation = required(request.getEnglishTranslation(), "English translation is required");
        EntryType entryType = EntryType.fromCode(request.getEntryType());

        DictionaryEntry entry = lockEntry(entryId);
        Map<Long, Member> members = lockMembers(actorId, entry.getContributorId());
        Member actor = requireMember(members, actorId);
        requireOwnerOrStaff(entry, actor, "edit");
        if (entry.getStatus() == EntryStatus.REJECTED) {
            throw new ConflictException("Rejected entries cannot be edited");
        }

        if (!text.equalsIgnoreCase(entry.getKoloquaText())) {
            checkDuplicate(text, entry.getContributorId(), entryId);
        }

        entry.setKoloquaText(text);
        entry.setEnglishTranslation(translation);
        entry.setEntryType(entryType);
        applyOptionalFields(entry, request);
        entry.setUpdatedAt(LocalDateTime.now(clock));

        if (entry.getStatus() == EntryStatus.NEEDS_REVISION) {
            stateMachine.transition(entry, EntryStatus.PENDING);
            // verifications kept arriving while it was out for revision
            Member contributor = members.get(entry.getContributorId());
            inRewardPipeline("re-review entry " + entryId,
                    () -> verificationLedgerService.recheckThresholds(entry, contributor));
        } else {
            stateMachine.contentChanged(entry);
        }
        DictionaryEntry saved = saveEntry(entry, "You have already submitted '" + text + "'.");

        log.info("Member {} edited entry {}", actorId, entryId);
        return EntryMapper.toDTO(saved);
    }

    // ===== Withdraw =====

    public WithdrawResultDTO withdrawEntry(Long entryId, Long actorId) {
        DictionaryEntry entry = lockEntry(entryId);
        Map<Long, Member> members = lockMembers(actorId, entry.getContributorId());
        Member actor = requireMember(members, actorId);
        requireOwnerOrStaff(entry, actor, "withdraw");

        boolean referenced = voteRepository.existsByEntryId(entryId) || verificationRepository.existsByEntryId(entryId);

        if (!referenced) {
            // no community activity yet: remove it outright
            Member contributor = members.get(entry.getContributorId());
            if (contributor != null) {
                contributor.setContributionsCount(Math.max(0, contributor.getContributionsCount() - 1));
            }
            if (embeddingRepository.existsById(entryId)) {
                embeddingRepository.deleteById(entryId);
            }
            entryRepository.delete(entry);
            log.info("Member {} withdrew entry {} (deleted)", actorId, entryId);
            return new WithdrawResultDTO(entryId, true, null);
        }

        if (entry.getStatus() == EntryStatus.VERIFIED) {
            throw new ConflictException("Verified entries with community activity cannot be withdrawn");
        }
        if (entry.getStatus() == EntryStatus.REJECTED) {
            throw new ConflictException("Entry has already been withdrawn or rejected");
        }
        stateMachine.markRejected(entry);
        log.info("Member {} withdrew entry {} (marked rejected)", actorId, entryId);
        return new WithdrawResultDTO(entryId, false, entry.getStatus().getCode());
    }

    // ===== Moderate =====

    public EntryDTO moderateEntry(Long entryId, Long moderatorId, ModerationRequest request) {
        EntryStatus target = EntryStatus.fromCode(request.getStatus());

        DictionaryEntry entry = lockEntry(entryId);
        Map<Long, Member> members = lockMembers(moderatorId, entry.getContributorId());
        Member moderator = requireMember(members, moderatorId);
        if (!moderator.isStaff()) {
            log.warn("Member {} is not staff, moderation of entry {} refused", moderatorId, entryId);
            throw new ForbiddenException("Only staff can moderate entries");
        }

        if (target == EntryStatus.VERIFIED) {
            Member contributor = members.get(entry.getContributorId());
            inRewardPipeline("moderate entry " + entryId, () -> {
                stateMachine.markVerified(entry);
                if (contributor != null) {
                    verificationLedgerService.rewardContributorForVerifiedEntry(entry, contributor);
                }
                return null;
            });
        } else {
            stateMachine.transition(entry, target);
        }

        log.info("Moderator {} set entry {} to {}", moderatorId, entryId, target.getCode());
        return EntryMapper.toDTO(entry);
    }

    // ===== Helpers =====

    private DictionaryEntry lockEntry(Long entryId) {
        return entryRepository.findByIdForUpdate(entryId)
                .orElseThrow(() -> new NotFoundException("Entry not found: " + entryId));
    }

    private Member lockMember(Long memberId) {
        return memberRepository.findByIdForUpdate(memberId)
                .orElseThrow(() -> new NotFoundException("Member not found: " + memberId));
    }

    /**
     * Locks the given members in ascending id order. Null ids and missing rows are skipped.
     */
    private Map<Long, Member> lockMembers(Long... memberIds) {
        Map<Long, Member> locked = new HashMap<>();
        Arrays.stream(memberIds)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .forEach(id -> memberRepository.findByIdForUpdate(id).ifPresent(m -> locked.put(id, m)));
        return locked;
    }

    private static Member requireMember(Map<Long, Member> members, Long memberId) {
        Member member = members.get(memberId);
        if (member == null) {
            throw new NotFoundException("Member not found: " + memberId);
        }
        return member;
    }

    private static void requireOwnerOrStaff(DictionaryEntry entry, Member actor, String action) {
        if (!actor.isStaff() && !Objects.equals(entry.getContributorId(), actor.getMemberId())) {
            log.warn("Member {} may not {} entry {}", actor.getMemberId(), action, entry.getId());
            throw new ForbiddenException("Only the contributor or staff can " + action + " this entry");
        }
    }

    private static String required(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(message);
        }
        return value.trim();
    }

    private void checkDuplicate(String text, Long contributorId, Long ignoredEntryId) {
        List<DictionaryEntry> existing = entryRepository.findByTextIgnoreCaseAndStatusNot(text, EntryStatus.REJECTED)
                .stream()
                .filter(e -> !e.getId().equals(ignoredEntryId))
                .toList();
        if (existing.isEmpty()) {
            return;
        }
        if (existing.stream().anyMatch(e -> e.getStatus() == EntryStatus.VERIFIED)) {
            throw new ConflictException("'" + text + "' already exists in the dictionary. Please search for it to view or vote on it.");
        }
        if (existing.stream().anyMatch(e -> Objects.equals(e.getContributorId(), contributorId))) {
            throw new ConflictException("You have already submitted '" + text + "' and it is pending review.");
        }
        throw new ConflictException("'" + text + "' has already been submitted by someone else and is pending review.");
    }

    private DictionaryEntry saveEntry(DictionaryEntry entry, String conflictMessage) {
        try {
            return entryRepository.saveAndFlush(entry);
        } catch (DataIntegrityViolationException e) {
            log.warn("Entry '{}' violates a unique constraint: {}", entry.getKoloquaText(), e.getMostSpecificCause().getMessage());
            throw new ConflictException(conflictMessage);
        }
    }

    private static void applyOptionalFields(DictionaryEntry entry, EntryRequest request) {
        entry.setLiteralTranslation(trimToNull(request.getLiteralTranslation()));
        entry.setContextExplanation(trimToNull(request.getContextExplanation()));
        entry.setExampleSentenceKoloqua(trimToNull(request.getExampleSentenceKoloqua()));
        entry.setExampleSentenceEnglish(trimToNull(request.getExampleSentenceEnglish()));
        entry.setCulturalNotes(trimToNull(request.getCulturalNotes()));
        entry.setPronunciationGuide(trimToNull(request.getPronunciationGuide()));
        entry.setRegionSpecific(trimToNull(request.getRegionSpecific()));
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    /**
     * Runs points, badges and streaks. Domain errors pass through; anything unexpected is
     * logged and rethrown as {@link DependencyException}, rolling the whole call back.
     */
    private <T> T inRewardPipeline(String action, Supplier<T> body) {
        try {
            return body.get();
        } catch (KolokwaException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Reward pipeline failed during {}, rolling back", action, e);
            throw new DependencyException("Could not " + action + ", please try again", e);
        }
    }
}
