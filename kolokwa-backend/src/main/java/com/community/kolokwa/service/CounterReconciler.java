package com.community.kolokwa.service;

import com.community.kolokwa.config.KolokwaProperties;
import com.community.kolokwa.dto.ReconciliationReportDTO;
import com.community.kolokwa.entity.DictionaryEntry;
import com.community.kolokwa.entity.EntryStatus;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.MemberLevel;
import com.community.kolokwa.entity.VerificationType;
import com.community.kolokwa.entity.VoteType;
import com.community.kolokwa.repository.DictionaryEntryRepository;
import com.community.kolokwa.repository.EntryVerificationRepository;
import com.community.kolokwa.repository.EntryVoteRepository;
import com.community.kolokwa.repository.MemberRepository;
import com.community.kolokwa.repository.PointTransactionRepository;
import com.community.kolokwa.util.ProgressBar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Rebuilds the denormalized counters from ledger truth, in four steps:
 * entry counters, missing contribution_verified grants, member counters, point balances.
 * Badges are re-evaluated last, for every member any step corrected.
 */
@Service
public class CounterReconciler {

    private static final Logger log = LoggerFactory.getLogger(CounterReconciler.class);

    private final DictionaryEntryRepository entryRepository;
    private final EntryVoteRepository voteRepository;
    private final EntryVerificationRepository verificationRepository;
    private final MemberRepository memberRepository;
    private final PointTransactionRepository transactionRepository;
    private final KolokwaProperties properties;
    private final BadgeEvaluationService badgeEvaluationService;
    private final PointLedgerService pointLedgerService;
    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public CounterReconciler(DictionaryEntryRepository entryRepository,
                             EntryVoteRepository voteRepository,
                             EntryVerificationRepository verificationRepository,
                             MemberRepository memberRepository,
                             PointTransactionRepository transactionRepository,
                             KolokwaProperties properties,
                             BadgeEvaluationService badgeEvaluationService,
                             PointLedgerService pointLedgerService,
                             JdbcTemplate jdbcTemplate,
                             Clock clock) {
        this.entryRepository = entryRepository;
        this.voteRepository = voteRepository;
        this.verificationRepository = verificationRepository;
        this.memberRepository = memberRepository;
        this.transactionRepository = transactionRepository;
        this.properties = properties;
        this.badgeEvaluationService = badgeEvaluationService;
        this.pointLedgerService = pointLedgerService;
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    /**
     * Runs all four steps in one transaction.
     * <p>
     * A dry run reads and logs every drift it finds but writes nothing, so its report holds
     * what a real run would correct. A real run re-evaluates badges only after the last step,
     * for the members whose counters, balances or rewards were touched, so no badge is granted
     * from a value that is about to be corrected.
     *
     * @param dryRun report only
     * @return per-step correction counts
     */
    @Transactional
    public ReconciliationReportDTO run(boolean dryRun) {
        LocalDateTime startedAt = LocalDateTime.now(clock);
        ProgressBar progressBar = new ProgressBar(dryRun ? "Reconciliation (dry run)" : "Reconciliation", 4);

        int entries = reconcileEntryCounters(dryRun);
        progressBar.step();

        Set<Long> touched = new TreeSet<>();
        int repaired = repairVerificationRewards(dryRun, touched);
        progressBar.step();

        int memberCounters = reconcileMemberCounters(dryRun, touched);
        progressBar.step();

        int balances = reconcileBalances(dryRun, touched);
        // badges last, once counters and balances agree with the ledgers
        int badges = dryRun ? 0 : reevaluateBadges(touched);
        long duration = progressBar.complete();

        ReconciliationReportDTO report = ReconciliationReportDTO.builder()
                .dryRun(dryRun)
                .startedAt(startedAt)
                .durationMs(duration)
                .entriesCorrected(entries)
                .rewardsRepaired(repaired)
                .memberCountersCorrected(memberCounters)
                .badgesGranted(badges)
                .balancesCorrected(balances)
                .build();
        log.info("Reconciliation finished (dryRun={}): {} entries, {} rewards, {} member counters, {} balances, {} badges",
                dryRun, entries, repaired, memberCounters, balances, badges);
        return report;
    }

    /**
     * Step 1: upvotes, downvotes and verification_count from the vote and verification rows.
     */
    int reconcileEntryCounters(boolean dryRun) {
        Map<Long, int[]> votes = new HashMap<>();
        for (Object[] row : voteRepository.countGroupByEntryAndType()) {
            int[] counts = votes.computeIfAbsent(toLong(row[0]), id -> new int[2]);
            int index = toInt(row[1]) == VoteType.UPVOTE.getValue() ? 0 : 1;
            counts[index] = toInt(row[2]);
        }
        Map<Long, Integer> accurate = new HashMap<>();
        for (Object[] row : verificationRepository.countGroupByEntryForType(VerificationType.ACCURATE)) {
            accurate.put(toLong(row[0]), toInt(row[1]));
        }

        List<Object[]> corrections = new ArrayList<>();
        for (Object[] row : entryRepository.findAllCounters()) {
            Long entryId = toLong(row[0]);
            int[] counts = votes.getOrDefault(entryId, new int[2]);
            int verified = accurate.getOrDefault(entryId, 0);
            if (counts[0] != toInt(row[1]) || counts[1] != toInt(row[2]) || verified != toInt(row[3])) {
                log.warn("Entry {} counters drifted: stored +{}/-{}/{} , ledger +{}/-{}/{}", entryId,
                        row[1], row[2], row[3], counts[0], counts[1], verified);
                corrections.add(new Object[]{counts[0], counts[1], verified, entryId});
            }
        }

        if (!dryRun && !corrections.isEmpty()) {
            jdbcTemplate.batchUpdate(
                    "UPDATE koloqua_entries SET upvotes = ?, downvotes = ?, verification_count = ? WHERE entry_id = ?",
                    corrections);
        }
        return corrections.size();
    }

    /**
     * Step 2: every verified entry with a contributor has its contribution_verified grant.
     * The grant goes straight to the ledger; the contributor's badges wait for the final pass.
     */
    int repairVerificationRewards(boolean dryRun, Set<Long> touched) {
        int repaired = 0;
        for (DictionaryEntry entry : entryRepository.findByStatusAndContributorIdIsNotNull(EntryStatus.VERIFIED)) {
            String key = VerificationLedgerService.contributionVerifiedKey(entry.getId());
            if (transactionRepository.existsByIdempotencyKey(key)) {
                continue;
            }
            Member contributor = memberRepository.findByIdForUpdate(entry.getContributorId()).orElse(null);
            if (contributor == null) {
                continue;
            }
            repaired++;
            log.warn("Entry {} is verified but contributor {} was never rewarded", entry.getId(), contributor.getMemberId());
            if (!dryRun) {
                RewardRule rule = RewardRule.CONTRIBUTION_VERIFIED;
                pointLedgerService.append(contributor, rule.amount(properties), rule.getTransactionType(),
                        "Your contribution '" + entry.getKoloquaText() + "' was verified", key);
                touched.add(contributor.getMemberId());
            }
        }
        return repaired;
    }

    /**
     * Step 3: contributions_count and verifications_count.
     */
    int reconcileMemberCounters(boolean dryRun, Set<Long> touched) {
        Map<Long, Integer> contributions = toCountMap(entryRepository.countGroupByContributor());
        Map<Long, Integer> verifications = toCountMap(verificationRepository.countGroupByVerifier());

        int corrected = 0;
        for (Long memberId : memberRepository.findAllIdsOrderById()) {
            Member member = memberRepository.findByIdForUpdate(memberId).orElse(null);
            if (member == null) {
                continue;
            }
            int expectedContributions = contributions.getOrDefault(memberId, 0);
            int expectedVerifications = verifications.getOrDefault(memberId, 0);
            if (member.getContributionsCount() == expectedContributions
                    && member.getVerificationsCount() == expectedVerifications) {
                continue;
            }
            corrected++;
            log.warn("Member {} counters drifted: contributions {} -> {}, verifications {} -> {}", memberId,
                    member.getContributionsCount(), expectedContributions,
                    member.getVerificationsCount(), expectedVerifications);
            if (!dryRun) {
                member.setContributionsCount(expectedContributions);
                member.setVerificationsCount(expectedVerifications);
                memberRepository.save(member);
                touched.add(memberId);
            }
        }
        return corrected;
    }

    /**
     * Step 4: balance equals the ledger sum, level follows the balance.
     */
    int reconcileBalances(boolean dryRun, Set<Long> touched) {
        Map<Long, Integer> sums = toCountMap(transactionRepository.sumGroupByMember());

        int corrected = 0;
        for (Long memberId : memberRepository.findAllIdsOrderById()) {
            Member member = memberRepository.findByIdForUpdate(memberId).orElse(null);
            if (member == null) {
                continue;
            }
            int expected = sums.getOrDefault(memberId, 0);
            boolean levelDrift = member.getLevel() != MemberLevel.fromPoints(expected);
            if (member.getPoints() == expected && !levelDrift) {
                continue;
            }
            corrected++;
            log.warn("Member {} balance drifted: stored {} ({}), ledger {}", memberId,
                    member.getPoints(), member.getLevel(), expected);
            if (!dryRun) {
                member.setPoints(expected);
                pointLedgerService.applyLevel(member);
                memberRepository.save(member);
                touched.add(memberId);
            }
        }
        return corrected;
    }

    private int reevaluateBadges(Set<Long> memberIds) {
        int granted = 0;
        for (Long memberId : memberIds) {
            Member member = memberRepository.findByIdForUpdate(memberId).orElse(null);
            if (member != null) {
                granted += badgeEvaluationService.evaluate(member).size();
            }
        }
        return granted;
    }

    private static Map<Long, Integer> toCountMap(List<Object[]> rows) {
        Map<Long, Integer> map = new HashMap<>();
        for (Object[] row : rows) {
            map.put(toLong(row[0]), toInt(row[1]));
        }
        return map;
    }

    private static Long toLong(Object value) {
        return ((Number) value).longValue();
    }

    private static int toInt(Object value) {
        return value == null ? 0 : ((Number) value).intValue();
    }
}
