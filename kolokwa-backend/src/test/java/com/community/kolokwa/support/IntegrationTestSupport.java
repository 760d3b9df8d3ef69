package com.community.kolokwa.support;

import com.community.kolokwa.KolokwaBackendApplication;
import com.community.kolokwa.dto.EntryRequest;
import com.community.kolokwa.dto.EntryDTO;
import com.community.kolokwa.dto.VerificationRequest;
import com.community.kolokwa.dto.VerificationResultDTO;
import com.community.kolokwa.dto.VoteRequest;
import com.community.kolokwa.dto.VoteResultDTO;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.PointTransaction;
import com.community.kolokwa.entity.TransactionType;
import com.community.kolokwa.repository.*;
import com.community.kolokwa.service.ContributionService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Shared setup of the H2-backed integration tests. Tests are not transactional: every
 * service call commits, so after-commit listeners and row locks behave as in production.
 */
@SpringBootTest(classes = {KolokwaBackendApplication.class, TestClockConfig.class})
@AutoConfigureMockMvc
@ActiveProfiles("test")
public abstract class IntegrationTestSupport {

    @Autowired
    protected MutableClock clock;

    @Autowired
    protected ContributionService contributionService;

    @Autowired
    protected MemberRepository memberRepository;

    @Autowired
    protected DictionaryEntryRepository entryRepository;

    @Autowired
    protected EntryVoteRepository voteRepository;

    @Autowired
    protected EntryVerificationRepository verificationRepository;

    @Autowired
    protected PointTransactionRepository transactionRepository;

    @Autowired
    protected UserBadgeRepository userBadgeRepository;

    @Autowired
    protected UserStreakRepository streakRepository;

    @Autowired
    protected DailyChallengeRepository challengeRepository;

    @Autowired
    protected EntryEmbeddingRepository embeddingRepository;

    @BeforeEach
    void cleanDatabase() {
        clock.reset();
        transactionRepository.deleteAll();
        userBadgeRepository.deleteAll();
        streakRepository.deleteAll();
        voteRepository.deleteAll();
        verificationRepository.deleteAll();
        embeddingRepository.deleteAll();
        entryRepository.deleteAll();
        challengeRepository.deleteAll();
        memberRepository.deleteAll();
    }

    protected Member createMember(long memberId, String name) {
        return createMember(memberId, name, false);
    }

    protected Member createMember(long memberId, String name, boolean staff) {
        return memberRepository.save(Member.builder()
                .memberId(memberId)
                .name(name)
                .joinDate(LocalDateTime.now(clock))
                .staff(staff)
                .build());
    }

    protected Member reload(long memberId) {
        return memberRepository.findById(memberId).orElseThrow();
    }

    protected EntryDTO submit(long contributorId, String text) {
        return contributionService.submitEntry(contributorId, EntryRequest.builder()
                .koloquaText(text)
                .englishTranslation("Translation of " + text)
                .build());
    }

    protected VoteResultDTO vote(long entryId, long voterId, int voteType) {
        return contributionService.castVote(entryId, voterId, new VoteRequest(voteType));
    }

    protected VerificationResultDTO verify(long entryId, long verifierId, String type) {
        return contributionService.submitVerification(entryId, verifierId, new VerificationRequest(type, null));
    }

    protected List<PointTransaction> transactions(long memberId, TransactionType type) {
        return transactionRepository.findByMemberIdAndTransactionType(memberId, type);
    }

    protected int sum(long memberId, TransactionType type) {
        return transactions(memberId, type).stream().mapToInt(PointTransaction::getPoints).sum();
    }

    protected int ledgerBalance(long memberId) {
        return transactionRepository.sumPointsByMemberId(memberId).intValue();
    }
}
