package com.community.kolokwa.service;

import com.community.kolokwa.badge.SpecialBadgeRule;
import com.community.kolokwa.config.KolokwaProperties;
import com.community.kolokwa.entity.Badge;
import com.community.kolokwa.entity.BadgeType;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.TransactionType;
import com.community.kolokwa.entity.UserBadge;
import com.community.kolokwa.repository.BadgeRepository;
import com.community.kolokwa.repository.UserBadgeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class BadgeEvaluationServiceTest {

    @Mock
    private PointLedgerService pointLedgerService;

    @Mock
    private BadgeRepository badgeRepository;

    @Mock
    private UserBadgeRepository userBadgeRepository;

    private BadgeEvaluationService evaluationService;

    private final Badge firstSteps = Badge.builder().badgeKey("first_steps").name("First Steps")
            .badgeType(BadgeType.SPECIAL).build();
    private final Badge risingStar = Badge.builder().badgeKey("rising_star").name("Rising Star")
            .badgeType(BadgeType.CONTRIBUTION).pointsRequired(500).build();
    private final Badge wordCollector = Badge.builder().badgeKey("word_collector").name("Word Collector")
            .badgeType(BadgeType.CONTRIBUTION).contributionsRequired(10).build();

    @BeforeEach
    void setUp() {
        SpecialBadgeRule firstStepsRule = new SpecialBadgeRule() {
            @Override
            public String getBadgeKey() {
                return "first_steps";
            }

            @Override
            public boolean qualifies(Member member) {
                return member.getContributionsCount() >= 1;
            }
        };
        evaluationService = new BadgeEvaluationService(pointLedgerService, badgeRepository, userBadgeRepository,
                List.of(firstStepsRule), new KolokwaProperties(),
                Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void testBonusFor() {
        assertEquals(5, evaluationService.bonusFor(firstSteps));
        assertEquals(50, evaluationService.bonusFor(risingStar));
        assertEquals(5, evaluationService.bonusFor(wordCollector));
    }

    @Test
    void testQualifies() {
        Member member = Member.builder().memberId(1L).points(520).contributionsCount(0).build();

        assertTrue(evaluationService.qualifies(member, risingStar));
        assertFalse(evaluationService.qualifies(member, wordCollector));
        assertFalse(evaluationService.qualifies(member, firstSteps));
    }

    @Test
    void testEvaluate_GrantsOnlyMissingBadges() {
        Member member = Member.builder().memberId(1L).points(600).contributionsCount(12).build();
        when(userBadgeRepository.findByMemberIdOrderByEarnedAtAsc(1L))
                .thenReturn(List.of(UserBadge.builder().memberId(1L).badgeKey("first_steps").build()));
        when(badgeRepository.findAllByOrderByBadgeKeyAsc()).thenReturn(List.of(firstSteps, risingStar, wordCollector));

        List<String> granted = evaluationService.evaluate(member);

        assertEquals(List.of("rising_star", "word_collector"), granted);
        ArgumentCaptor<UserBadge> saved = ArgumentCaptor.forClass(UserBadge.class);
        verify(userBadgeRepository, times(2)).save(saved.capture());
        assertEquals("rising_star", saved.getAllValues().get(0).getBadgeKey());
        verify(pointLedgerService).append(eq(member), eq(50), eq(TransactionType.ACHIEVEMENT),
                anyString(), eq("badge:1:rising_star"));
        verify(pointLedgerService).append(eq(member), eq(5), eq(TransactionType.ACHIEVEMENT),
                anyString(), eq("badge:1:word_collector"));
    }

    @Test
    void testEvaluate_NothingNew() {
        Member member = Member.builder().memberId(2L).build();
        when(userBadgeRepository.findByMemberIdOrderByEarnedAtAsc(2L)).thenReturn(List.of());
        when(badgeRepository.findAllByOrderByBadgeKeyAsc()).thenReturn(List.of(firstSteps, risingStar, wordCollector));

        assertTrue(evaluationService.evaluate(member).isEmpty());
        verify(userBadgeRepository, never()).save(any());
        verifyNoInteractions(pointLedgerService);
    }
}
