package com.community.kolokwa.service;

import com.community.kolokwa.config.KolokwaProperties;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.PointTransaction;
import com.community.kolokwa.entity.TransactionType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class RewardServiceTest {

    @Mock
    private PointLedgerService pointLedgerService;

    @Mock
    private BadgeEvaluationService badgeEvaluationService;

    @Spy
    private KolokwaProperties properties = new KolokwaProperties();

    @InjectMocks
    private RewardService rewardService;

    private final Member member = Member.builder().memberId(3L).build();

    @Test
    void testAward_EvaluatesBadges() {
        when(pointLedgerService.append(member, 10, TransactionType.CONTRIBUTION_VERIFIED, "verified", "k1"))
                .thenReturn(new PointTransaction());

        assertTrue(rewardService.award(member, RewardRule.CONTRIBUTION_VERIFIED, "verified", "k1"));
        verify(badgeEvaluationService).evaluate(member);
    }

    @Test
    void testAward_DuplicateKeySkipsEvaluation() {
        when(pointLedgerService.append(any(), anyInt(), any(), anyString(), eq("k1"))).thenReturn(null);

        assertFalse(rewardService.awardPoints(member, 3, TransactionType.VERIFICATION, "again", "k1"));
        verifyNoInteractions(badgeEvaluationService);
    }

    @Test
    void testAchievementDoesNotCascade() {
        when(pointLedgerService.append(member, 5, TransactionType.ACHIEVEMENT, "bonus", null))
                .thenReturn(new PointTransaction());

        assertTrue(rewardService.awardPoints(member, 5, TransactionType.ACHIEVEMENT, "bonus"));
        verifyNoInteractions(badgeEvaluationService);
    }
}
