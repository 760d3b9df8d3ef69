package com.community.kolokwa.service;

import com.community.kolokwa.config.KolokwaProperties;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.PointTransaction;
import com.community.kolokwa.entity.TransactionType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Grants points and re-checks badges afterwards. Achievement grants skip the re-check so a
 * badge bonus can never trigger another evaluation.
 */
@Service
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class RewardService {

    private final PointLedgerService pointLedgerService;
    private final BadgeEvaluationService badgeEvaluationService;
    private final KolokwaProperties properties;

    /**
     * @return true if a transaction was written
     */
    public boolean awardPoints(Member member, int points, TransactionType type,
                               String description, String idempotencyKey) {
        PointTransaction row = pointLedgerService.append(member, points, type, description, idempotencyKey);
        if (row == null) {
            return false;
        }
        if (type.triggersBadgeEvaluation()) {
            badgeEvaluationService.evaluate(member);
        }
        return true;
    }

    public boolean awardPoints(Member member, int points, TransactionType type, String description) {
        return awardPoints(member, points, type, description, null);
    }

    public boolean award(Member member, RewardRule rule, String description, String idempotencyKey) {
        return awardPoints(member, rule.amount(properties), rule.getTransactionType(), description, idempotencyKey);
    }
}
