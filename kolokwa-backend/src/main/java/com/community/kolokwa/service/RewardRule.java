package com.community.kolokwa.service;

import com.community.kolokwa.config.KolokwaProperties;
import com.community.kolokwa.entity.TransactionType;

import java.util.function.ToIntFunction;

/**
 * Fixed-amount grants and where their amount is configured.
 */
public enum RewardRule {

    NEW_CONTRIBUTION(TransactionType.CONTRIBUTION, KolokwaProperties.Rewards::getContribution),
    VOTE_CAST(TransactionType.VOTE, KolokwaProperties.Rewards::getVote),
    ACCURATE_VERIFICATION(TransactionType.VERIFICATION, KolokwaProperties.Rewards::getVerificationAccurate),
    VERIFYING_VERIFICATION(TransactionType.VERIFICATION, KolokwaProperties.Rewards::getVerificationVerified),
    REVIEW(TransactionType.VERIFICATION, KolokwaProperties.Rewards::getVerificationReview),
    CONTRIBUTION_VERIFIED(TransactionType.CONTRIBUTION_VERIFIED, KolokwaProperties.Rewards::getContributionVerified),
    VERIFICATION_RECEIVED(TransactionType.VERIFICATION_RECEIVED, KolokwaProperties.Rewards::getVerificationReceived);

    private final TransactionType transactionType;
    private final ToIntFunction<KolokwaProperties.Rewards> amount;

    RewardRule(TransactionType transactionType, ToIntFunction<KolokwaProperties.Rewards> amount) {
        this.transactionType = transactionType;
        this.amount = amount;
    }

    public TransactionType getTransactionType() {
        return transactionType;
    }

    public int amount(KolokwaProperties properties) {
        return amount.applyAsInt(properties.getRewards());
    }
}
