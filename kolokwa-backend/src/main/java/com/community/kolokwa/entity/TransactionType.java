package com.community.kolokwa.entity;

/**
 * Closed set of reasons a point transaction is written for.
 * ACHIEVEMENT marks badge and streak bonuses and never re-enters badge evaluation.
 */
public enum TransactionType {

    CONTRIBUTION("contribution", "New Contribution"),
    VERIFICATION("verification", "Verification"),
    VOTE("vote", "Vote"),
    VOTE_RECEIVED("vote_received", "Vote Received"),
    VOTE_CHANGED("vote_changed", "Vote Changed"),
    VOTE_REMOVED("vote_removed", "Vote Removed"),
    DAILY_BONUS("daily_bonus", "Daily Bonus"),
    ACHIEVEMENT("achievement", "Achievement"),
    PENALTY("penalty", "Penalty"),
    CONTRIBUTION_VERIFIED("contribution_verified", "Contribution Verified"),
    VERIFICATION_RECEIVED("verification_received", "Verification Received");

    private final String code;
    private final String label;

    TransactionType(String code, String label) {
        this.code = code;
        this.label = label;
    }

    public String getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    public boolean triggersBadgeEvaluation() {
        return this != ACHIEVEMENT;
    }
}
