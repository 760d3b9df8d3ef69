package com.community.kolokwa.badge;

import com.community.kolokwa.entity.Member;

/**
 * Qualification check for a badge that a plain threshold cannot express.
 * Implementations are Spring beans; adding a badge means adding a rule and a catalog row.
 */
public interface SpecialBadgeRule {

    /**
     * Must match {@code Badge.badgeKey}.
     */
    String getBadgeKey();

    boolean qualifies(Member member);
}
