package com.community.kolokwa.badge.rules;

import com.community.kolokwa.badge.SpecialBadgeRule;
import com.community.kolokwa.entity.Member;
import org.springframework.stereotype.Component;

/**
 * helpful_verifier: 10 verifications
 */
@Component
public class HelpfulVerifierRule implements SpecialBadgeRule {

    static final int VERIFICATIONS = 10;

    @Override
    public String getBadgeKey() {
        return "helpful_verifier";
    }

    @Override
    public boolean qualifies(Member member) {
        return member.getVerificationsCount() >= VERIFICATIONS;
    }
}
