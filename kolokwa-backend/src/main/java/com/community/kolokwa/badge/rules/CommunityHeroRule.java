package com.community.kolokwa.badge.rules;

import com.community.kolokwa.badge.SpecialBadgeRule;
import com.community.kolokwa.entity.Member;
import org.springframework.stereotype.Component;

/**
 * community_hero: active on both sides, 5 contributions and 20 verifications
 */
@Component
public class CommunityHeroRule implements SpecialBadgeRule {

    @Override
    public String getBadgeKey() {
        return "community_hero";
    }

    @Override
    public boolean qualifies(Member member) {
        return member.getContributionsCount() >= 5 && member.getVerificationsCount() >= 20;
    }
}
