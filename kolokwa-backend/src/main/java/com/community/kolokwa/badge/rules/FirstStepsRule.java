package com.community.kolokwa.badge.rules;

import com.community.kolokwa.badge.SpecialBadgeRule;
import com.community.kolokwa.entity.Member;
import org.springframework.stereotype.Component;

/**
 * first_steps: first contribution submitted
 */
@Component
public class FirstStepsRule implements SpecialBadgeRule {

    @Override
    public String getBadgeKey() {
        return "first_steps";
    }

    @Override
    public boolean qualifies(Member member) {
        return member.getContributionsCount() >= 1;
    }
}
