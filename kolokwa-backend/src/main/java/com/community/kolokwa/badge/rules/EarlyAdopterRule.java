package com.community.kolokwa.badge.rules;

import com.community.kolokwa.badge.SpecialBadgeRule;
import com.community.kolokwa.config.KolokwaProperties;
import com.community.kolokwa.entity.Member;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;

/**
 * early_adopter: joined on or before the configured cutoff (one year ago when unset)
 */
@Component
public class EarlyAdopterRule implements SpecialBadgeRule {

    private final KolokwaProperties properties;
    private final Clock clock;

    public EarlyAdopterRule(KolokwaProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public String getBadgeKey() {
        return "early_adopter";
    }

    @Override
    public boolean qualifies(Member member) {
        if (member.getJoinDate() == null) {
            return false;
        }
        LocalDate cutoff = properties.getBadges().getEarlyAdopterCutoff();
        if (cutoff == null) {
            cutoff = LocalDate.now(clock).minusDays(365);
        }
        return !member.getJoinDate().toLocalDate().isAfter(cutoff);
    }
}
