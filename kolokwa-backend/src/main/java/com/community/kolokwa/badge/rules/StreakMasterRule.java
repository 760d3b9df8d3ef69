package com.community.kolokwa.badge.rules;

import com.community.kolokwa.badge.SpecialBadgeRule;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.repository.UserStreakRepository;
import org.springframework.stereotype.Component;

/**
 * streak_master: longest streak of 30 days
 */
@Component
public class StreakMasterRule implements SpecialBadgeRule {

    static final int DAYS = 30;

    private final UserStreakRepository streakRepository;

    public StreakMasterRule(UserStreakRepository streakRepository) {
        this.streakRepository = streakRepository;
    }

    @Override
    public String getBadgeKey() {
        return "streak_master";
    }

    @Override
    public boolean qualifies(Member member) {
        return streakRepository.findById(member.getMemberId())
                .map(streak -> streak.getLongestStreak() >= DAYS)
                .orElse(false);
    }
}
