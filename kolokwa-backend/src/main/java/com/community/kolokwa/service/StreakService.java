package com.community.kolokwa.service;

import com.community.kolokwa.config.KolokwaProperties;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.TransactionType;
import com.community.kolokwa.entity.UserStreak;
import com.community.kolokwa.repository.UserStreakRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Daily contribution streaks. The caller holds the member row lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class StreakService {

    private final UserStreakRepository streakRepository;
    private final PointLedgerService pointLedgerService;
    private final KolokwaProperties properties;
    private final Clock clock;

    public UserStreak getOrCreate(Long memberId) {
        return streakRepository.findById(memberId)
                .orElseGet(() -> streakRepository.save(UserStreak.builder().memberId(memberId).build()));
    }

    /**
     * Records activity today. Consecutive days extend the streak, a gap restarts it at 1, a
     * second touch on the same day changes nothing. Reaching a multiple of the bonus interval
     * pays {@code streak * multiplier} as an achievement.
     */
    public UserStreak touch(Member member) {
        UserStreak streak = getOrCreate(member.getMemberId());
        LocalDate today = LocalDate.now(clock);
        LocalDate last = streak.getLastContributionDate();

        if (today.equals(last)) {
            return streak;
        }

        if (last != null && last.plusDays(1).equals(today)) {
            streak.setCurrentStreak(streak.getCurrentStreak() + 1);
        } else {
            streak.setCurrentStreak(1);
        }
        streak.setLongestStreak(Math.max(streak.getLongestStreak(), streak.getCurrentStreak()));
        streak.setLastContributionDate(today);
        streakRepository.save(streak);

        int current = streak.getCurrentStreak();
        KolokwaProperties.Streak config = properties.getStreak();
        if (current % config.getBonusInterval() == 0) {
            int bonus = current * config.getBonusMultiplier();
            pointLedgerService.append(member, bonus, TransactionType.ACHIEVEMENT,
                    current + "-day streak bonus",
                    "streak:" + member.getMemberId() + ":" + today);
            log.info("Member {} reached a {}-day streak (+{} points)", member.getMemberId(), current, bonus);
        }
        return streak;
    }
}
