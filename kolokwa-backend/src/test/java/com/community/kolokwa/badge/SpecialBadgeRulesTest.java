package com.community.kolokwa.badge;

import com.community.kolokwa.badge.rules.CommunityHeroRule;
import com.community.kolokwa.badge.rules.EarlyAdopterRule;
import com.community.kolokwa.badge.rules.PopularContributorRule;
import com.community.kolokwa.badge.rules.StreakMasterRule;
import com.community.kolokwa.config.KolokwaProperties;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.UserStreak;
import com.community.kolokwa.repository.DictionaryEntryRepository;
import com.community.kolokwa.repository.UserStreakRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class SpecialBadgeRulesTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private UserStreakRepository streakRepository;

    @Mock
    private DictionaryEntryRepository entryRepository;

    @Test
    void testCommunityHero() {
        CommunityHeroRule rule = new CommunityHeroRule();

        assertTrue(rule.qualifies(Member.builder().contributionsCount(5).verificationsCount(20).build()));
        assertFalse(rule.qualifies(Member.builder().contributionsCount(50).verificationsCount(19).build()));
    }

    @Test
    void testEarlyAdopter_ConfiguredCutoff() {
        KolokwaProperties properties = new KolokwaProperties();
        properties.getBadges().setEarlyAdopterCutoff(LocalDate.of(2025, 12, 31));
        EarlyAdopterRule rule = new EarlyAdopterRule(properties, CLOCK);

        assertTrue(rule.qualifies(Member.builder().joinDate(LocalDateTime.of(2025, 12, 31, 23, 59)).build()));
        assertFalse(rule.qualifies(Member.builder().joinDate(LocalDateTime.of(2026, 1, 1, 0, 0)).build()));
        assertFalse(rule.qualifies(Member.builder().build()));
    }

    @Test
    void testEarlyAdopter_DefaultsToOneYear() {
        EarlyAdopterRule rule = new EarlyAdopterRule(new KolokwaProperties(), CLOCK);

        assertTrue(rule.qualifies(Member.builder().joinDate(LocalDateTime.of(2025, 3, 2, 8, 0)).build()));
        assertFalse(rule.qualifies(Member.builder().joinDate(LocalDateTime.of(2025, 3, 3, 8, 0)).build()));
    }

    @Test
    void testStreakMaster() {
        StreakMasterRule rule = new StreakMasterRule(streakRepository);
        when(streakRepository.findById(1L)).thenReturn(Optional.of(UserStreak.builder().memberId(1L).longestStreak(30).build()));
        when(streakRepository.findById(2L)).thenReturn(Optional.empty());

        assertTrue(rule.qualifies(Member.builder().memberId(1L).build()));
        assertFalse(rule.qualifies(Member.builder().memberId(2L).build()));
    }

    @Test
    void testPopularContributor() {
        PopularContributorRule rule = new PopularContributorRule(entryRepository);
        when(entryRepository.countByContributorIdAndUpvotesGreaterThanEqual(1L, 10)).thenReturn(3L);
        when(entryRepository.countByContributorIdAndUpvotesGreaterThanEqual(2L, 10)).thenReturn(2L);

        assertTrue(rule.qualifies(Member.builder().memberId(1L).build()));
        assertFalse(rule.qualifies(Member.builder().memberId(2L).build()));
    }
}
