package com.community.kolokwa.badge;

import com.community.kolokwa.entity.Badge;
import com.community.kolokwa.entity.BadgeType;
import com.community.kolokwa.repository.BadgeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Seeds the badge catalog at start-up. Existing rows are left untouched so operators can
 * retune requirements in the database.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BadgeCatalogInitializer implements ApplicationRunner {

    private final BadgeRepository badgeRepository;
    private final Clock clock;

    @Override
    @Transactional
    public void run(ApplicationArguments args) {
        int created = 0;
        for (Badge badge : defaultCatalog()) {
            if (badgeRepository.existsById(badge.getBadgeKey())) {
                continue;
            }
            badge.setCreatedAt(LocalDateTime.now(clock));
            badgeRepository.save(badge);
            created++;
        }
        log.info("Badge catalog ready: {} created, {} total", created, badgeRepository.count());
    }

    static List<Badge> defaultCatalog() {
        return List.of(
                special("first_steps", "First Steps", "Submitted your first entry", BadgeType.SPECIAL),
                special("helpful_verifier", "Helpful Verifier", "Verified 10 entries", BadgeType.VERIFICATION),
                special("community_hero", "Community Hero", "5 contributions and 20 verifications", BadgeType.SPECIAL),
                special("streak_master", "Streak Master", "Contributed 30 days in a row", BadgeType.STREAK),
                special("early_adopter", "Early Adopter", "One of the first members of the community", BadgeType.SPECIAL),
                special("popular_contributor", "Popular Contributor", "3 entries with 10 or more upvotes", BadgeType.SPECIAL),
                Badge.builder().badgeKey("word_collector").name("Word Collector")
                        .description("Contributed 10 entries").badgeType(BadgeType.CONTRIBUTION)
                        .contributionsRequired(10).build(),
                Badge.builder().badgeKey("dictionary_builder").name("Dictionary Builder")
                        .description("Contributed 50 entries").badgeType(BadgeType.CONTRIBUTION)
                        .contributionsRequired(50).build(),
                Badge.builder().badgeKey("trusted_reviewer").name("Trusted Reviewer")
                        .description("Verified 25 entries").badgeType(BadgeType.VERIFICATION)
                        .verificationsRequired(25).build(),
                Badge.builder().badgeKey("point_collector").name("Point Collector")
                        .description("Reached 100 points").badgeType(BadgeType.SPECIAL)
                        .pointsRequired(100).build(),
                Badge.builder().badgeKey("rising_star").name("Rising Star")
                        .description("Reached 500 points").badgeType(BadgeType.SPECIAL)
                        .pointsRequired(500).build()
        );
    }

    private static Badge special(String key, String name, String description, BadgeType type) {
        return Badge.builder().badgeKey(key).name(name).description(description).badgeType(type).build();
    }
}
