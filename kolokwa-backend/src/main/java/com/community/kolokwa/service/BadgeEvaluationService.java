package com.community.kolokwa.service;

import com.community.kolokwa.badge.SpecialBadgeRule;
import com.community.kolokwa.config.KolokwaProperties;
import com.community.kolokwa.entity.Badge;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.TransactionType;
import com.community.kolokwa.entity.UserBadge;
import com.community.kolokwa.repository.BadgeRepository;
import com.community.kolokwa.repository.UserBadgeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Badge evaluator: collects every registered {@link SpecialBadgeRule} and grants each badge
 * the member newly qualifies for, together with its bonus points.
 * One pass per call. Bonuses are written straight to the ledger as ACHIEVEMENT rows so they
 * do not re-enter evaluation.
 */
@Service
@Transactional(propagation = Propagation.MANDATORY)
public class BadgeEvaluationService {

    private static final Logger log = LoggerFactory.getLogger(BadgeEvaluationService.class);

    private final PointLedgerService pointLedgerService;
    private final BadgeRepository badgeRepository;
    private final UserBadgeRepository userBadgeRepository;
    private final Map<String, SpecialBadgeRule> specialRules;
    private final KolokwaProperties properties;
    private final Clock clock;

    public BadgeEvaluationService(PointLedgerService pointLedgerService,
                                  BadgeRepository badgeRepository,
                                  UserBadgeRepository userBadgeRepository,
                                  List<SpecialBadgeRule> rules,
                                  KolokwaProperties properties,
                                  Clock clock) {
        this.pointLedgerService = pointLedgerService;
        this.badgeRepository = badgeRepository;
        this.userBadgeRepository = userBadgeRepository;
        this.specialRules = rules.stream()
                .collect(Collectors.toMap(SpecialBadgeRule::getBadgeKey, Function.identity()));
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return keys of the badges granted by this call, in catalog order
     */
    public List<String> evaluate(Member member) {
        // 1. badges already held
        Set<String> held = userBadgeRepository.findByMemberIdOrderByEarnedAtAsc(member.getMemberId()).stream()
                .map(UserBadge::getBadgeKey)
                .collect(Collectors.toSet());

        // 2. first matching check wins for each missing badge
        List<String> granted = new ArrayList<>();
        for (Badge badge : badgeRepository.findAllByOrderByBadgeKeyAsc()) {
            if (held.contains(badge.getBadgeKey()) || !qualifies(member, badge)) {
                continue;
            }
            grant(member, badge);
            granted.add(badge.getBadgeKey());
        }
        return granted.isEmpty() ? Collections.emptyList() : granted;
    }

    boolean qualifies(Member member, Badge badge) {
        if (badge.getPointsRequired() > 0 && member.getPoints() >= badge.getPointsRequired()) {
            return true;
        }
        if (badge.getContributionsRequired() > 0 && member.getContributionsCount() >= badge.getContributionsRequired()) {
            return true;
        }
        if (badge.getVerificationsRequired() > 0 && member.getVerificationsCount() >= badge.getVerificationsRequired()) {
            return true;
        }
        SpecialBadgeRule rule = specialRules.get(badge.getBadgeKey());
        return rule != null && rule.qualifies(member);
    }

    /**
     * Bonus = max(points_required / divisor, minimum).
     */
    int bonusFor(Badge badge) {
        KolokwaProperties.Badges config = properties.getBadges();
        return Math.max(badge.getPointsRequired() / config.getBonusDivisor(), config.getBonusMinimum());
    }

    private void grant(Member member, Badge badge) {
        userBadgeRepository.save(UserBadge.builder()
                .memberId(member.getMemberId())
                .badgeKey(badge.getBadgeKey())
                .earnedAt(LocalDateTime.now(clock))
                .build());

        int bonus = bonusFor(badge);
        pointLedgerService.append(member, bonus, TransactionType.ACHIEVEMENT,
                "Earned badge: " + badge.getName(),
                "badge:" + member.getMemberId() + ":" + badge.getBadgeKey());

        log.info("Member {} earned badge {} (+{} points)", member.getMemberId(), badge.getBadgeKey(), bonus);
    }
}
