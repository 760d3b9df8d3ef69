package com.community.kolokwa.service;

import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.MemberLevel;
import com.community.kolokwa.entity.PointTransaction;
import com.community.kolokwa.entity.TransactionType;
import com.community.kolokwa.repository.MemberRepository;
import com.community.kolokwa.repository.PointTransactionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Append-only point ledger. Every row moves the member's materialized balance and level in
 * the same transaction. The caller holds the member row lock.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class PointLedgerService {

    static final int MAX_DESCRIPTION = 255;

    private final PointTransactionRepository transactionRepository;
    private final MemberRepository memberRepository;
    private final Clock clock;

    /**
     * @param idempotencyKey null for grants that may repeat
     * @return the appended row, or null when nothing was written (zero delta or key already used)
     */
    public PointTransaction append(Member member, int points, TransactionType type,
                                   String description, String idempotencyKey) {
        if (points == 0) {
            return null;
        }
        if (idempotencyKey != null && transactionRepository.existsByIdempotencyKey(idempotencyKey)) {
            log.debug("Skip {} for member {}: key {} already used", type.getCode(), member.getMemberId(), idempotencyKey);
            return null;
        }

        PointTransaction row = PointTransaction.builder()
                .memberId(member.getMemberId())
                .points(points)
                .transactionType(type)
                .description(truncate(description))
                .idempotencyKey(idempotencyKey)
                .createdAt(LocalDateTime.now(clock))
                .build();
        transactionRepository.save(row);

        member.setPoints(member.getPoints() + points);
        applyLevel(member);
        memberRepository.save(member);

        log.debug("Member {} {} {} ({}), balance {}", member.getMemberId(), points > 0 ? "+" : "",
                points, type.getCode(), member.getPoints());
        return row;
    }

    /**
     * Recomputes the level from the balance.
     *
     * @return true if the level changed
     */
    public boolean applyLevel(Member member) {
        MemberLevel level = MemberLevel.fromPoints(member.getPoints());
        if (level == member.getLevel()) {
            return false;
        }
        log.info("Member {} level {} -> {}", member.getMemberId(), member.getLevel(), level);
        member.setLevel(level);
        return true;
    }

    private static String truncate(String description) {
        if (description == null || description.length() <= MAX_DESCRIPTION) {
            return description;
        }
        return description.substring(0, MAX_DESCRIPTION);
    }
}
