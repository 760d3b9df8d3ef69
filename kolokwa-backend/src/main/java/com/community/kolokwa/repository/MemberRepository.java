package com.community.kolokwa.repository;

import com.community.kolokwa.entity.Member;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface MemberRepository extends JpaRepository<Member, Long> {

    // Row lock; callers lock several members in ascending id order
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM Member m WHERE m.memberId = :memberId")
    Optional<Member> findByIdForUpdate(Long memberId);

    // Leaderboard: points desc, earlier member first on ties
    @Query("SELECT m FROM Member m ORDER BY m.points DESC, m.memberId ASC")
    List<Member> findLeaderboard(Pageable pageable);

    long countByPointsGreaterThan(Integer points);

    @Query("SELECT m.memberId FROM Member m ORDER BY m.memberId ASC")
    List<Long> findAllIdsOrderById();
}
