package com.community.kolokwa.repository;

import com.community.kolokwa.entity.UserBadge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface UserBadgeRepository extends JpaRepository<UserBadge, Long> {

    List<UserBadge> findByMemberIdOrderByEarnedAtAsc(Long memberId);

    boolean existsByMemberIdAndBadgeKey(Long memberId, String badgeKey);

    long countByMemberIdAndBadgeKey(Long memberId, String badgeKey);

    long countByBadgeKey(String badgeKey);
}
