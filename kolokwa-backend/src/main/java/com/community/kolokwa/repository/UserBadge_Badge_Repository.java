package com.community.kolokwa.repository;

import com.community.kolokwa.entity.UserBadge;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Aggregate queries joining the badge catalog with the badges members hold.
 */
@Repository
public interface UserBadge_Badge_Repository extends org.springframework.data.repository.Repository<UserBadge, Long> {

    // Every badge with the number of members holding it; LEFT JOIN keeps unearned badges
    @Query(value = "SELECT " +
            "    b.badge_key, b.name, b.badge_type, b.description, " +
            "    COUNT(DISTINCT u.member_id) AS earned_count " +
            "FROM badges b " +
            "LEFT JOIN user_badges u ON b.badge_key = u.badge_key " +
            "GROUP BY b.badge_key, b.name, b.badge_type, b.description " +
            "ORDER BY b.badge_key", nativeQuery = true)
    List<Object[]> findAllBadgesWithStats();
}
