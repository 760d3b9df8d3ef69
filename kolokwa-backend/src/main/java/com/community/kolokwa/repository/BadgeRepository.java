package com.community.kolokwa.repository;

import com.community.kolokwa.entity.Badge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BadgeRepository extends JpaRepository<Badge, String> {

    List<Badge> findAllByOrderByBadgeKeyAsc();
}
