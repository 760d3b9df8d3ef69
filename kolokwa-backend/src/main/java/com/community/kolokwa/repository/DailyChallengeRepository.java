package com.community.kolokwa.repository;

import com.community.kolokwa.entity.DailyChallenge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Optional;

@Repository
public interface DailyChallengeRepository extends JpaRepository<DailyChallenge, Long> {

    Optional<DailyChallenge> findByChallengeDateAndActiveTrue(LocalDate challengeDate);

    boolean existsByChallengeDate(LocalDate challengeDate);
}
