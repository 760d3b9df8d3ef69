package com.community.kolokwa.service;

import com.community.kolokwa.config.KolokwaProperties;
import com.community.kolokwa.dto.DailyChallengeDTO;
import com.community.kolokwa.entity.DailyChallenge;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.TransactionType;
import com.community.kolokwa.entity.UserStreak;
import com.community.kolokwa.exception.ConflictException;
import com.community.kolokwa.exception.NotFoundException;
import com.community.kolokwa.repository.DailyChallengeRepository;
import com.community.kolokwa.repository.MemberRepository;
import com.community.kolokwa.repository.UserStreakRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * One challenge per day: members accept it, complete it once, and are paid its reward.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailyChallengeService {

    private static final DateTimeFormatter TITLE_DATE = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);

    private final DailyChallengeRepository challengeRepository;
    private final UserStreakRepository streakRepository;
    private final MemberRepository memberRepository;
    private final StreakService streakService;
    private final RewardService rewardService;
    private final KolokwaProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public DailyChallengeDTO getToday(Long memberId) {
        LocalDate today = LocalDate.now(clock);
        DailyChallenge challenge = challengeRepository.findByChallengeDateAndActiveTrue(today)
                .orElseThrow(() -> new NotFoundException("No challenge available for today"));
        UserStreak streak = memberId == null ? null : streakRepository.findById(memberId).orElse(null);
        return toDTO(challenge, streak, today);
    }

    @Transactional
    public DailyChallengeDTO accept(Long challengeId, Long memberId) {
        DailyChallenge challenge = findActive(challengeId);
        lockMember(memberId);
        LocalDate today = LocalDate.now(clock);

        UserStreak streak = streakService.getOrCreate(memberId);
        if (isAccepted(streak, challenge, today)) {
            throw new ConflictException("You have already accepted this challenge today.");
        }
        streak.setAcceptedChallengeId(challenge.getId());
        streak.setChallengeAcceptedDate(today);
        streakRepository.save(streak);

        log.info("Member {} accepted challenge {}", memberId, challengeId);
        return toDTO(challenge, streak, today);
    }

    @Transactional
    public DailyChallengeDTO complete(Long challengeId, Long memberId) {
        DailyChallenge challenge = findActive(challengeId);
        Member member = lockMember(memberId);
        LocalDate today = LocalDate.now(clock);

        UserStreak streak = streakService.getOrCreate(memberId);
        if (!isAccepted(streak, challenge, today)) {
            throw new ConflictException("You have not accepted this challenge today.");
        }
        if (isCompleted(streak, challenge, today)) {
            throw new ConflictException("You have already completed this challenge today.");
        }
        streak.setCompletedChallengeId(challenge.getId());
        streak.setChallengeCompletedDate(today);
        streakRepository.save(streak);

        // streak first so the reward's badge check sees it
        streakService.touch(member);
        rewardService.awardPoints(member, challenge.getPointsReward(), TransactionType.DAILY_BONUS,
                "Completed daily challenge: " + challenge.getTitle(),
                "challenge:" + challenge.getId() + ":" + memberId);

        log.info("Member {} completed challenge {} (+{} points)", memberId, challengeId, challenge.getPointsReward());
        return toDTO(challenge, streak, today);
    }

    @Scheduled(cron = "${kolokwa.challenges.cron}")
    public void scheduledCreation() {
        try {
            createChallenge(LocalDate.now(clock));
        } catch (RuntimeException ex) {
            log.error("Daily challenge creation failed: {}", ex.getMessage(), ex);
        }
    }

    /**
     * Creates the challenge for the given day if there is none yet.
     *
     * @return the challenge of that day
     */
    @Transactional
    public DailyChallenge createChallenge(LocalDate date) {
        return challengeRepository.findByChallengeDateAndActiveTrue(date).orElseGet(() -> {
            if (challengeRepository.existsByChallengeDate(date)) {
                throw new ConflictException("An inactive challenge already exists for " + date);
            }
            DailyChallenge challenge = DailyChallenge.builder()
                    .title("Daily Challenge - " + TITLE_DATE.format(date))
                    .description("Contribute a new word or verify an existing entry today!")
                    .pointsReward(properties.getChallenges().getDefaultReward())
                    .targetCount(1)
                    .challengeDate(date)
                    .active(true)
                    .build();
            try {
                challenge = challengeRepository.saveAndFlush(challenge);
            } catch (DataIntegrityViolationException e) {
                throw new ConflictException("A challenge was created concurrently for " + date);
            }
            log.info("Created daily challenge {} for {}", challenge.getId(), date);
            return challenge;
        });
    }

    private DailyChallenge findActive(Long challengeId) {
        return challengeRepository.findById(challengeId)
                .filter(DailyChallenge::isActive)
                .orElseThrow(() -> new NotFoundException("Challenge not found: " + challengeId));
    }

    private Member lockMember(Long memberId) {
        return memberRepository.findByIdForUpdate(memberId)
                .orElseThrow(() -> new NotFoundException("Member not found: " + memberId));
    }

    private static boolean isAccepted(UserStreak streak, DailyChallenge challenge, LocalDate today) {
        return streak != null && Objects.equals(streak.getAcceptedChallengeId(), challenge.getId())
                && today.equals(streak.getChallengeAcceptedDate());
    }

    private static boolean isCompleted(UserStreak streak, DailyChallenge challenge, LocalDate today) {
        return streak != null && Objects.equals(streak.getCompletedChallengeId(), challenge.getId())
                && today.equals(streak.getChallengeCompletedDate());
    }

    private static DailyChallengeDTO toDTO(DailyChallenge challenge, UserStreak streak, LocalDate today) {
        DailyChallengeDTO dto = new DailyChallengeDTO();
        dto.setChallengeId(challenge.getId());
        dto.setTitle(challenge.getTitle());
        dto.setDescription(challenge.getDescription());
        dto.setPointsReward(challenge.getPointsReward());
        dto.setTargetCount(challenge.getTargetCount());
        dto.setChallengeDate(challenge.getChallengeDate());
        dto.setAccepted(isAccepted(streak, challenge, today));
        dto.setCompleted(isCompleted(streak, challenge, today));
        return dto;
    }
}
