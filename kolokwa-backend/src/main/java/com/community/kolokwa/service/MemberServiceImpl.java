package com.community.kolokwa.service;

import com.community.kolokwa.dto.EarnedBadgeDTO;
import com.community.kolokwa.dto.LeaderboardEntryDTO;
import com.community.kolokwa.dto.LevelInfoDTO;
import com.community.kolokwa.dto.MemberRankDTO;
import com.community.kolokwa.dto.MemberStatsDTO;
import com.community.kolokwa.dto.PointTransactionDTO;
import com.community.kolokwa.entity.Badge;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.entity.MemberLevel;
import com.community.kolokwa.entity.UserStreak;
import com.community.kolokwa.exception.NotFoundException;
import com.community.kolokwa.repository.BadgeRepository;
import com.community.kolokwa.repository.MemberRepository;
import com.community.kolokwa.repository.PointTransactionRepository;
import com.community.kolokwa.repository.UserBadgeRepository;
import com.community.kolokwa.repository.UserStreakRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class MemberServiceImpl implements MemberService {

    private final MemberRepository memberRepository;
    private final PointTransactionRepository transactionRepository;
    private final UserBadgeRepository userBadgeRepository;
    private final BadgeRepository badgeRepository;
    private final UserStreakRepository streakRepository;

    public MemberServiceImpl(MemberRepository memberRepository,
                             PointTransactionRepository transactionRepository,
                             UserBadgeRepository userBadgeRepository,
                             BadgeRepository badgeRepository,
                             UserStreakRepository streakRepository) {
        this.memberRepository = memberRepository;
        this.transactionRepository = transactionRepository;
        this.userBadgeRepository = userBadgeRepository;
        this.badgeRepository = badgeRepository;
        this.streakRepository = streakRepository;
    }

    @Override
    public MemberStatsDTO getMemberStats(Long memberId) {
        Member member = findMember(memberId);

        MemberStatsDTO dto = new MemberStatsDTO();
        dto.setMemberId(member.getMemberId());
        dto.setName(member.getName());
        dto.setPoints(member.getPoints());
        dto.setLevelInfo(buildLevelInfo(member.getPoints()));
        dto.setContributionsCount(member.getContributionsCount());
        dto.setVerificationsCount(member.getVerificationsCount());
        dto.setRank(memberRepository.countByPointsGreaterThan(member.getPoints()) + 1);

        // badges, oldest first
        Map<String, Badge> catalog = badgeRepository.findAll().stream()
                .collect(Collectors.toMap(Badge::getBadgeKey, Function.identity()));
        dto.setBadges(userBadgeRepository.findByMemberIdOrderByEarnedAtAsc(memberId).stream()
                .map(ub -> new EarnedBadgeDTO(ub.getBadgeKey(),
                        catalog.containsKey(ub.getBadgeKey()) ? catalog.get(ub.getBadgeKey()).getName() : ub.getBadgeKey(),
                        ub.getEarnedAt()))
                .collect(Collectors.toList()));

        dto.setRecentTransactions(transactionRepository.findTop20ByMemberIdOrderByCreatedAtDescIdDesc(memberId).stream()
                .map(t -> new PointTransactionDTO(t.getPoints(), t.getTransactionType().getCode(),
                        t.getDescription(), t.getCreatedAt()))
                .collect(Collectors.toList()));

        UserStreak streak = streakRepository.findById(memberId).orElse(null);
        dto.setCurrentStreak(streak == null ? 0 : streak.getCurrentStreak());
        dto.setLongestStreak(streak == null ? 0 : streak.getLongestStreak());
        dto.setLastContributionDate(streak == null ? null : streak.getLastContributionDate());
        return dto;
    }

    @Override
    public List<LeaderboardEntryDTO> getLeaderboard(Integer count) {
        final int finalCount = (count == null) ? 10 : Math.max(1, Math.min(count, 100));

        List<Member> members = memberRepository.findLeaderboard(PageRequest.of(0, finalCount));
        List<LeaderboardEntryDTO> leaderboard = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            Member m = members.get(i);
            leaderboard.add(new LeaderboardEntryDTO(i + 1, m.getMemberId(), m.getName(), m.getPoints(),
                    m.getLevel().getCode()));
        }
        return leaderboard;
    }

    @Override
    public MemberRankDTO getMemberRank(Long memberId) {
        Member member = findMember(memberId);
        long higher = memberRepository.countByPointsGreaterThan(member.getPoints());
        return new MemberRankDTO(memberId, member.getPoints(), higher + 1, memberRepository.count());
    }

    static LevelInfoDTO buildLevelInfo(int points) {
        MemberLevel level = MemberLevel.fromPoints(points);
        MemberLevel next = level.next();
        return new LevelInfoDTO(
                level.getCode(),
                level.getDisplayName(),
                next == null ? null : next.getCode(),
                next == null ? null : next.getDisplayName(),
                next == null ? 0 : next.getThreshold() - points,
                (int) level.progressPercent(points));
    }

    private Member findMember(Long memberId) {
        return memberRepository.findById(memberId)
                .orElseThrow(() -> new NotFoundException("Member not found: " + memberId));
    }
}
