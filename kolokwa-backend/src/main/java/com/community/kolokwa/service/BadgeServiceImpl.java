package com.community.kolokwa.service;

import com.community.kolokwa.dto.BadgeDTO;
import com.community.kolokwa.repository.MemberRepository;
import com.community.kolokwa.repository.UserBadge_Badge_Repository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class BadgeServiceImpl implements BadgeService {

    private final UserBadge_Badge_Repository customRepository;
    private final MemberRepository memberRepository;

    public BadgeServiceImpl(UserBadge_Badge_Repository customRepository,
                            MemberRepository memberRepository) {
        this.customRepository = customRepository;
        this.memberRepository = memberRepository;
    }

    /**
     * Row layout: [0:badge_key, 1:name, 2:badge_type, 3:description, 4:earned_count]
     */
    private BadgeDTO mapToDTO(Object[] result, double totalMembers) {
        BadgeDTO dto = new BadgeDTO();
        dto.setBadgeKey((String) result[0]);
        dto.setName((String) result[1]);
        dto.setCategory(result[2] == null ? null : result[2].toString().toLowerCase(Locale.ROOT));
        dto.setDescription((String) result[3]);

        // COUNT comes back as Long or BigInteger depending on the driver
        Integer earnedCount = ((Number) result[4]).intValue();
        dto.setEarnedCount(earnedCount);
        dto.setCompletionRate(earnedCount / totalMembers);
        dto.setRank(null);
        return dto;
    }

    private List<BadgeDTO> buildAllBadgeDTOs() {
        // 1. total members; 1 avoids dividing by zero on an empty community
        long totalMembers = memberRepository.count();
        final double finalTotalMembers = (totalMembers == 0) ? 1.0 : (double) totalMembers;

        // 2. catalog joined with earned counts
        List<Object[]> results = customRepository.findAllBadgesWithStats();

        // 3. map
        return results.stream()
                .map(result -> mapToDTO(result, finalTotalMembers))
                .collect(Collectors.toList());
    }

    @Override
    public List<BadgeDTO> getBadgeList() {
        return buildAllBadgeDTOs();
    }

    @Override
    public List<BadgeDTO> getBadgeRanking(Integer count, String sortOrder) {
        List<BadgeDTO> allBadges = buildAllBadgeDTOs();

        final int finalCount = (count == null || count < 1) ? 1 : count;

        Comparator<BadgeDTO> comparator = Comparator.comparing(BadgeDTO::getEarnedCount);
        if (sortOrder == null || sortOrder.equalsIgnoreCase("desc")) {
            comparator = comparator.reversed();
        }

        List<BadgeDTO> ranked = allBadges.stream()
                .sorted(comparator.thenComparing(BadgeDTO::getBadgeKey))
                .limit(finalCount)
                .collect(Collectors.toList());

        for (int i = 0; i < ranked.size(); i++) {
            ranked.get(i).setRank(i + 1);
        }
        return ranked;
    }
}
