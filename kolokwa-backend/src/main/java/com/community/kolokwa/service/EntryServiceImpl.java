package com.community.kolokwa.service;

import com.community.kolokwa.dto.EntryDTO;
import com.community.kolokwa.entity.DictionaryEntry;
import com.community.kolokwa.entity.EntryStatus;
import com.community.kolokwa.entity.EntryVote;
import com.community.kolokwa.entity.Member;
import com.community.kolokwa.exception.NotFoundException;
import com.community.kolokwa.repository.DictionaryEntryRepository;
import com.community.kolokwa.repository.EntryVoteRepository;
import com.community.kolokwa.repository.MemberRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

@Service
@Transactional(readOnly = true)
public class EntryServiceImpl implements EntryService {

    static final int MAX_COUNT = 100;

    private final DictionaryEntryRepository entryRepository;
    private final EntryVoteRepository voteRepository;
    private final MemberRepository memberRepository;

    public EntryServiceImpl(DictionaryEntryRepository entryRepository,
                            EntryVoteRepository voteRepository,
                            MemberRepository memberRepository) {
        this.entryRepository = entryRepository;
        this.voteRepository = voteRepository;
        this.memberRepository = memberRepository;
    }

    @Override
    public EntryDTO getEntry(Long entryId, Long viewerId) {
        DictionaryEntry entry = entryRepository.findById(entryId)
                .orElseThrow(() -> new NotFoundException("Entry not found: " + entryId));

        if (entry.getStatus() == EntryStatus.REJECTED && !canSeeRejected(entry, viewerId)) {
            throw new NotFoundException("Entry not found: " + entryId);
        }

        EntryDTO dto = EntryMapper.toDTO(entry);

        // rank = (verified entries with a higher score) + 1
        if (entry.getStatus() == EntryStatus.VERIFIED) {
            long higher = entryRepository.countWithHigherScore(EntryStatus.VERIFIED, entry.calculateScore());
            dto.setRank((int) higher + 1);
        }

        if (viewerId != null) {
            dto.setUserVote(voteRepository.findByEntryIdAndVoterId(entryId, viewerId)
                    .map(EntryVote::getVoteType)
                    .orElse(null));
        }
        return dto;
    }

    @Override
    public List<EntryDTO> getEntryRanking(Integer count, String sortOrder) {
        final int finalCount = clamp(count, 1);
        PageRequest page = PageRequest.of(0, finalCount);

        List<DictionaryEntry> entities = "asc".equalsIgnoreCase(sortOrder)
                ? entryRepository.findRankingAsc(EntryStatus.VERIFIED, page)
                : entryRepository.findRankingDesc(EntryStatus.VERIFIED, page);

        List<EntryDTO> ranking = new ArrayList<>(entities.size());
        for (int i = 0; i < entities.size(); i++) {
            EntryDTO dto = EntryMapper.toDTO(entities.get(i));
            dto.setRank(i + 1);
            ranking.add(dto);
        }
        return ranking;
    }

    @Override
    public List<EntryDTO> getPendingEntries(Integer count) {
        return entryRepository.findByStatusOrderByCreatedAtDesc(EntryStatus.PENDING, PageRequest.of(0, clamp(count, 20)))
                .stream()
                .map(EntryMapper::toDTO)
                .collect(Collectors.toList());
    }

    private boolean canSeeRejected(DictionaryEntry entry, Long viewerId) {
        if (viewerId == null) {
            return false;
        }
        if (Objects.equals(entry.getContributorId(), viewerId)) {
            return true;
        }
        return memberRepository.findById(viewerId).map(Member::isStaff).orElse(false);
    }

    private static int clamp(Integer count, int defaultCount) {
        if (count == null) {
            return defaultCount;
        }
        return Math.max(1, Math.min(count, MAX_COUNT));
    }
}
