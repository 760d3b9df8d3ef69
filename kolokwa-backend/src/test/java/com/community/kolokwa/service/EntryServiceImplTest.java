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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
public class EntryServiceImplTest {

    @Mock
    private DictionaryEntryRepository entryRepository;

    @Mock
    private EntryVoteRepository voteRepository;

    @Mock
    private MemberRepository memberRepository;

    @InjectMocks
    private EntryServiceImpl entryService;

    private DictionaryEntry entry(long id, EntryStatus status, int up, int down, int verifications) {
        return DictionaryEntry.builder()
                .id(id)
                .koloquaText("Entry " + id)
                .englishTranslation("Meaning " + id)
                .contributorId(1L)
                .status(status)
                .upvotes(up)
                .downvotes(down)
                .verificationCount(verifications)
                .build();
    }

    @Test
    void testGetEntry_VerifiedHasRankAndVote() {
        when(entryRepository.findById(5L)).thenReturn(Optional.of(entry(5L, EntryStatus.VERIFIED, 3, 1, 3)));
        when(entryRepository.countWithHigherScore(EntryStatus.VERIFIED, 8)).thenReturn(2L);
        when(voteRepository.findByEntryIdAndVoterId(5L, 9L))
                .thenReturn(Optional.of(EntryVote.builder().voteType(-1).build()));

        EntryDTO dto = entryService.getEntry(5L, 9L);

        assertEquals(8, dto.getScore());
        assertEquals(3, dto.getRank());
        assertEquals(-1, dto.getUserVote());
        assertEquals("verified", dto.getStatus());
    }

    @Test
    void testGetEntry_PendingHasNoRank() {
        when(entryRepository.findById(6L)).thenReturn(Optional.of(entry(6L, EntryStatus.PENDING, 0, 0, 0)));

        EntryDTO dto = entryService.getEntry(6L, null);

        assertNull(dto.getRank());
        assertNull(dto.getUserVote());
        verify(entryRepository, never()).countWithHigherScore(any(), anyInt());
        verifyNoInteractions(voteRepository);
    }

    @Test
    void testGetEntry_RejectedVisibility() {
        when(entryRepository.findById(7L)).thenReturn(Optional.of(entry(7L, EntryStatus.REJECTED, 0, 0, 0)));
        when(memberRepository.findById(2L)).thenReturn(Optional.of(Member.builder().memberId(2L).build()));
        when(memberRepository.findById(99L)).thenReturn(Optional.of(Member.builder().memberId(99L).staff(true).build()));

        assertThrows(NotFoundException.class, () -> entryService.getEntry(7L, null));
        assertThrows(NotFoundException.class, () -> entryService.getEntry(7L, 2L));
        assertEquals("rejected", entryService.getEntry(7L, 1L).getStatus());
        assertEquals("rejected", entryService.getEntry(7L, 99L).getStatus());
    }

    @Test
    void testGetEntryRanking() {
        when(entryRepository.findRankingDesc(eq(EntryStatus.VERIFIED), any(Pageable.class)))
                .thenReturn(List.of(entry(1L, EntryStatus.VERIFIED, 9, 0, 3), entry(2L, EntryStatus.VERIFIED, 1, 0, 3)));

        List<EntryDTO> ranking = entryService.getEntryRanking(500, null);

        assertEquals(2, ranking.size());
        assertEquals(1, ranking.get(0).getRank());
        assertEquals(2, ranking.get(1).getRank());
        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(entryRepository).findRankingDesc(eq(EntryStatus.VERIFIED), page.capture());
        assertEquals(100, page.getValue().getPageSize());
    }

    @Test
    void testGetEntryRanking_AscDefaultsToOne() {
        when(entryRepository.findRankingAsc(eq(EntryStatus.VERIFIED), any(Pageable.class))).thenReturn(List.of());

        assertTrue(entryService.getEntryRanking(null, "ASC").isEmpty());

        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);
        verify(entryRepository).findRankingAsc(eq(EntryStatus.VERIFIED), page.capture());
        assertEquals(1, page.getValue().getPageSize());
    }
}
