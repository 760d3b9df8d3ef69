package com.community.kolokwa.repository;

import com.community.kolokwa.entity.EntryVote;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EntryVoteRepository extends JpaRepository<EntryVote, Long> {

    Optional<EntryVote> findByEntryIdAndVoterId(Long entryId, Long voterId);

    long countByEntryIdAndVoteType(Long entryId, Integer voteType);

    boolean existsByEntryId(Long entryId);

    // entry_id, vote_type, count
    @Query("SELECT v.entryId, v.voteType, COUNT(v) FROM EntryVote v GROUP BY v.entryId, v.voteType")
    List<Object[]> countGroupByEntryAndType();
}
