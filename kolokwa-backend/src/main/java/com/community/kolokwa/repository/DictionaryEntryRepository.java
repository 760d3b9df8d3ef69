package com.community.kolokwa.repository;

import com.community.kolokwa.entity.DictionaryEntry;
import com.community.kolokwa.entity.EntryStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DictionaryEntryRepository extends JpaRepository<DictionaryEntry, Long> {

    // Entry row lock, always taken before any member lock
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM DictionaryEntry e WHERE e.id = :entryId")
    Optional<DictionaryEntry> findByIdForUpdate(Long entryId);

    // Duplicate check: same text (case-insensitive) outside the rejected pile
    @Query("SELECT e FROM DictionaryEntry e WHERE LOWER(e.koloquaText) = LOWER(:koloquaText) AND e.status <> :excluded")
    List<DictionaryEntry> findByTextIgnoreCaseAndStatusNot(String koloquaText, EntryStatus excluded);

    List<DictionaryEntry> findByStatusOrderByCreatedAtDesc(EntryStatus status, Pageable pageable);

    List<DictionaryEntry> findByStatusAndContributorIdIsNotNull(EntryStatus status);

    long countByContributorId(Long contributorId);

    long countByContributorIdAndUpvotesGreaterThanEqual(Long contributorId, Integer upvotes);

    // ----------------- Ranking by score: upvotes - downvotes + 2 * verification_count -----------------

    @Query("SELECT e FROM DictionaryEntry e WHERE e.status = :status " +
            "ORDER BY (e.upvotes - e.downvotes + e.verificationCount * 2) DESC, e.id ASC")
    List<DictionaryEntry> findRankingDesc(EntryStatus status, Pageable pageable);

    @Query("SELECT e FROM DictionaryEntry e WHERE e.status = :status " +
            "ORDER BY (e.upvotes - e.downvotes + e.verificationCount * 2) ASC, e.id ASC")
    List<DictionaryEntry> findRankingAsc(EntryStatus status, Pageable pageable);

    @Query("SELECT COUNT(e) FROM DictionaryEntry e WHERE e.status = :status " +
            "AND (e.upvotes - e.downvotes + e.verificationCount * 2) > :score")
    long countWithHigherScore(EntryStatus status, int score);

    // entry_id, upvotes, downvotes, verification_count without loading entities, for reconciliation
    @Query("SELECT e.id, e.upvotes, e.downvotes, e.verificationCount FROM DictionaryEntry e ORDER BY e.id")
    List<Object[]> findAllCounters();

    // contributor_id -> number of entries, for reconciliation
    @Query("SELECT e.contributorId, COUNT(e) FROM DictionaryEntry e WHERE e.contributorId IS NOT NULL GROUP BY e.contributorId")
    List<Object[]> countGroupByContributor();
}
