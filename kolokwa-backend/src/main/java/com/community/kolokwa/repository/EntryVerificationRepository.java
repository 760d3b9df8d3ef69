package com.community.kolokwa.repository;

import com.community.kolokwa.entity.EntryVerification;
import com.community.kolokwa.entity.VerificationType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface EntryVerificationRepository extends JpaRepository<EntryVerification, Long> {

    Optional<EntryVerification> findByEntryIdAndVerifierId(Long entryId, Long verifierId);

    long countByEntryIdAndVerificationType(Long entryId, VerificationType verificationType);

    long countByVerifierId(Long verifierId);

    boolean existsByEntryId(Long entryId);

    // entry_id -> accurate count, for reconciliation
    @Query("SELECT v.entryId, COUNT(v) FROM EntryVerification v WHERE v.verificationType = :type GROUP BY v.entryId")
    List<Object[]> countGroupByEntryForType(VerificationType type);

    // verifier_id -> verification rows, for reconciliation
    @Query("SELECT v.verifierId, COUNT(v) FROM EntryVerification v GROUP BY v.verifierId")
    List<Object[]> countGroupByVerifier();
}
