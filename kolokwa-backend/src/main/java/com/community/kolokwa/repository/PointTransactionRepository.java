package com.community.kolokwa.repository;

import com.community.kolokwa.entity.PointTransaction;
import com.community.kolokwa.entity.TransactionType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PointTransactionRepository extends JpaRepository<PointTransaction, Long> {

    boolean existsByIdempotencyKey(String idempotencyKey);

    @Query("SELECT COALESCE(SUM(t.points), 0) FROM PointTransaction t WHERE t.memberId = :memberId")
    Long sumPointsByMemberId(Long memberId);

    List<PointTransaction> findTop20ByMemberIdOrderByCreatedAtDescIdDesc(Long memberId);

    List<PointTransaction> findByMemberIdAndTransactionType(Long memberId, TransactionType transactionType);

    List<PointTransaction> findByMemberIdOrderByIdAsc(Long memberId);

    // member_id -> ledger sum, for reconciliation
    @Query("SELECT t.memberId, SUM(t.points) FROM PointTransaction t GROUP BY t.memberId")
    List<Object[]> sumGroupByMember();
}
