package com.community.kolokwa.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Member Entity: community member as provisioned by the auth layer.
 * points / level / contributions_count / verifications_count are denormalized from the
 * ledgers and can be rebuilt by reconciliation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "members", indexes = {
        @Index(name = "idx_member_points", columnList = "points")
})
public class Member {

    /**
     * member_id: assigned by the auth layer (Primary Key)
     */
    @Id
    @Column(name = "member_id")
    private Long memberId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    /**
     * join_date: used by the early adopter badge
     */
    @Column(name = "join_date", nullable = false)
    private LocalDateTime joinDate;

    /**
     * is_staff: moderators may edit, withdraw and moderate any entry
     */
    @Column(name = "is_staff", nullable = false)
    @Builder.Default
    private boolean staff = false;

    /** points: materialized balance, always equal to the sum of the member's point transactions */
    @Column(name = "points", nullable = false)
    @Builder.Default
    private Integer points = 0;

    @Enumerated(EnumType.STRING)
    @Column(name = "level", nullable = false, length = 20)
    @Builder.Default
    private MemberLevel level = MemberLevel.BEGINNER;

    /** contributions_count: entries submitted by this member */
    @Column(name = "contributions_count", nullable = false)
    @Builder.Default
    private Integer contributionsCount = 0;

    /** verifications_count: distinct entries this member has verified */
    @Column(name = "verifications_count", nullable = false)
    @Builder.Default
    private Integer verificationsCount = 0;
}
