package com.community.kolokwa.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Badge Entity: reference data describing one earnable badge.
 * A non-zero requirement is a threshold check; badges without one are awarded by a special rule.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Entity
@Table(name = "badges", uniqueConstraints = {
        @UniqueConstraint(name = "uk_badge_name", columnNames = {"name"})
})
public class Badge {

    /**
     * badge_key: stable identifier, also the key special rules register under (Primary Key)
     */
    @Id
    @Column(name = "badge_key", length = 50)
    private String badgeKey;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "badge_type", nullable = false, length = 20)
    private BadgeType badgeType;

    @Column(name = "points_required", nullable = false)
    @Builder.Default
    private Integer pointsRequired = 0;

    @Column(name = "contributions_required", nullable = false)
    @Builder.Default
    private Integer contributionsRequired = 0;

    @Column(name = "verifications_required", nullable = false)
    @Builder.Default
    private Integer verificationsRequired = 0;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;
}
