package com.community.kolokwa.entity;

public enum BadgeType {
    CONTRIBUTION,
    VERIFICATION,
    STREAK,
    SPECIAL
}
