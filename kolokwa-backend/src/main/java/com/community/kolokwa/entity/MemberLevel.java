package com.community.kolokwa.entity;

/**
 * Contributor levels, derived from the point balance against fixed ascending thresholds.
 */
public enum MemberLevel {

    BEGINNER("beginner", "Beginner", 0),
    CONTRIBUTOR("contributor", "Contributor", 100),
    EXPERT("expert", "Expert", 500),
    MASTER("master", "Master", 1000),
    LEGEND("legend", "Legend", 2500),
    CHAMPION("champion", "Kolokwa Champion", 5000);

    private final String code;
    private final String displayName;
    private final int threshold;

    MemberLevel(String code, String displayName, int threshold) {
        this.code = code;
        this.displayName = displayName;
        this.threshold = threshold;
    }

    public String getCode() {
        return code;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getThreshold() {
        return threshold;
    }

    public static MemberLevel fromPoints(int points) {
        MemberLevel current = BEGINNER;
        for (MemberLevel level : values()) {
            if (points < level.threshold) {
                break;
            }
            current = level;
        }
        return current;
    }

    /**
     * @return the following level, or null for the top level
     */
    public MemberLevel next() {
        MemberLevel[] levels = values();
        return ordinal() + 1 < levels.length ? levels[ordinal() + 1] : null;
    }

    /**
     * Progress towards the next level in percent (0-100). Top level is always 100.
     */
    public double progressPercent(int points) {
        MemberLevel next = next();
        if (next == null) {
            return 100.0;
        }
        int range = next.threshold - threshold;
        double progress = (points - threshold) * 100.0 / range;
        return Math.max(0.0, Math.min(progress, 100.0));
    }
}
