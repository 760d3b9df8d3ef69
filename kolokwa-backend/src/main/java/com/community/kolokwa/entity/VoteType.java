package com.community.kolokwa.entity;

import com.community.kolokwa.exception.ValidationException;

/**
 * Vote polarity. The value doubles as the point delta a new vote gives the contributor.
 */
public enum VoteType {

    UPVOTE(1),
    DOWNVOTE(-1);

    private final int value;

    VoteType(int value) {
        this.value = value;
    }

    public int getValue() {
        return value;
    }

    public VoteType opposite() {
        return this == UPVOTE ? DOWNVOTE : UPVOTE;
    }

    public static VoteType fromValue(Integer value) {
        if (value != null) {
            for (VoteType type : values()) {
                if (type.value == value) {
                    return type;
                }
            }
        }
        throw new ValidationException("Invalid vote type: " + value);
    }
}
