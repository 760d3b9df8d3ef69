package com.community.kolokwa.entity;

import com.community.kolokwa.exception.ValidationException;

/**
 * Review status of a dictionary entry.
 * verified and rejected are terminal; needs_revision and pending may move into each other.
 */
public enum EntryStatus {

    PENDING("pending"),
    VERIFIED("verified"),
    REJECTED("rejected"),
    NEEDS_REVISION("needs_revision");

    private final String code;

    EntryStatus(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isTerminal() {
        return this == VERIFIED || this == REJECTED;
    }

    public boolean canTransitionTo(EntryStatus target) {
        if (target == null || target == this || isTerminal()) {
            return false;
        }
        // pending and needs_revision may reach every other state
        return true;
    }

    public static EntryStatus fromCode(String code) {
        if (code != null) {
            for (EntryStatus status : values()) {
                if (status.code.equalsIgnoreCase(code.trim())) {
                    return status;
                }
            }
        }
        throw new ValidationException("Invalid entry status: " + code);
    }
}
