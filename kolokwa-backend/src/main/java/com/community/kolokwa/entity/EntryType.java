package com.community.kolokwa.entity;

import com.community.kolokwa.exception.ValidationException;

public enum EntryType {

    WORD("word"),
    PHRASE("phrase"),
    IDIOM("idiom"),
    PROVERB("proverb");

    private final String code;

    EntryType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Blank input defaults to {@link #WORD}.
     */
    public static EntryType fromCode(String code) {
        if (code == null || code.isBlank()) {
            return WORD;
        }
        for (EntryType type : values()) {
            if (type.code.equalsIgnoreCase(code.trim())) {
                return type;
            }
        }
        throw new ValidationException("Invalid entry type: " + code);
    }
}
