package com.community.kolokwa.entity;

import com.community.kolokwa.exception.ValidationException;

public enum VerificationType {

    ACCURATE("accurate"),
    NEEDS_REVISION("needs_revision"),
    INCORRECT("incorrect");

    private final String code;

    VerificationType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static VerificationType fromCode(String code) {
        if (code != null) {
            for (VerificationType type : values()) {
                if (type.code.equalsIgnoreCase(code.trim())) {
                    return type;
                }
            }
        }
        throw new ValidationException("Invalid verification type: " + code);
    }
}
