package com.claude.warehouse.domain;

import lombok.Getter;

@Getter
public enum MaritalStatus implements CanonicalValue {
    SINGLE("Single"),
    MARRIED("Married"),
    UNKNOWN("Unknown");

    private final String label;

    MaritalStatus(String label) {
        this.label = label;
    }

    public static MaritalStatus fromLabel(String label) {
        for (MaritalStatus status : values()) {
            if (status.label.equals(label)) {
                return status;
            }
        }
        return UNKNOWN;
    }
}
