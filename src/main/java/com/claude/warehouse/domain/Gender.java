package com.claude.warehouse.domain;

import lombok.Getter;

@Getter
public enum Gender implements CanonicalValue {
    MALE("Male"),
    FEMALE("Female"),
    UNKNOWN("Unknown");

    private final String label;

    Gender(String label) {
        this.label = label;
    }

    public static Gender fromLabel(String label) {
        for (Gender gender : values()) {
            if (gender.label.equals(label)) {
                return gender;
            }
        }
        return UNKNOWN;
    }
}
