package com.claude.warehouse.domain;

import lombok.Getter;

@Getter
public enum MaintenanceFlag implements CanonicalValue {
    YES("Yes"),
    NO("No"),
    UNKNOWN("Unknown");

    private final String label;

    MaintenanceFlag(String label) {
        this.label = label;
    }

    public static MaintenanceFlag fromLabel(String label) {
        for (MaintenanceFlag flag : values()) {
            if (flag.label.equals(label)) {
                return flag;
            }
        }
        return UNKNOWN;
    }
}
