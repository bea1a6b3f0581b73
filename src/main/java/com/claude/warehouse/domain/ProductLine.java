package com.claude.warehouse.domain;

import lombok.Getter;

@Getter
public enum ProductLine implements CanonicalValue {
    MOUNTAIN("Mountain"),
    ROAD("Road"),
    TOURING("Touring"),
    OTHER("Other");

    private final String label;

    ProductLine(String label) {
        this.label = label;
    }

    public static ProductLine fromLabel(String label) {
        for (ProductLine line : values()) {
            if (line.label.equals(label)) {
                return line;
            }
        }
        return OTHER;
    }
}
