package com.claude.warehouse.entity.converter;

import com.claude.warehouse.domain.MaritalStatus;
import jakarta.persistence.Converter;

@Converter
public class MaritalStatusConverter extends CanonicalValueConverter<MaritalStatus> {

    public MaritalStatusConverter() {
        super(MaritalStatus::fromLabel);
    }
}
