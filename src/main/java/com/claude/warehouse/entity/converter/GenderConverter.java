package com.claude.warehouse.entity.converter;

import com.claude.warehouse.domain.Gender;
import jakarta.persistence.Converter;

@Converter
public class GenderConverter extends CanonicalValueConverter<Gender> {

    public GenderConverter() {
        super(Gender::fromLabel);
    }
}
