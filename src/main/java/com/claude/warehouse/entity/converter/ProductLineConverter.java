package com.claude.warehouse.entity.converter;

import com.claude.warehouse.domain.ProductLine;
import jakarta.persistence.Converter;

@Converter
public class ProductLineConverter extends CanonicalValueConverter<ProductLine> {

    public ProductLineConverter() {
        super(ProductLine::fromLabel);
    }
}
