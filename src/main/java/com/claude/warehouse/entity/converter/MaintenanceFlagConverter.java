package com.claude.warehouse.entity.converter;

import com.claude.warehouse.domain.MaintenanceFlag;
import jakarta.persistence.Converter;

@Converter
public class MaintenanceFlagConverter extends CanonicalValueConverter<MaintenanceFlag> {

    public MaintenanceFlagConverter() {
        super(MaintenanceFlag::fromLabel);
    }
}
