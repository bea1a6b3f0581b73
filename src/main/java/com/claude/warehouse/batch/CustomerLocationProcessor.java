package com.claude.warehouse.batch;

import com.claude.warehouse.entity.bronze.BronzeCustomerLocation;
import com.claude.warehouse.entity.silver.SilverCustomerLocation;
import com.claude.warehouse.rules.FieldNormalizer;
import com.claude.warehouse.rules.TextCleaner;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

@Component
@StepScope
public class CustomerLocationProcessor implements ItemProcessor<BronzeCustomerLocation, SilverCustomerLocation> {

    private final FieldNormalizer fieldNormalizer;
    private final LocalDateTime loadedAt;

    public CustomerLocationProcessor(FieldNormalizer fieldNormalizer,
                                     @Value("#{jobParameters['loadedAt']}") LocalDateTime loadedAt) {
        this.fieldNormalizer = fieldNormalizer;
        this.loadedAt = loadedAt != null ? loadedAt : LocalDateTime.now();
    }

    @Override
    public SilverCustomerLocation process(BronzeCustomerLocation item) {
        return SilverCustomerLocation.builder()
                .customerKey(TextCleaner.clean(item.getCustomerKey()))
                .country(fieldNormalizer.country(item.getCountry()))
                .dwhDateLoaded(loadedAt)
                .build();
    }
}
