package com.claude.warehouse.batch;

import com.claude.warehouse.entity.bronze.BronzeCustomerInfo;
import com.claude.warehouse.entity.silver.SilverCustomerInfo;
import com.claude.warehouse.rules.FieldNormalizer;
import com.claude.warehouse.rules.TextCleaner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

@Component
@StepScope
@Slf4j
public class CustomerInfoProcessor implements ItemProcessor<BronzeCustomerInfo, SilverCustomerInfo> {

    private final FieldNormalizer fieldNormalizer;
    private final LocalDateTime loadedAt;

    public CustomerInfoProcessor(FieldNormalizer fieldNormalizer,
                                 @Value("#{jobParameters['loadedAt']}") LocalDateTime loadedAt) {
        this.fieldNormalizer = fieldNormalizer;
        this.loadedAt = loadedAt != null ? loadedAt : LocalDateTime.now();
    }

    @Override
    public SilverCustomerInfo process(BronzeCustomerInfo item) {
        log.debug("Processing customer {}", item.getCustomerId());

        return SilverCustomerInfo.builder()
                .customerId(item.getCustomerId())
                .customerKey(TextCleaner.clean(item.getCustomerKey()))
                .firstName(TextCleaner.clean(item.getFirstName()))
                .lastName(TextCleaner.clean(item.getLastName()))
                .maritalStatus(fieldNormalizer.maritalStatus(item.getMaritalStatus()))
                .gender(fieldNormalizer.gender(item.getGender()))
                .createDate(item.getCreateDate())
                .dwhDateLoaded(loadedAt)
                .build();
    }
}
