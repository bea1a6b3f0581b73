package com.claude.warehouse.batch;

import com.claude.warehouse.entity.bronze.BronzeCustomerDemographic;
import com.claude.warehouse.entity.silver.SilverCustomerDemographic;
import com.claude.warehouse.rules.FieldNormalizer;
import com.claude.warehouse.rules.ValueRepairRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Component
@StepScope
@Slf4j
public class CustomerDemographicProcessor
        implements ItemProcessor<BronzeCustomerDemographic, SilverCustomerDemographic> {

    private final FieldNormalizer fieldNormalizer;
    private final ValueRepairRules repairRules;
    private final LocalDateTime loadedAt;

    public CustomerDemographicProcessor(FieldNormalizer fieldNormalizer,
                                        ValueRepairRules repairRules,
                                        @Value("#{jobParameters['loadedAt']}") LocalDateTime loadedAt) {
        this.fieldNormalizer = fieldNormalizer;
        this.repairRules = repairRules;
        this.loadedAt = loadedAt != null ? loadedAt : LocalDateTime.now();
    }

    @Override
    public SilverCustomerDemographic process(BronzeCustomerDemographic item) {
        LocalDate birthDate = repairRules.birthDateOrNull(item.getBirthDate(), loadedAt.toLocalDate());
        if (birthDate == null && item.getBirthDate() != null) {
            log.debug("고객 {} 미래 생년월일 {} 무효 처리", item.getCustomerKey(), item.getBirthDate());
        }

        return SilverCustomerDemographic.builder()
                .customerKey(fieldNormalizer.demographicCustomerKey(item.getCustomerKey()))
                .birthDate(birthDate)
                .gender(fieldNormalizer.gender(item.getGender()))
                .dwhDateLoaded(loadedAt)
                .build();
    }
}
