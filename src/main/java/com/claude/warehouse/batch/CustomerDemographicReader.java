package com.claude.warehouse.batch;

import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.entity.bronze.BronzeCustomerDemographic;
import com.claude.warehouse.repository.bronze.BronzeCustomerDemographicRepository;
import com.claude.warehouse.rules.FieldNormalizer;
import com.claude.warehouse.rules.SelectionResult;
import com.claude.warehouse.rules.SurvivorshipSelector;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * 태그가 제거된 고객 키 별로 생년월일이 가장 최근인 레코드를 선택
 */
@Component
@StepScope
public class CustomerDemographicReader extends SurvivorItemReader<BronzeCustomerDemographic> {

    private final BronzeCustomerDemographicRepository repository;
    private final FieldNormalizer fieldNormalizer;

    public CustomerDemographicReader(BronzeCustomerDemographicRepository repository,
                                     FieldNormalizer fieldNormalizer) {
        super(SilverEntity.ERP_CUST_DEMOGRAPHICS);
        this.repository = repository;
        this.fieldNormalizer = fieldNormalizer;
    }

    @Override
    protected SelectionResult<BronzeCustomerDemographic> selectSurvivors() {
        return SurvivorshipSelector.<BronzeCustomerDemographic, String, LocalDate>latestBy(
                        demographic -> fieldNormalizer.demographicCustomerKey(demographic.getCustomerKey()),
                        BronzeCustomerDemographic::getBirthDate)
                .select(repository.findAllByOrderByRowIdAsc());
    }
}
