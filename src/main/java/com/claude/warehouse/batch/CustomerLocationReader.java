package com.claude.warehouse.batch;

import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.entity.bronze.BronzeCustomerLocation;
import com.claude.warehouse.repository.bronze.BronzeCustomerLocationRepository;
import com.claude.warehouse.rules.SelectionResult;
import com.claude.warehouse.rules.SurvivorshipSelector;
import com.claude.warehouse.rules.TextCleaner;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 고객 위치 리더. 정렬 기준이 없으므로 입력 순서상 첫 레코드가 생존
 */
@Component
@StepScope
public class CustomerLocationReader extends SurvivorItemReader<BronzeCustomerLocation> {

    private final BronzeCustomerLocationRepository repository;

    public CustomerLocationReader(BronzeCustomerLocationRepository repository) {
        super(SilverEntity.ERP_CUST_LOCATION);
        this.repository = repository;
    }

    @Override
    protected SelectionResult<BronzeCustomerLocation> selectSurvivors() {
        List<BronzeCustomerLocation> rows = excludeBeforeSelection(repository.findAllByOrderByRowIdAsc(),
                location -> location.getCountry() != null, "국가 누락");

        return SurvivorshipSelector.<BronzeCustomerLocation, String>firstSeen(
                        location -> TextCleaner.cleanKey(location.getCustomerKey()))
                .select(rows);
    }
}
