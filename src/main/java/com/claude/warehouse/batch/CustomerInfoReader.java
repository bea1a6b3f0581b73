package com.claude.warehouse.batch;

import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.entity.bronze.BronzeCustomerInfo;
import com.claude.warehouse.repository.bronze.BronzeCustomerInfoRepository;
import com.claude.warehouse.rules.SelectionResult;
import com.claude.warehouse.rules.SurvivorshipSelector;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * cst_id 별로 생성일(cst_create_date)이 가장 최근인 고객 레코드를 선택
 */
@Component
@StepScope
public class CustomerInfoReader extends SurvivorItemReader<BronzeCustomerInfo> {

    private final BronzeCustomerInfoRepository repository;

    public CustomerInfoReader(BronzeCustomerInfoRepository repository) {
        super(SilverEntity.CRM_CUST_INFO);
        this.repository = repository;
    }

    @Override
    protected SelectionResult<BronzeCustomerInfo> selectSurvivors() {
        return SurvivorshipSelector.<BronzeCustomerInfo, Integer, LocalDate>latestBy(
                        BronzeCustomerInfo::getCustomerId,
                        BronzeCustomerInfo::getCreateDate)
                .select(repository.findAllByOrderByRowIdAsc());
    }
}
