package com.claude.warehouse.batch;

import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.entity.bronze.BronzeProductInfo;
import com.claude.warehouse.repository.bronze.BronzeProductInfoRepository;
import com.claude.warehouse.rules.SelectionResult;
import com.claude.warehouse.rules.SurvivorshipSelector;
import com.claude.warehouse.rules.TemporalIntervalDeriver;
import com.claude.warehouse.rules.TextCleaner;
import com.claude.warehouse.rules.VersionInterval;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;

/**
 * 제품 버전 리더
 *
 * 1. prd_id(버전 키) 별로 시작일이 가장 최근인 레코드 선택
 * 2. 남은 버전들을 prd_key 로 묶어 다음 버전 시작일 기준으로 종료일 계산
 */
@Component
@StepScope
public class ProductInfoReader extends SurvivorItemReader<VersionInterval<BronzeProductInfo>> {

    private final BronzeProductInfoRepository repository;

    private final TemporalIntervalDeriver<BronzeProductInfo> intervalDeriver = new TemporalIntervalDeriver<>(
            product -> TextCleaner.cleanKey(product.getProductKey()),
            BronzeProductInfo::getStartDate,
            BronzeProductInfo::getEndDate);

    public ProductInfoReader(BronzeProductInfoRepository repository) {
        super(SilverEntity.CRM_PRD_INFO);
        this.repository = repository;
    }

    @Override
    protected SelectionResult<VersionInterval<BronzeProductInfo>> selectSurvivors() {
        SelectionResult<BronzeProductInfo> versions = SurvivorshipSelector
                .<BronzeProductInfo, Integer, LocalDate>latestBy(
                        BronzeProductInfo::getProductId,
                        BronzeProductInfo::getStartDate)
                .select(repository.findAllByOrderByRowIdAsc());

        List<VersionInterval<BronzeProductInfo>> intervals = intervalDeriver.derive(versions.getSurvivors());

        return new SelectionResult<>(intervals, versions.getRawRows(),
                versions.getNullKeyRows(), versions.getDuplicateRows());
    }
}
