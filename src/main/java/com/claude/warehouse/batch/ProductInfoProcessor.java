package com.claude.warehouse.batch;

import com.claude.warehouse.entity.bronze.BronzeProductInfo;
import com.claude.warehouse.entity.silver.SilverProductInfo;
import com.claude.warehouse.rules.FieldNormalizer;
import com.claude.warehouse.rules.TextCleaner;
import com.claude.warehouse.rules.ValueRepairRules;
import com.claude.warehouse.rules.VersionInterval;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * 제품 버전 정제
 *
 * - prd_key 를 카테고리 ID(cat_id)와 나머지 키(prd_key_clean)로 분해
 * - 원가 null 은 0
 * - 제품 라인 코드를 표준 라인명으로 매핑
 * - 종료일은 리더에서 계산된 유효기간 종료일 사용
 */
@Component
@StepScope
@Slf4j
public class ProductInfoProcessor implements ItemProcessor<VersionInterval<BronzeProductInfo>, SilverProductInfo> {

    private final FieldNormalizer fieldNormalizer;
    private final ValueRepairRules repairRules;
    private final LocalDateTime loadedAt;

    public ProductInfoProcessor(FieldNormalizer fieldNormalizer,
                                ValueRepairRules repairRules,
                                @Value("#{jobParameters['loadedAt']}") LocalDateTime loadedAt) {
        this.fieldNormalizer = fieldNormalizer;
        this.repairRules = repairRules;
        this.loadedAt = loadedAt != null ? loadedAt : LocalDateTime.now();
    }

    @Override
    public SilverProductInfo process(VersionInterval<BronzeProductInfo> item) {
        BronzeProductInfo product = item.getVersion();
        String productKey = TextCleaner.clean(product.getProductKey());

        if (item.getEndDate() != null && !item.getEndDate().equals(product.getEndDate())) {
            log.debug("제품 {} ({}) 종료일 재계산: {} -> {}",
                    product.getProductId(), productKey, product.getEndDate(), item.getEndDate());
        }

        return SilverProductInfo.builder()
                .productId(product.getProductId())
                .productKey(productKey)
                .categoryId(repairRules.categoryId(productKey))
                .productKeyClean(repairRules.productKeySuffix(productKey))
                .productName(TextCleaner.clean(product.getProductName()))
                .cost(repairRules.costOrZero(product.getCost()))
                .productLine(fieldNormalizer.productLine(product.getProductLine()))
                .startDate(product.getStartDate())
                .endDate(item.getEndDate())
                .dwhDateLoaded(loadedAt)
                .build();
    }
}
