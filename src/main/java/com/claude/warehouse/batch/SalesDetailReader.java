package com.claude.warehouse.batch;

import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.entity.bronze.BronzeSalesDetail;
import com.claude.warehouse.repository.bronze.BronzeSalesDetailRepository;
import com.claude.warehouse.rules.SelectionResult;
import com.claude.warehouse.rules.SurvivorshipSelector;
import com.claude.warehouse.rules.TextCleaner;
import lombok.Value;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.stereotype.Component;

/**
 * 주문번호 + 제품키 별로 주문일(정수 YYYYMMDD)이 가장 큰 판매 라인을 선택
 */
@Component
@StepScope
public class SalesDetailReader extends SurvivorItemReader<BronzeSalesDetail> {

    private final BronzeSalesDetailRepository repository;

    public SalesDetailReader(BronzeSalesDetailRepository repository) {
        super(SilverEntity.CRM_SALES_DETAILS);
        this.repository = repository;
    }

    @Override
    protected SelectionResult<BronzeSalesDetail> selectSurvivors() {
        return SurvivorshipSelector.<BronzeSalesDetail, SalesLineKey, Integer>latestBy(
                        SalesLineKey::of,
                        BronzeSalesDetail::getOrderDate)
                .select(repository.findAllByOrderByRowIdAsc());
    }

    @Value
    public static class SalesLineKey {
        String orderNumber;
        String productKey;

        public static SalesLineKey of(BronzeSalesDetail line) {
            String orderNumber = TextCleaner.cleanKey(line.getOrderNumber());
            String productKey = TextCleaner.cleanKey(line.getProductKey());
            if (orderNumber == null || productKey == null) {
                return null;
            }
            return new SalesLineKey(orderNumber, productKey);
        }
    }
}
