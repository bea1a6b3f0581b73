package com.claude.warehouse.batch;

import com.claude.warehouse.entity.bronze.BronzeSalesDetail;
import com.claude.warehouse.entity.silver.SilverSalesDetail;
import com.claude.warehouse.rules.SalesFigures;
import com.claude.warehouse.rules.TextCleaner;
import com.claude.warehouse.rules.ValueRepairRules;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

@Component
@StepScope
@Slf4j
public class SalesDetailProcessor implements ItemProcessor<BronzeSalesDetail, SilverSalesDetail> {

    private final ValueRepairRules repairRules;
    private final LocalDateTime loadedAt;

    public SalesDetailProcessor(ValueRepairRules repairRules,
                                @Value("#{jobParameters['loadedAt']}") LocalDateTime loadedAt) {
        this.repairRules = repairRules;
        this.loadedAt = loadedAt != null ? loadedAt : LocalDateTime.now();
    }

    @Override
    public SilverSalesDetail process(BronzeSalesDetail item) {
        SalesFigures figures = repairRules.reconcileSales(item.getSales(), item.getQuantity(), item.getPrice());

        return SilverSalesDetail.builder()
                .orderNumber(TextCleaner.clean(item.getOrderNumber()))
                .productKey(TextCleaner.clean(item.getProductKey()))
                .customerId(item.getCustomerId())
                .orderDate(repairRules.packedDate(item.getOrderDate()))
                .shipDate(repairRules.packedDate(item.getShipDate()))
                .dueDate(repairRules.packedDate(item.getDueDate()))
                .sales(figures.getAmount())
                .quantity(figures.getQuantity())
                .price(figures.getPrice())
                .dwhDateLoaded(loadedAt)
                .build();
    }
}
