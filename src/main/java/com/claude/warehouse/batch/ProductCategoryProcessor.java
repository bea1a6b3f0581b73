package com.claude.warehouse.batch;

import com.claude.warehouse.entity.bronze.BronzeProductCategory;
import com.claude.warehouse.entity.silver.SilverProductCategory;
import com.claude.warehouse.rules.FieldNormalizer;
import com.claude.warehouse.rules.TextCleaner;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

@Component
@StepScope
public class ProductCategoryProcessor implements ItemProcessor<BronzeProductCategory, SilverProductCategory> {

    private final FieldNormalizer fieldNormalizer;
    private final LocalDateTime loadedAt;

    public ProductCategoryProcessor(FieldNormalizer fieldNormalizer,
                                    @Value("#{jobParameters['loadedAt']}") LocalDateTime loadedAt) {
        this.fieldNormalizer = fieldNormalizer;
        this.loadedAt = loadedAt != null ? loadedAt : LocalDateTime.now();
    }

    @Override
    public SilverProductCategory process(BronzeProductCategory item) {
        return SilverProductCategory.builder()
                .categoryId(TextCleaner.clean(item.getCategoryId()))
                .category(TextCleaner.clean(item.getCategory()))
                .subcategory(TextCleaner.clean(item.getSubcategory()))
                .maintenance(fieldNormalizer.maintenanceFlag(item.getMaintenance()))
                .dwhDateLoaded(loadedAt)
                .build();
    }
}
