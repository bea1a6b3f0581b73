package com.claude.warehouse.batch;

import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.entity.bronze.BronzeProductCategory;
import com.claude.warehouse.repository.bronze.BronzeProductCategoryRepository;
import com.claude.warehouse.rules.SelectionResult;
import com.claude.warehouse.rules.SurvivorshipSelector;
import com.claude.warehouse.rules.TextCleaner;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.stereotype.Component;

@Component
@StepScope
public class ProductCategoryReader extends SurvivorItemReader<BronzeProductCategory> {

    private final BronzeProductCategoryRepository repository;

    public ProductCategoryReader(BronzeProductCategoryRepository repository) {
        super(SilverEntity.ERP_PRODUCT_CATEGORIES);
        this.repository = repository;
    }

    @Override
    protected SelectionResult<BronzeProductCategory> selectSurvivors() {
        return SurvivorshipSelector.<BronzeProductCategory, String>firstSeen(
                        category -> TextCleaner.cleanKey(category.getCategoryId()))
                .select(repository.findAllByOrderByRowIdAsc());
    }
}
