package com.claude.warehouse.config;

import com.claude.warehouse.batch.CustomerDemographicProcessor;
import com.claude.warehouse.batch.CustomerDemographicReader;
import com.claude.warehouse.batch.CustomerLocationProcessor;
import com.claude.warehouse.batch.CustomerLocationReader;
import com.claude.warehouse.batch.ProductCategoryProcessor;
import com.claude.warehouse.batch.ProductCategoryReader;
import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.entity.silver.SilverCustomerDemographic;
import com.claude.warehouse.entity.silver.SilverCustomerLocation;
import com.claude.warehouse.entity.silver.SilverProductCategory;
import com.claude.warehouse.repository.silver.SilverCustomerDemographicRepository;
import com.claude.warehouse.repository.silver.SilverCustomerLocationRepository;
import com.claude.warehouse.repository.silver.SilverProductCategoryRepository;
import org.springframework.batch.core.Job;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * ERP 원천 파이프라인 (인구통계, 위치, 제품 카테고리)
 */
@Configuration
public class ErpBatchConfig {

    private final SilverPipelineSteps pipelineSteps;

    public ErpBatchConfig(SilverPipelineSteps pipelineSteps) {
        this.pipelineSteps = pipelineSteps;
    }

    @Bean
    public Job erpCustDemographicsJob(CustomerDemographicReader demographicReader,
                                      CustomerDemographicProcessor demographicProcessor,
                                      SilverCustomerDemographicRepository silverRepository) {
        return pipelineSteps.pipeline(SilverEntity.ERP_CUST_DEMOGRAPHICS,
                demographicReader, demographicProcessor,
                SilverCustomerDemographic.class, silverRepository);
    }

    @Bean
    public Job erpCustLocationJob(CustomerLocationReader locationReader,
                                  CustomerLocationProcessor locationProcessor,
                                  SilverCustomerLocationRepository silverRepository) {
        return pipelineSteps.pipeline(SilverEntity.ERP_CUST_LOCATION,
                locationReader, locationProcessor,
                SilverCustomerLocation.class, silverRepository);
    }

    @Bean
    public Job erpProductCategoriesJob(ProductCategoryReader categoryReader,
                                       ProductCategoryProcessor categoryProcessor,
                                       SilverProductCategoryRepository silverRepository) {
        return pipelineSteps.pipeline(SilverEntity.ERP_PRODUCT_CATEGORIES,
                categoryReader, categoryProcessor,
                SilverProductCategory.class, silverRepository);
    }
}
