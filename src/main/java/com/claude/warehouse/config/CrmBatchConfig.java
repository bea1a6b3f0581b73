package com.claude.warehouse.config;

import com.claude.warehouse.batch.CustomerInfoProcessor;
import com.claude.warehouse.batch.CustomerInfoReader;
import com.claude.warehouse.batch.ProductInfoProcessor;
import com.claude.warehouse.batch.ProductInfoReader;
import com.claude.warehouse.batch.SalesDetailProcessor;
import com.claude.warehouse.batch.SalesDetailReader;
import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.entity.silver.SilverCustomerInfo;
import com.claude.warehouse.entity.silver.SilverProductInfo;
import com.claude.warehouse.entity.silver.SilverSalesDetail;
import com.claude.warehouse.repository.silver.SilverCustomerInfoRepository;
import com.claude.warehouse.repository.silver.SilverProductInfoRepository;
import com.claude.warehouse.repository.silver.SilverSalesDetailRepository;
import org.springframework.batch.core.Job;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * CRM 원천 파이프라인 (고객, 제품, 판매)
 */
@Configuration
public class CrmBatchConfig {

    private final SilverPipelineSteps pipelineSteps;

    public CrmBatchConfig(SilverPipelineSteps pipelineSteps) {
        this.pipelineSteps = pipelineSteps;
    }

    @Bean
    public Job crmCustInfoJob(CustomerInfoReader customerInfoReader,
                              CustomerInfoProcessor customerInfoProcessor,
                              SilverCustomerInfoRepository silverRepository) {
        return pipelineSteps.pipeline(SilverEntity.CRM_CUST_INFO,
                customerInfoReader, customerInfoProcessor,
                SilverCustomerInfo.class, silverRepository);
    }

    @Bean
    public Job crmPrdInfoJob(ProductInfoReader productInfoReader,
                             ProductInfoProcessor productInfoProcessor,
                             SilverProductInfoRepository silverRepository) {
        return pipelineSteps.pipeline(SilverEntity.CRM_PRD_INFO,
                productInfoReader, productInfoProcessor,
                SilverProductInfo.class, silverRepository);
    }

    @Bean
    public Job crmSalesDetailsJob(SalesDetailReader salesDetailReader,
                                  SalesDetailProcessor salesDetailProcessor,
                                  SilverSalesDetailRepository silverRepository) {
        return pipelineSteps.pipeline(SilverEntity.CRM_SALES_DETAILS,
                salesDetailReader, salesDetailProcessor,
                SilverSalesDetail.class, silverRepository);
    }
}
