package com.claude.warehouse.service;

import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.dto.SilverVerificationReport;
import com.claude.warehouse.repository.silver.SilverCustomerDemographicRepository;
import com.claude.warehouse.repository.silver.SilverCustomerInfoRepository;
import com.claude.warehouse.repository.silver.SilverCustomerLocationRepository;
import com.claude.warehouse.repository.silver.SilverProductCategoryRepository;
import com.claude.warehouse.repository.silver.SilverProductInfoRepository;
import com.claude.warehouse.repository.silver.SilverSalesDetailRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Silver 적재 결과 검증 (테이블별 건수, 고객 표준 어휘 준수 건수)
 */
@Service
@Transactional(readOnly = true)
public class SilverVerificationService {

    private final SilverCustomerInfoRepository customerInfoRepository;
    private final SilverProductInfoRepository productInfoRepository;
    private final SilverSalesDetailRepository salesDetailRepository;
    private final SilverCustomerDemographicRepository demographicRepository;
    private final SilverCustomerLocationRepository locationRepository;
    private final SilverProductCategoryRepository categoryRepository;

    public SilverVerificationService(SilverCustomerInfoRepository customerInfoRepository,
                                     SilverProductInfoRepository productInfoRepository,
                                     SilverSalesDetailRepository salesDetailRepository,
                                     SilverCustomerDemographicRepository demographicRepository,
                                     SilverCustomerLocationRepository locationRepository,
                                     SilverProductCategoryRepository categoryRepository) {
        this.customerInfoRepository = customerInfoRepository;
        this.productInfoRepository = productInfoRepository;
        this.salesDetailRepository = salesDetailRepository;
        this.demographicRepository = demographicRepository;
        this.locationRepository = locationRepository;
        this.categoryRepository = categoryRepository;
    }

    public SilverVerificationReport verify() {
        Map<String, Long> rowCounts = new LinkedHashMap<>();
        rowCounts.put(silverTable(SilverEntity.CRM_CUST_INFO), customerInfoRepository.count());
        rowCounts.put(silverTable(SilverEntity.CRM_PRD_INFO), productInfoRepository.count());
        rowCounts.put(silverTable(SilverEntity.CRM_SALES_DETAILS), salesDetailRepository.count());
        rowCounts.put(silverTable(SilverEntity.ERP_CUST_DEMOGRAPHICS), demographicRepository.count());
        rowCounts.put(silverTable(SilverEntity.ERP_CUST_LOCATION), locationRepository.count());
        rowCounts.put(silverTable(SilverEntity.ERP_PRODUCT_CATEGORIES), categoryRepository.count());

        return SilverVerificationReport.builder()
                .rowCounts(rowCounts)
                .distinctCustomers(customerInfoRepository.countDistinctCustomers())
                .customerRows(rowCounts.get(silverTable(SilverEntity.CRM_CUST_INFO)))
                .standardizedMaritalStatus(customerInfoRepository.countStandardizedMaritalStatus())
                .standardizedGender(customerInfoRepository.countStandardizedGender())
                .verifiedAt(LocalDateTime.now())
                .build();
    }

    private static String silverTable(SilverEntity entity) {
        return "silver_" + entity.getTableName();
    }
}
