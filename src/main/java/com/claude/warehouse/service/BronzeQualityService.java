package com.claude.warehouse.service;

import com.claude.warehouse.batch.SalesDetailReader;
import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.dto.CustomerInfoQualityReport;
import com.claude.warehouse.dto.KeyIntegrityReport;
import com.claude.warehouse.entity.bronze.BronzeCustomerDemographic;
import com.claude.warehouse.entity.bronze.BronzeCustomerInfo;
import com.claude.warehouse.entity.bronze.BronzeCustomerLocation;
import com.claude.warehouse.entity.bronze.BronzeProductCategory;
import com.claude.warehouse.entity.bronze.BronzeProductInfo;
import com.claude.warehouse.entity.bronze.BronzeSalesDetail;
import com.claude.warehouse.quality.CustomerInfoProfiler;
import com.claude.warehouse.quality.KeyIntegrityCheck;
import com.claude.warehouse.repository.bronze.BronzeCustomerDemographicRepository;
import com.claude.warehouse.repository.bronze.BronzeCustomerInfoRepository;
import com.claude.warehouse.repository.bronze.BronzeCustomerLocationRepository;
import com.claude.warehouse.repository.bronze.BronzeProductCategoryRepository;
import com.claude.warehouse.repository.bronze.BronzeProductInfoRepository;
import com.claude.warehouse.repository.bronze.BronzeSalesDetailRepository;
import com.claude.warehouse.rules.FieldNormalizer;
import com.claude.warehouse.rules.TextCleaner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Bronze 데이터 품질 진단 서비스
 */
@Service
@Slf4j
@Transactional(readOnly = true)
public class BronzeQualityService {

    private final BronzeCustomerInfoRepository customerInfoRepository;
    private final BronzeProductInfoRepository productInfoRepository;
    private final BronzeSalesDetailRepository salesDetailRepository;
    private final BronzeCustomerDemographicRepository demographicRepository;
    private final BronzeCustomerLocationRepository locationRepository;
    private final BronzeProductCategoryRepository categoryRepository;
    private final FieldNormalizer fieldNormalizer;

    private final CustomerInfoProfiler customerInfoProfiler = new CustomerInfoProfiler();

    public BronzeQualityService(BronzeCustomerInfoRepository customerInfoRepository,
                                BronzeProductInfoRepository productInfoRepository,
                                BronzeSalesDetailRepository salesDetailRepository,
                                BronzeCustomerDemographicRepository demographicRepository,
                                BronzeCustomerLocationRepository locationRepository,
                                BronzeProductCategoryRepository categoryRepository,
                                FieldNormalizer fieldNormalizer) {
        this.customerInfoRepository = customerInfoRepository;
        this.productInfoRepository = productInfoRepository;
        this.salesDetailRepository = salesDetailRepository;
        this.demographicRepository = demographicRepository;
        this.locationRepository = locationRepository;
        this.categoryRepository = categoryRepository;
        this.fieldNormalizer = fieldNormalizer;
    }

    public CustomerInfoQualityReport profileCustomerInfo() {
        CustomerInfoQualityReport report = customerInfoProfiler.profile(customerInfoRepository.findAllByOrderByRowIdAsc());

        log.info("bronze_crm_cust_info 품질 진단: 총 {}건, 중복 {}건, NULL 키 {}건, 품질 점수 {}%",
                report.getTotalRecords(), report.getDuplicateRecords(),
                report.getNullPrimaryKeys(), report.getQualityScorePct());
        return report;
    }

    /**
     * 모든 Bronze 테이블의 자연 키 중복/NULL 점검
     *
     * 키 추출은 적재 시 생존 레코드 선택과 같은 규칙을 따른다. 인구통계 키는 태그 제거 후 키로 점검
     */
    public List<KeyIntegrityReport> checkKeyIntegrity() {
        return List.of(
                new KeyIntegrityCheck<BronzeCustomerInfo>(bronzeTable(SilverEntity.CRM_CUST_INFO),
                        BronzeCustomerInfo::getCustomerId)
                        .inspect(customerInfoRepository.findAllByOrderByRowIdAsc()),
                new KeyIntegrityCheck<BronzeProductInfo>(bronzeTable(SilverEntity.CRM_PRD_INFO),
                        BronzeProductInfo::getProductId)
                        .inspect(productInfoRepository.findAllByOrderByRowIdAsc()),
                new KeyIntegrityCheck<BronzeSalesDetail>(bronzeTable(SilverEntity.CRM_SALES_DETAILS),
                        SalesDetailReader.SalesLineKey::of)
                        .inspect(salesDetailRepository.findAllByOrderByRowIdAsc()),
                new KeyIntegrityCheck<BronzeCustomerDemographic>(bronzeTable(SilverEntity.ERP_CUST_DEMOGRAPHICS),
                        row -> fieldNormalizer.demographicCustomerKey(row.getCustomerKey()))
                        .inspect(demographicRepository.findAllByOrderByRowIdAsc()),
                new KeyIntegrityCheck<BronzeCustomerLocation>(bronzeTable(SilverEntity.ERP_CUST_LOCATION),
                        row -> TextCleaner.cleanKey(row.getCustomerKey()))
                        .inspect(locationRepository.findAllByOrderByRowIdAsc()),
                new KeyIntegrityCheck<BronzeProductCategory>(bronzeTable(SilverEntity.ERP_PRODUCT_CATEGORIES),
                        row -> TextCleaner.cleanKey(row.getCategoryId()))
                        .inspect(categoryRepository.findAllByOrderByRowIdAsc()));
    }

    private static String bronzeTable(SilverEntity entity) {
        return "bronze_" + entity.getTableName();
    }
}
