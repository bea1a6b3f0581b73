package com.claude.warehouse.domain;

import lombok.Getter;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Silver 레이어로 적재되는 6개 엔티티 파이프라인
 *
 * 각 엔티티는 독립적인 Spring Batch Job 으로 실행되며
 * 서로 다른 Bronze 테이블을 읽고 서로 다른 Silver 테이블에 쓴다.
 */
@Getter
public enum SilverEntity {
    CRM_CUST_INFO("crm_cust_info", "crmCustInfoJob"),
    CRM_PRD_INFO("crm_prd_info", "crmPrdInfoJob"),
    CRM_SALES_DETAILS("crm_sales_details", "crmSalesDetailsJob"),
    ERP_CUST_DEMOGRAPHICS("erp_cust_demographics", "erpCustDemographicsJob"),
    ERP_CUST_LOCATION("erp_cust_location", "erpCustLocationJob"),
    ERP_PRODUCT_CATEGORIES("erp_product_categories", "erpProductCategoriesJob");

    private final String tableName;
    private final String jobName;

    SilverEntity(String tableName, String jobName) {
        this.tableName = tableName;
        this.jobName = jobName;
    }

    public String getReconcileStepName() {
        return stepPrefix() + "ReconcileStep";
    }

    public String getPublishStepName() {
        return stepPrefix() + "PublishStep";
    }

    private String stepPrefix() {
        return jobName.substring(0, jobName.length() - "Job".length());
    }

    /**
     * 테이블 이름(crm_cust_info) 또는 enum 이름(CRM_CUST_INFO)으로 조회, 대소문자 무시
     */
    public static SilverEntity fromName(String name) {
        if (name != null) {
            String candidate = name.trim();
            for (SilverEntity entity : values()) {
                if (entity.tableName.equalsIgnoreCase(candidate) || entity.name().equalsIgnoreCase(candidate)) {
                    return entity;
                }
            }
        }
        throw new IllegalArgumentException("Unknown silver entity: " + name
                + " (expected one of " + Arrays.stream(values())
                .map(SilverEntity::getTableName)
                .collect(Collectors.joining(", ")) + ")");
    }
}
