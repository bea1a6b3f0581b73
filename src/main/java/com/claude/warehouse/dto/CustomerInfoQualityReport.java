package com.claude.warehouse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Bronze 고객 정보 품질 진단 결과
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomerInfoQualityReport {

    private long totalRecords;
    private long uniqueCustomers;
    private long duplicateRecords;
    private long nullPrimaryKeys;
    private long incompleteNames;

    // 컬럼별 NULL/공백 분석
    private long nullCustomerKeys;
    private long incompleteLastNames;
    private long nullMaritalStatus;
    private long nullGender;
    private long nullCreateDate;

    // 문자열 품질
    private long firstNameWhitespaceIssues;
    private long lastNameWhitespaceIssues;
    private long emptyFirstNames;
    private long emptyLastNames;

    // 중복 cst_id -> 건수
    private Map<Integer, Long> duplicateCustomerIds;

    // 원시 코드값 -> 건수 (건수 내림차순)
    private Map<String, Long> genderDistribution;
    private Map<String, Long> maritalStatusDistribution;

    private BigDecimal uniquenessPct;
    private BigDecimal qualityScorePct;
}
