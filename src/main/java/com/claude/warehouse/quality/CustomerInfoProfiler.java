package com.claude.warehouse.quality;

import com.claude.warehouse.dto.CustomerInfoQualityReport;
import com.claude.warehouse.entity.bronze.BronzeCustomerInfo;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Bronze 고객 정보 품질 진단
 *
 * 점검 항목:
 * 1. 중복/NULL 기본 키 (cst_id)
 * 2. 컬럼별 NULL 및 공백 값
 * 3. 성별/결혼 여부 원시 코드값 분포
 * 4. 이름 앞뒤 공백, 빈 이름
 * 5. 요약 지표: 고유율(%), 품질 점수(%)
 */
public class CustomerInfoProfiler {

    public CustomerInfoQualityReport profile(List<BronzeCustomerInfo> rows) {
        long total = rows.size();

        Map<Integer, Long> idCounts = rows.stream()
                .map(BronzeCustomerInfo::getCustomerId)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));

        long uniqueCustomers = idCounts.size();
        long duplicateRecords = total - uniqueCustomers;
        long nullPrimaryKeys = count(rows, row -> row.getCustomerId() == null);
        long incompleteNames = count(rows, row -> isBlank(row.getFirstName()));

        Map<Integer, Long> duplicateIds = idCounts.entrySet().stream()
                .filter(entry -> entry.getValue() > 1)
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (left, right) -> left, LinkedHashMap::new));

        return CustomerInfoQualityReport.builder()
                .totalRecords(total)
                .uniqueCustomers(uniqueCustomers)
                .duplicateRecords(duplicateRecords)
                .nullPrimaryKeys(nullPrimaryKeys)
                .incompleteNames(incompleteNames)
                .nullCustomerKeys(count(rows, row -> row.getCustomerKey() == null))
                .incompleteLastNames(count(rows, row -> isBlank(row.getLastName())))
                .nullMaritalStatus(count(rows, row -> row.getMaritalStatus() == null))
                .nullGender(count(rows, row -> row.getGender() == null))
                .nullCreateDate(count(rows, row -> row.getCreateDate() == null))
                .firstNameWhitespaceIssues(count(rows, row -> hasSurroundingWhitespace(row.getFirstName())))
                .lastNameWhitespaceIssues(count(rows, row -> hasSurroundingWhitespace(row.getLastName())))
                .emptyFirstNames(count(rows, row -> isEmptyButPresent(row.getFirstName())))
                .emptyLastNames(count(rows, row -> isEmptyButPresent(row.getLastName())))
                .duplicateCustomerIds(duplicateIds)
                .genderDistribution(distribution(rows, BronzeCustomerInfo::getGender))
                .maritalStatusDistribution(distribution(rows, BronzeCustomerInfo::getMaritalStatus))
                .uniquenessPct(percentage(uniqueCustomers, total))
                .qualityScorePct(percentage(total - nullPrimaryKeys - duplicateRecords - incompleteNames, total))
                .build();
    }

    private static long count(List<BronzeCustomerInfo> rows, Predicate<BronzeCustomerInfo> condition) {
        return rows.stream().filter(condition).count();
    }

    // NULL 은 제외, 건수 내림차순 (동률은 먼저 등장한 값 우선)
    private static Map<String, Long> distribution(List<BronzeCustomerInfo> rows,
                                                  Function<BronzeCustomerInfo, String> field) {
        Map<String, Long> counts = rows.stream()
                .map(field)
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(Function.identity(), LinkedHashMap::new, Collectors.counting()));

        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue,
                        (left, right) -> left, LinkedHashMap::new));
    }

    static BigDecimal percentage(long part, long total) {
        if (total == 0) {
            return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
        }
        return BigDecimal.valueOf(part)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(total), 2, RoundingMode.HALF_UP);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static boolean isEmptyButPresent(String value) {
        return value != null && value.isBlank();
    }

    private static boolean hasSurroundingWhitespace(String value) {
        return value != null && !value.equals(value.strip());
    }
}
