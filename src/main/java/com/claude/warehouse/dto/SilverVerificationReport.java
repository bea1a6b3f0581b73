package com.claude.warehouse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Silver 적재 결과 검증
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilverVerificationReport {

    // Silver 테이블명 -> 행 수
    private Map<String, Long> rowCounts;
    private long distinctCustomers;
    private long customerRows;
    private long standardizedMaritalStatus;
    private long standardizedGender;
    private LocalDateTime verifiedAt;

    public boolean isVocabularyClosed() {
        return standardizedMaritalStatus == customerRows && standardizedGender == customerRows;
    }
}
