package com.claude.warehouse.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class KeyIntegrityReport {

    private String table;
    private long totalRows;
    private long distinctKeys;
    private long nullKeys;
    // 2건 이상 등장한 키의 수
    private long duplicateKeys;
    // 키별 첫 레코드를 제외한 나머지 레코드 수
    private long duplicateRows;

    public boolean isClean() {
        return nullKeys == 0 && duplicateKeys == 0;
    }
}
