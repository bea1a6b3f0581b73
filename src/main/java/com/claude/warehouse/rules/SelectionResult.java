package com.claude.warehouse.rules;

import lombok.Value;

import java.util.List;

/**
 * 생존 레코드 선택 결과와 통계
 */
@Value
public class SelectionResult<T> {
    List<T> survivors;
    int rawRows;
    int nullKeyRows;
    int duplicateRows;

    public int getSurvivorCount() {
        return survivors.size();
    }
}
