package com.claude.warehouse.quality;

import com.claude.warehouse.dto.KeyIntegrityReport;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Bronze 테이블의 자연 키 중복/NULL 점검
 *
 * @param <T> Bronze 레코드 타입
 */
public class KeyIntegrityCheck<T> {

    private final String table;
    private final Function<? super T, ?> naturalKey;

    public KeyIntegrityCheck(String table, Function<? super T, ?> naturalKey) {
        this.table = table;
        this.naturalKey = naturalKey;
    }

    public KeyIntegrityReport inspect(List<? extends T> rows) {
        Map<Object, Long> occurrences = new HashMap<>();
        long nullKeys = 0;

        for (T row : rows) {
            Object key = naturalKey.apply(row);
            if (key == null) {
                nullKeys++;
            } else {
                occurrences.merge(key, 1L, Long::sum);
            }
        }

        long duplicateKeys = occurrences.values().stream().filter(count -> count > 1).count();
        long duplicateRows = occurrences.values().stream().mapToLong(count -> count - 1).sum();

        return KeyIntegrityReport.builder()
                .table(table)
                .totalRows(rows.size())
                .distinctKeys(occurrences.size())
                .nullKeys(nullKeys)
                .duplicateKeys(duplicateKeys)
                .duplicateRows(duplicateRows)
                .build();
    }
}
