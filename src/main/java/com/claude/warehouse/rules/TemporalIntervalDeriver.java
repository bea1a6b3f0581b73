package com.claude.warehouse.rules;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 버전 관리 엔티티(제품)의 유효기간 종료일 계산
 *
 * 같은 그룹 키의 버전들을 시작일 순으로 정렬(안정 정렬, null 시작일이 먼저)한 뒤
 * 각 버전의 종료일을 다음 버전 시작일 하루 전으로 설정한다.
 * 마지막 버전, 또는 다음 버전 시작일이 null 인 경우는 원본 종료일을 그대로 유지한다.
 *
 * @param <T> 버전 레코드 타입
 */
public class TemporalIntervalDeriver<T> {

    private static final Object NULL_GROUP = new Object();

    private final Function<? super T, ?> groupKey;
    private final Function<? super T, LocalDate> startDate;
    private final Function<? super T, LocalDate> rawEndDate;

    public TemporalIntervalDeriver(Function<? super T, ?> groupKey,
                                   Function<? super T, LocalDate> startDate,
                                   Function<? super T, LocalDate> rawEndDate) {
        this.groupKey = groupKey;
        this.startDate = startDate;
        this.rawEndDate = rawEndDate;
    }

    /**
     * @return 그룹은 첫 등장 순서, 그룹 내부는 시작일 순서의 버전 목록
     */
    public List<VersionInterval<T>> derive(List<? extends T> versions) {
        Map<Object, List<T>> groups = new LinkedHashMap<>();
        for (T version : versions) {
            Object key = groupKey.apply(version);
            groups.computeIfAbsent(key == null ? NULL_GROUP : key, k -> new ArrayList<>()).add(version);
        }

        Comparator<T> byStart = Comparator.comparing(startDate, Comparator.nullsFirst(Comparator.<LocalDate>naturalOrder()));
        List<VersionInterval<T>> intervals = new ArrayList<>(versions.size());
        for (List<T> group : groups.values()) {
            group.sort(byStart);
            for (int i = 0; i < group.size(); i++) {
                T version = group.get(i);
                LocalDate nextStart = i + 1 < group.size() ? startDate.apply(group.get(i + 1)) : null;
                LocalDate endDate = nextStart != null ? nextStart.minusDays(1) : rawEndDate.apply(version);
                intervals.add(new VersionInterval<>(version, endDate));
            }
        }
        return intervals;
    }
}
