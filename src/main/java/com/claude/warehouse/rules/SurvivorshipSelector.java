package com.claude.warehouse.rules;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 자연키(natural key) 기준 중복 레코드 중 하나의 생존 레코드를 선택
 *
 * 선택 규칙:
 * - 키가 null 인 레코드는 조용히 제외 (오류가 아닌 필터)
 * - 정렬 기준 컬럼이 있으면 가장 최근 값을 가진 레코드가 생존, null 은 어떤 값보다 오래된 것으로 취급
 * - 동률이거나 정렬 기준이 없으면 입력 순서상 먼저 나온 레코드가 생존
 * - 결과는 각 키가 입력에서 처음 등장한 순서를 유지
 *
 * @param <T> 원천 레코드 타입
 * @param <K> 자연키 타입
 */
@Slf4j
public class SurvivorshipSelector<T, K> {

    private final Function<? super T, ? extends K> keyExtractor;
    private final Comparator<? super T> recency;

    private SurvivorshipSelector(Function<? super T, ? extends K> keyExtractor, Comparator<? super T> recency) {
        this.keyExtractor = keyExtractor;
        this.recency = recency;
    }

    /**
     * 정렬 기준 컬럼 값이 가장 큰(최근) 레코드를 선택
     */
    public static <T, K, C extends Comparable<? super C>> SurvivorshipSelector<T, K> latestBy(
            Function<? super T, ? extends K> keyExtractor,
            Function<? super T, ? extends C> orderingField) {
        Comparator<T> recency = Comparator.comparing(orderingField,
                Comparator.nullsFirst(Comparator.<C>naturalOrder()));
        return new SurvivorshipSelector<>(keyExtractor, recency);
    }

    /**
     * 정렬 기준이 없는 엔티티용: 입력 순서상 첫 레코드를 선택
     */
    public static <T, K> SurvivorshipSelector<T, K> firstSeen(Function<? super T, ? extends K> keyExtractor) {
        return new SurvivorshipSelector<>(keyExtractor, null);
    }

    public SelectionResult<T> select(List<? extends T> batch) {
        Map<K, T> survivorsByKey = new LinkedHashMap<>();
        int nullKeyRows = 0;
        int duplicateRows = 0;

        for (T candidate : batch) {
            K key = keyExtractor.apply(candidate);
            if (key == null) {
                nullKeyRows++;
                continue;
            }

            T current = survivorsByKey.get(key);
            if (current == null) {
                survivorsByKey.put(key, candidate);
                continue;
            }

            duplicateRows++;
            if (recency != null && recency.compare(candidate, current) > 0) {
                log.debug("키 {} 중복 레코드 중 더 최근 레코드로 교체", key);
                survivorsByKey.put(key, candidate);
            }
        }

        return new SelectionResult<>(new ArrayList<>(survivorsByKey.values()),
                batch.size(), nullKeyRows, duplicateRows);
    }
}
