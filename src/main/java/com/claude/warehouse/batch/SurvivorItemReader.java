package com.claude.warehouse.batch;

import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.rules.SelectionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.item.ItemStreamReader;

import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Bronze 전체 스냅샷을 읽어 생존 레코드만 순서대로 내보내는 리더의 공통 골격
 *
 * 생존 레코드 선택은 배치 전체가 필요하므로 첫 read() 시점에 한 번만 수행하고,
 * 선택 통계는 스텝 ExecutionContext 에 기록하여 실행 이력에 남긴다.
 */
@Slf4j
public abstract class SurvivorItemReader<T> implements ItemStreamReader<T> {

    public static final String RAW_ROWS_KEY = "selection.rawRows";
    public static final String NULL_KEY_ROWS_KEY = "selection.nullKeyRows";
    public static final String DUPLICATE_ROWS_KEY = "selection.duplicateRows";
    public static final String SURVIVORS_KEY = "selection.survivors";
    public static final String EXCLUDED_ROWS_KEY = "selection.excludedRows";

    private final SilverEntity entity;

    private Iterator<T> survivorIterator;
    private SelectionResult<T> selection;
    private int excludedRows = 0;
    private boolean initialized = false;

    protected SurvivorItemReader(SilverEntity entity) {
        this.entity = entity;
    }

    @Override
    public T read() {
        if (!initialized) {
            initializeSurvivors();
            initialized = true;
        }

        if (survivorIterator.hasNext()) {
            return survivorIterator.next();
        }

        log.debug("[{}] 생존 레코드 읽기 완료", entity.getTableName());
        return null;
    }

    private void initializeSurvivors() {
        log.info("[{}] Bronze 스냅샷 로드 및 생존 레코드 선택 시작", entity.getTableName());

        selection = selectSurvivors();
        survivorIterator = selection.getSurvivors().iterator();

        log.info("[{}] Bronze {}건 -> 생존 {}건 (키 누락 {}건, 중복 {}건, 적재 대상 아님 {}건 제외)",
                entity.getTableName(), getRawRows(), selection.getSurvivorCount(),
                selection.getNullKeyRows(), selection.getDuplicateRows(), excludedRows);
    }

    /**
     * 생존 레코드 선택 전에 적재 대상에서 빠지는 행을 걸러낸다. 걸러진 건수는 키 누락과 별도로 집계
     */
    protected List<T> excludeBeforeSelection(List<T> rows, Predicate<? super T> loadable, String reason) {
        List<T> kept = rows.stream()
                .filter(loadable)
                .collect(Collectors.toList());
        int excluded = rows.size() - kept.size();
        if (excluded > 0) {
            log.info("[{}] {} {}건 제외", entity.getTableName(), reason, excluded);
        }
        excludedRows += excluded;
        return kept;
    }

    private int getRawRows() {
        return selection.getRawRows() + excludedRows;
    }

    /**
     * Bronze 테이블 전체를 입력 순서대로 읽어 생존 레코드를 선택
     */
    protected abstract SelectionResult<T> selectSurvivors();

    @Override
    public void update(ExecutionContext executionContext) {
        if (selection == null) {
            return;
        }
        executionContext.putInt(RAW_ROWS_KEY, getRawRows());
        executionContext.putInt(NULL_KEY_ROWS_KEY, selection.getNullKeyRows());
        executionContext.putInt(DUPLICATE_ROWS_KEY, selection.getDuplicateRows());
        executionContext.putInt(SURVIVORS_KEY, selection.getSurvivorCount());
        executionContext.putInt(EXCLUDED_ROWS_KEY, excludedRows);
    }

    protected SilverEntity getEntity() {
        return entity;
    }
}
