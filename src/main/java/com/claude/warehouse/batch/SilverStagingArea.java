package com.claude.warehouse.batch;

import com.claude.warehouse.domain.SilverEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 엔티티별 Silver 결과 임시 보관소
 *
 * 정제 스텝이 새 결과를 여기에 쌓고, 게시 스텝이 한 트랜잭션에서 꺼내어 Silver 테이블을 교체한다.
 * 컨테이너는 실행마다 새로 만들어지므로 이전 실행의 잔여 데이터가 섞이지 않는다.
 */
@Component
@Slf4j
public class SilverStagingArea {

    private final Map<SilverEntity, List<Object>> staged = new ConcurrentHashMap<>();

    public void open(SilverEntity entity) {
        List<Object> previous = staged.put(entity, Collections.synchronizedList(new ArrayList<>()));
        if (previous != null && !previous.isEmpty()) {
            log.warn("[{}] 게시되지 않은 스테이징 데이터 {}건 폐기", entity.getTableName(), previous.size());
        }
    }

    public void stage(SilverEntity entity, List<?> rows) {
        List<Object> container = staged.get(entity);
        if (container == null) {
            throw new IllegalStateException("Staging area is not open for " + entity.getTableName());
        }
        container.addAll(rows);
    }

    /**
     * 스테이징된 결과를 꺼내고 컨테이너를 닫는다
     */
    public <S> List<S> drain(SilverEntity entity, Class<S> rowType) {
        List<Object> container = staged.remove(entity);
        if (container == null) {
            throw new IllegalStateException("Nothing staged for " + entity.getTableName());
        }
        List<S> rows = new ArrayList<>(container.size());
        synchronized (container) {
            for (Object row : container) {
                rows.add(rowType.cast(row));
            }
        }
        return rows;
    }

    public int stagedCount(SilverEntity entity) {
        List<Object> container = staged.get(entity);
        return container != null ? container.size() : 0;
    }
}
