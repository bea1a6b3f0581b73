package com.claude.warehouse.batch;

import com.claude.warehouse.domain.SilverEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.StepExecutionListener;
import org.springframework.batch.item.Chunk;
import org.springframework.batch.item.ItemWriter;

import java.util.List;

/**
 * 정제된 Silver 레코드를 테이블 대신 스테이징 영역에 기록
 *
 * 스텝의 writer 로 등록되면 리스너로도 자동 등록되어, 스텝 시작 시 해당 엔티티의 컨테이너를 새로 연다.
 */
@Slf4j
public class SilverStagingWriter<S> implements ItemWriter<S>, StepExecutionListener {

    private final SilverEntity entity;
    private final SilverStagingArea stagingArea;

    public SilverStagingWriter(SilverEntity entity, SilverStagingArea stagingArea) {
        this.entity = entity;
        this.stagingArea = stagingArea;
    }

    @Override
    public void beforeStep(StepExecution stepExecution) {
        stagingArea.open(entity);
    }

    @Override
    public void write(Chunk<? extends S> chunk) {
        List<? extends S> items = chunk.getItems();

        if (items.isEmpty()) {
            return;
        }

        stagingArea.stage(entity, items);
        log.debug("[{}] {}건 스테이징 (누적 {}건)", entity.getTableName(), items.size(),
                stagingArea.stagedCount(entity));
    }
}
