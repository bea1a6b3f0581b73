package com.claude.warehouse.batch;

import com.claude.warehouse.domain.SilverEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * 스테이징된 결과로 Silver 테이블 전체를 교체
 *
 * 스텝 트랜잭션 안에서 삭제와 삽입이 함께 커밋되며, 실패 시 기존 Silver 데이터는 그대로 남는다.
 */
@Slf4j
public class SilverPublishTasklet<S> implements Tasklet {

    private final SilverEntity entity;
    private final Class<S> rowType;
    private final JpaRepository<S, Long> silverRepository;
    private final SilverStagingArea stagingArea;

    public SilverPublishTasklet(SilverEntity entity,
                                Class<S> rowType,
                                JpaRepository<S, Long> silverRepository,
                                SilverStagingArea stagingArea) {
        this.entity = entity;
        this.rowType = rowType;
        this.silverRepository = silverRepository;
        this.stagingArea = stagingArea;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        List<S> rows = stagingArea.drain(entity, rowType);

        log.info("[{}] Silver 테이블 교체 시작: {}건 게시", entity.getTableName(), rows.size());

        silverRepository.deleteAllInBatch();
        silverRepository.saveAll(rows);
        contribution.incrementWriteCount(rows.size());

        log.info("[{}] Silver 테이블 교체 완료", entity.getTableName());
        return RepeatStatus.FINISHED;
    }
}
