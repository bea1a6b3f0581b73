package com.claude.warehouse.config;

import com.claude.warehouse.batch.SilverPublishTasklet;
import com.claude.warehouse.batch.SilverStagingArea;
import com.claude.warehouse.batch.SilverStagingWriter;
import com.claude.warehouse.domain.SilverEntity;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.item.ItemProcessor;
import org.springframework.batch.item.ItemStreamReader;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * 엔티티 파이프라인 공통 구성
 *
 * Job = 정제 스텝(reader -> processor -> 스테이징) + 게시 스텝(Silver 테이블 교체)
 */
@Component
public class SilverPipelineSteps {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final SilverStagingArea stagingArea;
    private final WarehouseProperties properties;

    public SilverPipelineSteps(JobRepository jobRepository,
                               PlatformTransactionManager transactionManager,
                               SilverStagingArea stagingArea,
                               WarehouseProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.stagingArea = stagingArea;
        this.properties = properties;
    }

    public <B, S> Job pipeline(SilverEntity entity,
                               ItemStreamReader<B> reader,
                               ItemProcessor<B, S> processor,
                               Class<S> silverType,
                               JpaRepository<S, Long> silverRepository) {
        return new JobBuilder(entity.getJobName(), jobRepository)
                .start(reconcileStep(entity, reader, processor))
                .next(publishStep(entity, silverType, silverRepository))
                .build();
    }

    private <B, S> Step reconcileStep(SilverEntity entity,
                                      ItemStreamReader<B> reader,
                                      ItemProcessor<B, S> processor) {
        SilverStagingWriter<S> writer = new SilverStagingWriter<>(entity, stagingArea);

        return new StepBuilder(entity.getReconcileStepName(), jobRepository)
                .<B, S>chunk(properties.getSilver().getChunkSize(), transactionManager)
                .reader(reader)
                .processor(processor)
                .writer(writer)
                .build();
    }

    private <S> Step publishStep(SilverEntity entity,
                                 Class<S> silverType,
                                 JpaRepository<S, Long> silverRepository) {
        return new StepBuilder(entity.getPublishStepName(), jobRepository)
                .tasklet(new SilverPublishTasklet<>(entity, silverType, silverRepository, stagingArea),
                        transactionManager)
                .build();
    }
}
