package com.claude.warehouse.service;

import com.claude.warehouse.batch.SurvivorItemReader;
import com.claude.warehouse.config.WarehouseProperties;
import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.dto.SilverLoadResult;
import com.claude.warehouse.entity.SilverLoadRun;
import com.claude.warehouse.repository.SilverLoadRunRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionException;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Silver 적재 오케스트레이터 - 6개 엔티티 파이프라인 실행 조정자
 *
 * 핵심 역할:
 * 1. 단건 실행: 엔티티 하나의 Job 을 동기 실행하고 결과를 실행 이력에 기록
 * 2. 전체 실행: 6개 Job 을 batchTaskExecutor 에서 병렬 실행 후 타임아웃 내 결과 수집
 * 3. 중복 방지: 같은 엔티티가 RUNNING 이면 새 요청은 SKIPPED 로 기록
 * 4. 헬스 체크: 오래 RUNNING 으로 남은 실행을 실패 처리
 *
 * 장애 격리:
 * - 엔티티별 Job 은 서로 다른 테이블만 다루므로 한 엔티티의 실패가 다른 엔티티에 영향 없음
 * - 실패한 엔티티의 Silver 테이블은 게시 스텝이 커밋되지 않아 이전 결과 유지
 */
@Service
@Slf4j
public class SilverLoadOrchestrator {

    private final JobLauncher jobLauncher;
    private final Map<String, Job> jobsByName;
    private final SilverLoadRunRepository runRepository;
    private final ObjectMapper objectMapper;
    private final Executor batchTaskExecutor;
    private final WarehouseProperties properties;

    public SilverLoadOrchestrator(JobLauncher jobLauncher,
                                  Map<String, Job> jobsByName,
                                  SilverLoadRunRepository runRepository,
                                  ObjectMapper objectMapper,
                                  @Qualifier("batchTaskExecutor") Executor batchTaskExecutor,
                                  WarehouseProperties properties) {
        this.jobLauncher = jobLauncher;
        this.jobsByName = jobsByName;
        this.runRepository = runRepository;
        this.objectMapper = objectMapper;
        this.batchTaskExecutor = batchTaskExecutor;
        this.properties = properties;
    }

    /**
     * 6개 엔티티를 병렬로 적재하고 엔티티 순서대로 결과 반환
     *
     * 타임아웃을 넘긴 엔티티는 FAILED 결과로 보고되며, 해당 Job 은 백그라운드에서 계속 진행된다.
     */
    public List<SilverLoadResult> loadAll(LocalDateTime loadedAt) {
        log.info("전체 Silver 적재 시작 (loadedAt={})", loadedAt);

        Map<SilverEntity, CompletableFuture<SilverLoadResult>> executions = new EnumMap<>(SilverEntity.class);
        for (SilverEntity entity : SilverEntity.values()) {
            executions.put(entity, CompletableFuture.supplyAsync(() -> load(entity, loadedAt), batchTaskExecutor));
        }

        long deadline = System.nanoTime() + TimeUnit.MINUTES.toNanos(properties.getSilver().getJobTimeoutMinutes());
        List<SilverLoadResult> results = new ArrayList<>();

        for (Map.Entry<SilverEntity, CompletableFuture<SilverLoadResult>> execution : executions.entrySet()) {
            SilverEntity entity = execution.getKey();
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                results.add(execution.getValue().get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                log.error("[{}] 적재가 타임아웃 내에 끝나지 않음", entity.getTableName());
                results.add(SilverLoadResult.failed(entity, loadedAt, "Timed out after "
                        + properties.getSilver().getJobTimeoutMinutes() + " minutes"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SilverLoadException("Interrupted while waiting for " + entity.getTableName(), e);
            } catch (ExecutionException e) {
                log.error("[{}] 비동기 적재 실행 실패", entity.getTableName(), e.getCause());
                results.add(SilverLoadResult.failed(entity, loadedAt, String.valueOf(e.getCause())));
            }
        }

        long succeeded = results.stream().filter(SilverLoadResult::isSuccessful).count();
        log.info("전체 Silver 적재 종료: 성공 {}/{}", succeeded, results.size());
        return results;
    }

    /**
     * 엔티티 하나를 동기 적재
     */
    public SilverLoadResult load(SilverEntity entity, LocalDateTime loadedAt) {
        SilverLoadRun run = claimRun(entity, loadedAt);
        if (run.getStatus() == SilverLoadRun.RunStatus.SKIPPED) {
            log.warn("[{}] 이전 실행이 진행 중이어서 건너뜀", entity.getTableName());
            return SilverLoadResult.from(run);
        }

        try {
            JobExecution jobExecution = launch(entity, loadedAt);
            run.setJobExecutionId(jobExecution.getId());

            if (jobExecution.getStatus() == BatchStatus.COMPLETED) {
                recordSuccess(run, jobExecution);
            } else {
                recordFailure(run, describeFailure(jobExecution));
            }
        } catch (Exception e) {
            log.error("[{}] 파이프라인 실행 중 예외 발생", entity.getTableName(), e);
            recordFailure(run, e.getMessage());
        }

        return SilverLoadResult.from(runRepository.save(run));
    }

    /**
     * warehouse.silver.load-cron 이 설정된 경우에만 동작하는 정기 전체 적재
     */
    @Scheduled(cron = "${warehouse.silver.load-cron:-}")
    public void scheduledLoad() {
        log.info("정기 Silver 적재 트리거");
        try {
            loadAll(LocalDateTime.now());
        } catch (Exception e) {
            // 스케줄러 스레드는 계속 살아 있어야 함
            log.error("정기 Silver 적재 중 오류 발생", e);
        }
    }

    // Health check and cleanup
    @Scheduled(fixedDelay = 300000)
    public void cleanupStaleRuns() {
        LocalDateTime cutoffTime = LocalDateTime.now().minusMinutes(properties.getSilver().getStaleRunMinutes());
        List<SilverLoadRun> staleRuns = runRepository.findByStatusAndStartedAtBeforeOrderByStartedAtAsc(
                SilverLoadRun.RunStatus.RUNNING, cutoffTime);

        for (SilverLoadRun run : staleRuns) {
            log.warn("[{}] 스테일 실행 감지 (runId={}, startedAt={}), 실패 처리",
                    run.getEntity().getTableName(), run.getId(), run.getStartedAt());
            run.fail("Run timeout - marked as stale");
            runRepository.save(run);
        }
    }

    public List<SilverLoadRun> getRecentRuns() {
        return runRepository.findTop50ByOrderByStartedAtDesc();
    }

    public List<SilverLoadRun> getRuns(SilverEntity entity) {
        return runRepository.findByEntityOrderByStartedAtDesc(entity);
    }

    private synchronized SilverLoadRun claimRun(SilverEntity entity, LocalDateTime loadedAt) {
        if (runRepository.existsByEntityAndStatus(entity, SilverLoadRun.RunStatus.RUNNING)) {
            return runRepository.save(SilverLoadRun.skipped(entity, loadedAt,
                    "Previous run of " + entity.getTableName() + " is still running"));
        }
        return runRepository.save(SilverLoadRun.start(entity, loadedAt));
    }

    private JobExecution launch(SilverEntity entity, LocalDateTime loadedAt) {
        Job job = jobsByName.get(entity.getJobName());
        if (job == null) {
            throw new SilverLoadException("No job registered for " + entity.getTableName());
        }

        JobParameters jobParameters = new JobParametersBuilder()
                .addLocalDateTime("loadedAt", loadedAt)
                .addString("runId", UUID.randomUUID().toString())
                .toJobParameters();

        log.info("[{}] Job {} 실행 (parameters: {})", entity.getTableName(), job.getName(), jobParameters);

        try {
            return jobLauncher.run(job, jobParameters);
        } catch (JobExecutionException e) {
            throw new SilverLoadException("Failed to launch " + job.getName(), e);
        }
    }

    private void recordSuccess(SilverLoadRun run, JobExecution jobExecution) {
        StepExecution reconcileStep = findStep(jobExecution, run.getEntity().getReconcileStepName());
        StepExecution publishStep = findStep(jobExecution, run.getEntity().getPublishStepName());

        long survivors = reconcileStep != null ? reconcileStep.getWriteCount() : 0L;
        long published = publishStep != null ? publishStep.getWriteCount() : 0L;

        run.complete(survivors, published, selectionStatistics(reconcileStep));
        log.info("[{}] Silver 적재 완료: 생존 {}건, 게시 {}건",
                run.getEntity().getTableName(), survivors, published);
    }

    private void recordFailure(SilverLoadRun run, String error) {
        run.fail(error);
        log.error("[{}] Silver 적재 실패, 기존 Silver 데이터 유지: {}", run.getEntity().getTableName(), error);
    }

    private String describeFailure(JobExecution jobExecution) {
        List<Throwable> failures = jobExecution.getAllFailureExceptions();
        if (failures.isEmpty()) {
            return "Job finished with status " + jobExecution.getStatus();
        }
        Throwable cause = failures.get(0);
        return cause.getClass().getSimpleName() + ": " + cause.getMessage();
    }

    private StepExecution findStep(JobExecution jobExecution, String stepName) {
        for (StepExecution stepExecution : jobExecution.getStepExecutions()) {
            if (stepExecution.getStepName().equals(stepName)) {
                return stepExecution;
            }
        }
        return null;
    }

    private String selectionStatistics(StepExecution reconcileStep) {
        if (reconcileStep == null) {
            return null;
        }

        ExecutionContext context = reconcileStep.getExecutionContext();
        Map<String, Object> statistics = new LinkedHashMap<>();
        statistics.put("rawRows", context.getInt(SurvivorItemReader.RAW_ROWS_KEY, 0));
        statistics.put("nullKeyRows", context.getInt(SurvivorItemReader.NULL_KEY_ROWS_KEY, 0));
        statistics.put("duplicateRows", context.getInt(SurvivorItemReader.DUPLICATE_ROWS_KEY, 0));
        statistics.put("excludedRows", context.getInt(SurvivorItemReader.EXCLUDED_ROWS_KEY, 0));
        statistics.put("survivors", context.getInt(SurvivorItemReader.SURVIVORS_KEY, 0));
        statistics.put("readCount", reconcileStep.getReadCount());
        statistics.put("filterCount", reconcileStep.getFilterCount());
        statistics.put("writeCount", reconcileStep.getWriteCount());

        try {
            return objectMapper.writeValueAsString(statistics);
        } catch (JsonProcessingException e) {
            log.warn("선택 통계 직렬화 실패: {}", e.getMessage());
            return statistics.toString();
        }
    }
}
