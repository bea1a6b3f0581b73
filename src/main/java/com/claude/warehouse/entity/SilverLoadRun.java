package com.claude.warehouse.entity;

import com.claude.warehouse.domain.SilverEntity;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 엔티티별 Silver 적재 실행 이력
 *
 * 각 파이프라인 실행의 상태, 건수, 오류를 기록하여
 * 동일 엔티티 중복 실행 방지와 운영 모니터링을 지원
 */
@Entity
@Table(name = "silver_load_runs")
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SilverLoadRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity", nullable = false, length = 40)
    private SilverEntity entity;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 20)
    private RunStatus status;

    // 감사 컬럼(dwh_date_loaded)에 기록되는 적재 기준 시각
    @Column(name = "loaded_at")
    private LocalDateTime loadedAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "job_execution_id")
    private Long jobExecutionId;

    // 생존 레코드 수 (processor 를 통과해 스테이징된 건수)
    @Column(name = "survivor_records")
    private Long survivorRecords = 0L;

    // Silver 테이블에 실제 게시된 건수
    @Column(name = "published_records")
    private Long publishedRecords = 0L;

    // 생존 레코드 선택 통계 (JSON)
    @Column(name = "selection_statistics", length = 1000)
    private String selectionStatistics;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    public enum RunStatus {
        RUNNING,    // 실행 중
        COMPLETED,  // 완료, 새 결과 게시됨
        FAILED,     // 실패, 기존 Silver 결과 유지
        SKIPPED     // 같은 엔티티가 이미 실행 중이라 건너뜀
    }

    public static SilverLoadRun start(SilverEntity entity, LocalDateTime loadedAt) {
        SilverLoadRun run = new SilverLoadRun();
        run.setEntity(entity);
        run.setLoadedAt(loadedAt);
        run.setStatus(RunStatus.RUNNING);
        run.setStartedAt(LocalDateTime.now());
        return run;
    }

    public static SilverLoadRun skipped(SilverEntity entity, LocalDateTime loadedAt, String reason) {
        SilverLoadRun run = start(entity, loadedAt);
        run.setStatus(RunStatus.SKIPPED);
        run.setCompletedAt(run.getStartedAt());
        run.setErrorMessage(reason);
        return run;
    }

    public void complete(long survivorCount, long publishedCount, String statistics) {
        this.status = RunStatus.COMPLETED;
        this.completedAt = LocalDateTime.now();
        this.survivorRecords = survivorCount;
        this.publishedRecords = publishedCount;
        this.selectionStatistics = statistics;
        this.errorMessage = null;
    }

    public void fail(String error) {
        this.status = RunStatus.FAILED;
        this.completedAt = LocalDateTime.now();
        this.publishedRecords = 0L;
        this.errorMessage = error != null && error.length() > 1000 ? error.substring(0, 1000) : error;
    }
}
