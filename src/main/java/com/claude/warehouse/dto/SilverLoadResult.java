package com.claude.warehouse.dto;

import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.entity.SilverLoadRun;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SilverLoadResult {

    private String entity;
    private SilverLoadRun.RunStatus status;
    private Long runId;
    private Long jobExecutionId;
    private LocalDateTime loadedAt;
    private long survivorRecords;
    private long publishedRecords;
    private Long durationMillis;
    private String errorMessage;

    public static SilverLoadResult from(SilverLoadRun run) {
        Long duration = run.getStartedAt() != null && run.getCompletedAt() != null
                ? Duration.between(run.getStartedAt(), run.getCompletedAt()).toMillis()
                : null;

        return SilverLoadResult.builder()
                .entity(run.getEntity().getTableName())
                .status(run.getStatus())
                .runId(run.getId())
                .jobExecutionId(run.getJobExecutionId())
                .loadedAt(run.getLoadedAt())
                .survivorRecords(run.getSurvivorRecords() != null ? run.getSurvivorRecords() : 0L)
                .publishedRecords(run.getPublishedRecords() != null ? run.getPublishedRecords() : 0L)
                .durationMillis(duration)
                .errorMessage(run.getErrorMessage())
                .build();
    }

    public static SilverLoadResult failed(SilverEntity entity, LocalDateTime loadedAt, String errorMessage) {
        return SilverLoadResult.builder()
                .entity(entity.getTableName())
                .status(SilverLoadRun.RunStatus.FAILED)
                .loadedAt(loadedAt)
                .errorMessage(errorMessage)
                .build();
    }

    public boolean isSuccessful() {
        return status == SilverLoadRun.RunStatus.COMPLETED;
    }
}
