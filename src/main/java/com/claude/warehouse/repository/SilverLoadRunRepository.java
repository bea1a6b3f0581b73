package com.claude.warehouse.repository;

import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.entity.SilverLoadRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Silver 적재 실행 이력 레포지토리
 */
@Repository
public interface SilverLoadRunRepository extends JpaRepository<SilverLoadRun, Long> {

    boolean existsByEntityAndStatus(SilverEntity entity, SilverLoadRun.RunStatus status);

    List<SilverLoadRun> findByEntityOrderByStartedAtDesc(SilverEntity entity);

    List<SilverLoadRun> findTop50ByOrderByStartedAtDesc();

    /**
     * 특정 시간 이전에 시작되어 아직 해당 상태인 실행 조회 (스테일 실행 감지용)
     */
    List<SilverLoadRun> findByStatusAndStartedAtBeforeOrderByStartedAtAsc(
            SilverLoadRun.RunStatus status, LocalDateTime cutoffTime);
}
