package com.claude.warehouse.controller;

import com.claude.warehouse.domain.SilverEntity;
import com.claude.warehouse.dto.SilverLoadResult;
import com.claude.warehouse.dto.SilverVerificationReport;
import com.claude.warehouse.entity.SilverLoadRun;
import com.claude.warehouse.service.SilverLoadOrchestrator;
import com.claude.warehouse.service.SilverVerificationService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/silver")
public class SilverLoadController {

    private final SilverLoadOrchestrator orchestrator;
    private final SilverVerificationService verificationService;

    public SilverLoadController(SilverLoadOrchestrator orchestrator,
                                SilverVerificationService verificationService) {
        this.orchestrator = orchestrator;
        this.verificationService = verificationService;
    }

    /**
     * 전체 엔티티 적재. loadedAt 을 지정하면 같은 Bronze 입력에 대해 동일한 결과를 재현한다.
     */
    @PostMapping("/load")
    public ResponseEntity<List<SilverLoadResult>> loadAll(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime loadedAt) {
        return ResponseEntity.ok(orchestrator.loadAll(loadedAt != null ? loadedAt : LocalDateTime.now()));
    }

    @PostMapping("/load/{entity}")
    public ResponseEntity<SilverLoadResult> load(
            @PathVariable String entity,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime loadedAt) {
        SilverEntity silverEntity = SilverEntity.fromName(entity);
        return ResponseEntity.ok(orchestrator.load(silverEntity, loadedAt != null ? loadedAt : LocalDateTime.now()));
    }

    @GetMapping("/runs")
    public ResponseEntity<List<SilverLoadRun>> getRecentRuns() {
        return ResponseEntity.ok(orchestrator.getRecentRuns());
    }

    @GetMapping("/runs/{entity}")
    public ResponseEntity<List<SilverLoadRun>> getRuns(@PathVariable String entity) {
        return ResponseEntity.ok(orchestrator.getRuns(SilverEntity.fromName(entity)));
    }

    @GetMapping("/verification")
    public ResponseEntity<SilverVerificationReport> verify() {
        return ResponseEntity.ok(verificationService.verify());
    }
}
