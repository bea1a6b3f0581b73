package com.claude.warehouse.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * warehouse.* 설정
 */
@Data
@ConfigurationProperties(prefix = "warehouse")
public class WarehouseProperties {

    private Silver silver = new Silver();
    private SampleData sampleData = new SampleData();

    @Data
    public static class Silver {
        // 정기 적재 cron, "-" 이면 비활성
        private String loadCron = "-";
        // 전체 적재 대기 시간 상한
        private long jobTimeoutMinutes = 10;
        private int chunkSize = 100;
        // 이 시간 이상 RUNNING 으로 남은 실행은 실패 처리
        private long staleRunMinutes = 30;
    }

    @Data
    public static class SampleData {
        private boolean enabled = false;
    }
}
