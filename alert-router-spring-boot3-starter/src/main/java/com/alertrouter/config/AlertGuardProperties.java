package com.alertrouter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.Map;

/**
 * alert:
 *   notify:
 *     guard:
 *       time-limiter:
 *         enabled: true
 *         timeout: 15s
 *       circuit-breaker:
 *         enabled: true
 *         failure-rate-threshold: 50
 *         sliding-window-size: 20
 *         wait-duration-in-open-state: 60s
 *       cb-per-destination:
 *         email: { enabled: false }
 */
@Data
@ConfigurationProperties(prefix = "alert.notify.guard")
public class AlertGuardProperties {

    /** 默认配置（可被目的地覆盖） */
    private TlConfig timeLimiter = new TlConfig();
    private CbConfig circuitBreaker = new CbConfig();

    /** 按目的地 chat|email 覆盖 */
    private Map<String, CbConfig> cbPerDestination;

    @Data
    public static class TlConfig {
        private boolean enabled = true;
        // 单次发送上限, 超时即失败
        private Duration timeout = Duration.ofSeconds(15);
    }

    @Data
    public static class CbConfig {
        private boolean enabled = false;
        private float failureRateThreshold = 50f;
        private int slidingWindowSize = 20;
        private int minimumNumberOfCalls = 10;
        private Duration waitDurationInOpenState = Duration.ofSeconds(60);
        private int permittedNumberOfCallsInHalfOpenState = 2;
    }
}
