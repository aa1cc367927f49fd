package com.alertrouter.core.silence;

import com.alertrouter.model.Silence;
import com.alertrouter.model.enums.StateNamespace;
import io.micrometer.core.instrument.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 过期静默清理
 * 独立于请求路径按固定周期运行
 */
public class SilenceReaper {

    private static final Logger log = LoggerFactory.getLogger(SilenceReaper.class);

    private final SilenceRegistry registry;

    private final Clock clock;

    private final Duration interval;

    private final AtomicBoolean running = new AtomicBoolean(false);

    private ScheduledExecutorService executor;

    public SilenceReaper(SilenceRegistry registry, Clock clock, Duration interval) {
        this.registry = registry;
        this.clock = clock;
        this.interval = interval;
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("alert-silence-reaper"));
        Runnable reap = () -> {
            try {
                reapOnce();
            } catch (Exception e) {
                // 下个周期再试
                log.error("[Silence-Reaper] reap failed", e);
            }
        };
        executor.scheduleWithFixedDelay(reap, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[Silence-Reaper] started, interval={} ms", interval.toMillis());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        executor.shutdownNow();
        log.info("[Silence-Reaper] stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * 删除 reap 时刻已过期的静默
     * 条件删除: 期间被重新创建/续期的条目值已变化, 不会被删掉
     * @return 删除数量
     */
    public int reapOnce() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, String> e : registry.rawEntries().entrySet()) {
            Silence s;
            try {
                s = registry.decode(e.getValue());
            } catch (IllegalStateException ex) {
                log.warn("[Silence-Reaper] skip undecodable entry id={}", e.getKey());
                continue;
            }
            if (s.isExpired(now)
                    && registry.store().deleteIfEquals(StateNamespace.SILENCE, e.getKey(), e.getValue())) {
                registry.forget(e.getKey());
                removed++;
            }
        }
        if (removed > 0) {
            log.info("[Silence-Reaper] removed {} expired silences", removed);
        }
        return removed;
    }
}
