package com.alertrouter.core;

import com.alertrouter.config.AlertGuardProperties;
import com.alertrouter.config.AlertRouterProperties;
import com.alertrouter.core.batch.RouteBatcher;
import com.alertrouter.core.handler.GuardedNotifierExecutor;
import com.alertrouter.core.silence.SilenceReaper;
import com.alertrouter.core.spi.StateStore;
import com.alertrouter.model.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class AlertRouterLifecycle implements SmartLifecycle {

    Logger log = LoggerFactory.getLogger(AlertRouterLifecycle.class);

    private final AlertRouter router;

    private final SilenceReaper reaper;

    private final GuardedNotifierExecutor guard;

    private final StateStore store;

    private final AlertRouterProperties props;

    private final AlertGuardProperties guardProps;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public AlertRouterLifecycle(AlertRouter router, SilenceReaper reaper, GuardedNotifierExecutor guard,
                                StateStore store, AlertRouterProperties props, AlertGuardProperties guardProps) {
        this.router = router;
        this.reaper = reaper;
        this.guard = guard;
        this.store = store;
        this.props = props;
        this.guardProps = guardProps;
    }

    @Override
    public void start() {
        running.compareAndSet(false, props.isEnabled());
        if (!running.get()) {
            log.info("[Alert-Router] start skipped, alert.router.enabled=false");
            return;
        }
        try {
            log.info("┌────────────────────────────────────────────────────────────┐");
            log.info("│ AlertRouter starting...");
            log.info("├────────────────────────────────────────────────────────────┤");
            log.info("│ store              : {}", store.getClass().getSimpleName());
            log.info("│ queue.capacity     : {}", props.getQueueCapacity());
            log.info("│ flush.minInterval  : {} ms", props.getMinFlushInterval().toMillis());
            log.info("│ failure.backoff    : {} ms", props.getFailureBackoff().toMillis());
            log.info("│ reaper.enabled     : {}", props.getReaper().isEnabled());
            log.info("│ reaper.interval    : {} ms", props.getReaper().getInterval().toMillis());
            log.info("│ guard.timeLimiter  : {}", guardProps.getTimeLimiter().isEnabled());
            log.info("│ guard.circuitBreak : {}", guardProps.getCircuitBreaker().isEnabled());
            for (RouteBatcher b : router.getBatchers().values()) {
                Route r = b.getRoute();
                log.info("│ route {} : matchers={}, dedupe={} s, group={} s, rate={}/min, chat={}, email={}",
                        r.getName(), r.getMatchers(), r.getDedupeWindow().toSeconds(), r.getGroupWindow().toSeconds(),
                        r.getRateLimitPerMin(), r.hasChat(), r.hasEmail());
            }
            log.info("└────────────────────────────────────────────────────────────┘");
        } catch (Throwable t) {
            log.warn("[Alert-Router] failed to render startup banner: {}", t.toString());
        }
        router.start();
        if (props.getReaper().isEnabled()) {
            reaper.start();
        }
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[Alert-Router] stop skipped: already stopped");
            return;
        }
        try {
            reaper.stop();
            router.stop();
        } finally {
            guard.shutdown();
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
