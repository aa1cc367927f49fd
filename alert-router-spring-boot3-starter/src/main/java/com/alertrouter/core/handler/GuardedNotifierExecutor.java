package com.alertrouter.core.handler;

import com.alertrouter.config.AlertGuardProperties;
import com.alertrouter.core.spi.notify.Notifier;
import com.alertrouter.model.Destination;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.micrometer.core.instrument.util.NamedThreadFactory;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 对 notifier.send 增加 TimeLimiter / CircuitBreaker 装饰
 * 保证单次发送有上限, 不会无限阻塞路由 worker
 */
public class GuardedNotifierExecutor {

    private final AlertGuardProperties props;

    private final ExecutorService sendExecutor;

    private final TimeLimiter timeLimiter;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();

    public GuardedNotifierExecutor(AlertGuardProperties props) {
        this.props = props;
        this.sendExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("alert-notify-send"));
        this.timeLimiter = props.getTimeLimiter().isEnabled()
                ? TimeLimiter.of("tl:notify", TimeLimiterConfig.custom()
                        .timeoutDuration(props.getTimeLimiter().getTimeout())
                        .cancelRunningFuture(true)
                        .build())
                : null;
    }

    /**
     * 统一入口
     * 组合装饰 CircuitBreaker → TimeLimiter → send, 超时也计入熔断统计
     */
    public void send(Notifier notifier, Destination destination, String text) throws Exception {
        Callable<Void> raw = () -> {
            notifier.send(destination, text);
            return null;
        };
        Callable<Void> decorated = raw;

        if (timeLimiter != null) {
            decorated = () -> timeLimiter.executeFutureSupplier(() -> sendExecutor.submit(raw));
        }

        CircuitBreaker cb = getCircuitBreakerIfEnabled(destination.name());
        if (cb != null) {
            decorated = CircuitBreaker.decorateCallable(cb, decorated);
        }
        decorated.call();
    }

    public CircuitBreaker getCircuitBreakerIfEnabled(String destination) {
        AlertGuardProperties.CbConfig c = cbConfig(destination);
        if (c == null || !c.isEnabled()) {
            return null;
        }
        return cbCache.computeIfAbsent(destination, k -> buildCb(k, c));
    }

    public void shutdown() {
        sendExecutor.shutdownNow();
    }

    private AlertGuardProperties.CbConfig cbConfig(String destination) {
        Map<String, AlertGuardProperties.CbConfig> per = props.getCbPerDestination();
        if (per != null && per.get(destination) != null) {
            return per.get(destination);
        }
        return props.getCircuitBreaker();
    }

    private CircuitBreaker buildCb(String destination, AlertGuardProperties.CbConfig c) {
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .minimumNumberOfCalls(c.getMinimumNumberOfCalls())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                .recordExceptions(Throwable.class)
                .build();
        return CircuitBreaker.of("cb:" + destination, cfg);
    }
}
