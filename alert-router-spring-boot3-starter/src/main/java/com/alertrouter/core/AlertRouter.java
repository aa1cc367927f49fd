package com.alertrouter.core;

import com.alertrouter.config.AlertRouterProperties;
import com.alertrouter.core.batch.RouteBatcher;
import com.alertrouter.core.dedup.DedupEngine;
import com.alertrouter.core.deliver.Deliverer;
import com.alertrouter.core.fingerprint.Fingerprinter;
import com.alertrouter.core.metric.AlertRouterMetrics;
import com.alertrouter.core.ratelimit.RouteRateLimiter;
import com.alertrouter.core.route.RouteMatcher;
import com.alertrouter.core.silence.SilenceRegistry;
import com.alertrouter.exception.CapacityException;
import com.alertrouter.exception.StoreException;
import com.alertrouter.model.Alert;
import com.alertrouter.model.IngestReport;
import com.alertrouter.model.Route;
import com.alertrouter.model.enums.DropReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 告警路由入口
 * 每条告警: 指纹 → 静默 → (每条命中路由) 限流 → 去重 → 入队
 * 状态存储异常一律按对应阶段丢弃
 */
public class AlertRouter {

    private static final Logger log = LoggerFactory.getLogger(AlertRouter.class);

    private final RouteMatcher matcher;

    private final SilenceRegistry silences;

    private final RouteRateLimiter rateLimiter;

    private final DedupEngine dedup;

    private final AlertRouterMetrics metrics;

    private final Clock clock;

    private final AlertRouterProperties props;

    /** 路由名 → worker, 启动时一次性构建 */
    private final Map<String, RouteBatcher> batchers;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /** 接入持读锁, 启停持写锁 */
    private final ReentrantReadWriteLock lifecycleLock = new ReentrantReadWriteLock();

    public AlertRouter(RouteMatcher matcher, SilenceRegistry silences, RouteRateLimiter rateLimiter,
                       DedupEngine dedup, Deliverer deliverer, AlertRouterMetrics metrics,
                       Clock clock, AlertRouterProperties props) {
        this.matcher = matcher;
        this.silences = silences;
        this.rateLimiter = rateLimiter;
        this.dedup = dedup;
        this.metrics = metrics;
        this.clock = clock;
        this.props = props;

        Map<String, RouteBatcher> m = new LinkedHashMap<>();
        for (Route r : matcher.routes()) {
            m.put(r.getName(), new RouteBatcher(r, props.getQueueCapacity(), props.getMinFlushInterval(),
                    props.getFailureBackoff(), deliverer, metrics));
        }
        this.batchers = Collections.unmodifiableMap(m);
    }

    public void start() {
        lifecycleLock.writeLock().lock();
        try {
            if (!running.compareAndSet(false, true)) {
                return;
            }
            batchers.values().forEach(RouteBatcher::start);
        } finally {
            lifecycleLock.writeLock().unlock();
        }
        log.info("[Alert-Router] started, routes={}", batchers.keySet());
    }

    /**
     * 停止接入, 每个 worker 排空队列并做最后一次 flush
     */
    public void stop() {
        // 等待进行中的 ingest 入队完成, 之后的 ingest 会直接被拒绝
        lifecycleLock.writeLock().lock();
        try {
            if (!running.compareAndSet(true, false)) {
                return;
            }
        } finally {
            lifecycleLock.writeLock().unlock();
        }
        log.info("[Alert-Router] stopping, draining {} route(s)", batchers.size());
        for (RouteBatcher b : batchers.values()) {
            b.stop(props.getShutdown().getAwait());
        }
        log.info("[Alert-Router] stopped");
    }

    public boolean isRunning() {
        return running.get();
    }

    public IngestReport ingest(List<Alert> alerts, String source) {
        IngestReport report = new IngestReport();
        lifecycleLock.readLock().lock();
        try {
            if (!running.get()) {
                throw new IllegalStateException("alert router is not running");
            }
            if (alerts == null) {
                return report;
            }
            for (Alert alert : alerts) {
                if (alert == null) {
                    continue;
                }
                report.received();
                metrics.incIngested(source);
                ingestOne(alert, report);
            }
        } finally {
            lifecycleLock.readLock().unlock();
        }
        log.debug("[Alert-Router] ingest source={}, {}", source, report);
        return report;
    }

    private void ingestOne(Alert alert, IngestReport report) {
        Fingerprinter.ensure(alert);
        Instant now = clock.instant();

        boolean silenced;
        try {
            silenced = silences.isSilenced(alert);
        } catch (StoreException e) {
            storeFailure("silence", alert, e);
            silenced = true;
        }
        if (silenced) {
            drop(report, DropReason.SILENCED, alert, null);
            return;
        }

        List<Route> routes = matcher.matchingRoutes(alert);
        if (routes.isEmpty()) {
            report.unmatched();
            log.debug("[Alert-Router] no route matched fp={}", alert.getFingerprint());
            return;
        }
        for (Route route : routes) {
            routeOne(alert, route, now, report);
        }
    }

    private void routeOne(Alert alert, Route route, Instant now, IngestReport report) {
        try {
            if (!rateLimiter.admit(route, now)) {
                drop(report, DropReason.RATE_LIMITED, alert, route);
                return;
            }
        } catch (StoreException e) {
            storeFailure("ratelimit", alert, e);
            drop(report, DropReason.RATE_LIMITED, alert, route);
            return;
        }

        try {
            if (!dedup.tryAdmit(alert.getFingerprint(), route.getDedupeWindow(), now)) {
                drop(report, DropReason.DEDUPED, alert, route);
                return;
            }
        } catch (StoreException e) {
            storeFailure("dedupe", alert, e);
            drop(report, DropReason.DEDUPED, alert, route);
            return;
        }

        try {
            batchers.get(route.getName()).enqueue(alert);
            report.enqueued();
            metrics.incEnqueued(route.getName());
        } catch (CapacityException e) {
            drop(report, DropReason.QUEUE_FULL, alert, route);
        }
    }

    private void drop(IngestReport report, DropReason reason, Alert alert, Route route) {
        report.dropped(reason);
        metrics.incDropped(reason);
        log.debug("[Alert-Router] dropped reason={}, route={}, fp={}",
                reason.tag(), route == null ? "-" : route.getName(), alert.getFingerprint());
    }

    private void storeFailure(String stage, Alert alert, StoreException e) {
        metrics.incStoreErr();
        log.error("[Alert-Router] state store failed at stage={}, fp={}, failing closed", stage, alert.getFingerprint(), e);
    }

    public Map<String, RouteBatcher> getBatchers() {
        return batchers;
    }
}
