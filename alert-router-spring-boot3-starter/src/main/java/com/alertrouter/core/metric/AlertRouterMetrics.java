package com.alertrouter.core.metric;

import com.alertrouter.model.enums.DropReason;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Collection;
import java.util.EnumMap;
import java.util.concurrent.TimeUnit;

public final class AlertRouterMetrics {
    private final MeterRegistry reg;
    private final EnumMap<DropReason, Counter> dropped = new EnumMap<>(DropReason.class);
    private final Counter dlq;
    private final Counter storeErr;
    private final DistributionSummary batchSize;
    private final Timer flushTimer;

    private AlertRouterMetrics(MeterRegistry reg) {
        this.reg = reg;
        for (DropReason r : DropReason.values()) {
            dropped.put(r, Counter.builder("alert.router.dropped").tag("reason", r.tag())
                    .description("alerts dropped").register(reg));
        }
        this.dlq      = Counter.builder("alert.router.dlq").description("dead-letter records written").register(reg);
        this.storeErr = Counter.builder("alert.router.store.errors").description("state store failures, failed closed").register(reg);
        this.batchSize = DistributionSummary.builder("alert.router.batch.size")
                .description("alerts per flushed batch").baseUnit("alerts").register(reg);
        this.flushTimer = Timer.builder("alert.router.flush.time").description("batch delivery time").register(reg);
    }

    public static AlertRouterMetrics create(MeterRegistry reg) { return new AlertRouterMetrics(reg); }

    /** 测试及无注册表场景 */
    public static AlertRouterMetrics noop() { return new AlertRouterMetrics(new SimpleMeterRegistry()); }

    public MeterRegistry registry() { return reg; }

    public void incIngested(String source){
        Counter.builder("alert.router.ingested").tag("source", source == null ? "unknown" : source)
                .description("alerts received").register(reg).increment();
    }
    public void incDropped(DropReason reason){ dropped.get(reason).increment(); }
    public void incEnqueued(String route){
        Counter.builder("alert.router.enqueued").tag("route", route).description("alerts enqueued").register(reg).increment();
    }
    public void incDelivered(String dest){
        Counter.builder("alert.router.deliveries").tag("dest", dest).description("successful deliveries").register(reg).increment();
    }
    public void incDeliveryError(String dest){
        Counter.builder("alert.router.delivery.errors").tag("dest", dest).description("failed deliveries").register(reg).increment();
    }
    public void incDlq(){ dlq.increment(); }
    public void incStoreErr(){ storeErr.increment(); }
    public void recordBatchSize(int n){ batchSize.record(n); }
    public void recordFlushNanos(long nanos){ flushTimer.record(nanos, TimeUnit.NANOSECONDS); }

    public void gaugeQueueDepth(String route, Collection<?> queue) {
        Gauge.builder("alert.router.queue.depth", queue, Collection::size)
                .tag("route", route).description("alerts waiting in route queue").register(reg);
    }

    public double dropped(DropReason reason) { return dropped.get(reason).count(); }
    public double dlqCount() { return dlq.count(); }
    public double storeErrors() { return storeErr.count(); }
}
