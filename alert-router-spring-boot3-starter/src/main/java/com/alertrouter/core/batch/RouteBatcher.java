package com.alertrouter.core.batch;

import com.alertrouter.core.deliver.DeliveryResult;
import com.alertrouter.core.deliver.Deliverer;
import com.alertrouter.core.metric.AlertRouterMetrics;
import com.alertrouter.exception.CapacityException;
import com.alertrouter.model.Alert;
import com.alertrouter.model.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 单条路由的批处理 worker
 * 有界队列 + 专属线程, 到期 flush, 停机时排空队列并做最后一次 flush
 */
public class RouteBatcher implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RouteBatcher.class);

    /** 轮询切片, 保证停机信号能及时被观察到 */
    private static final long POLL_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(200);

    private static final Duration MIN_INTERVAL = Duration.ofMillis(10);

    private final Route route;

    private final int capacity;

    private final BlockingQueue<Alert> queue;

    private final Deliverer deliverer;

    private final AlertRouterMetrics metrics;

    private final Duration flushInterval;

    private final Duration failureBackoff;

    /** 只由 worker 线程访问 */
    private final List<Alert> buffer = new ArrayList<>();

    private final CountDownLatch stopSignal = new CountDownLatch(1);

    private volatile boolean running;

    private Thread worker;

    public RouteBatcher(Route route, int capacity, Duration minFlushInterval, Duration failureBackoff,
                        Deliverer deliverer, AlertRouterMetrics metrics) {
        this.route = route;
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
        this.deliverer = deliverer;
        this.metrics = metrics;
        this.flushInterval = flushInterval(route.getGroupWindow(), minFlushInterval);
        this.failureBackoff = failureBackoff == null ? Duration.ZERO : failureBackoff;
        metrics.gaugeQueueDepth(route.getName(), queue);
    }

    /**
     * flush 周期 = max(groupWindow, 下限)
     */
    static Duration flushInterval(Duration groupWindow, Duration floor) {
        Duration g = groupWindow == null ? Duration.ZERO : groupWindow;
        Duration f = floor == null ? Duration.ZERO : floor;
        Duration d = g.compareTo(f) >= 0 ? g : f;
        return d.compareTo(MIN_INTERVAL) < 0 ? MIN_INTERVAL : d;
    }

    public synchronized void start() {
        if (worker != null) {
            return;
        }
        running = true;
        worker = new Thread(this, "alert-route-" + route.getName());
        worker.setDaemon(true);
        worker.setUncaughtExceptionHandler((t, e) -> log.error("[Route-Batcher] worker {} died", t.getName(), e));
        worker.start();
        log.info("[Route-Batcher] started route={}, flushEvery={} ms, capacity={}",
                route.getName(), flushInterval.toMillis(), capacity);
    }

    /**
     * 非阻塞入队, 队列满时抛出 CapacityException
     */
    public void enqueue(Alert alert) {
        if (!queue.offer(alert)) {
            throw new CapacityException(route.getName(), capacity);
        }
    }

    /**
     * 通知 worker 停止并等待最后一次 flush 完成
     */
    public void stop(Duration await) {
        Thread w;
        synchronized (this) {
            w = worker;
            running = false;
        }
        stopSignal.countDown();
        if (w == null) {
            return;
        }
        try {
            w.join(Math.max(1L, await.toMillis()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (w.isAlive()) {
            log.warn("[Route-Batcher] route={} did not finish final flush within {} ms", route.getName(), await.toMillis());
        } else {
            log.info("[Route-Batcher] stopped route={}", route.getName());
        }
    }

    @Override
    public void run() {
        long intervalNanos = flushInterval.toNanos();
        long nextFlushAt = System.nanoTime() + intervalNanos;
        try {
            while (running) {
                long wait = nextFlushAt - System.nanoTime();
                if (wait <= 0) {
                    flush();
                    nextFlushAt = System.nanoTime() + intervalNanos;
                    continue;
                }
                Alert a = queue.poll(Math.min(wait, POLL_SLICE_NANOS), TimeUnit.NANOSECONDS);
                if (a != null) {
                    buffer.add(a);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Route-Batcher] route={} interrupted, flushing what is buffered", route.getName());
        }
        queue.drainTo(buffer);
        flush();
    }

    private void flush() {
        if (buffer.isEmpty()) {
            return;
        }
        List<Alert> batch = List.copyOf(buffer);
        // 无论投递结果如何都清空
        buffer.clear();
        metrics.recordBatchSize(batch.size());

        long t0 = System.nanoTime();
        DeliveryResult result;
        try {
            result = deliverer.deliver(route, batch);
        } catch (RuntimeException e) {
            log.error("[Route-Batcher] route={} delivery crashed, batch of {} lost", route.getName(), batch.size(), e);
            return;
        } finally {
            metrics.recordFlushNanos(System.nanoTime() - t0);
        }

        if (!result.isSuccess() && running) {
            pauseAfterFailure();
        }
    }

    private void pauseAfterFailure() {
        if (failureBackoff.isZero() || failureBackoff.isNegative()) {
            return;
        }
        try {
            // 停机信号会提前结束等待
            stopSignal.await(failureBackoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public Route getRoute() {
        return route;
    }

    public int queueDepth() {
        return queue.size();
    }

    public boolean isRunning() {
        return running;
    }
}
