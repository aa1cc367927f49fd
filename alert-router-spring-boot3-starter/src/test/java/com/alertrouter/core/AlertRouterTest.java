package com.alertrouter.core;

import static com.alertrouter.support.Alerts.alert;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

import com.alertrouter.config.AlertGuardProperties;
import com.alertrouter.config.AlertRouterProperties;
import com.alertrouter.config.AlertRouterProperties.Chat;
import com.alertrouter.config.AlertRouterProperties.MatcherConfig;
import com.alertrouter.config.AlertRouterProperties.RouteConfig;
import com.alertrouter.core.dedup.DedupEngine;
import com.alertrouter.core.fingerprint.Fingerprinter;
import com.alertrouter.core.deliver.BatchFormatter;
import com.alertrouter.core.deliver.Deliverer;
import com.alertrouter.core.dlq.DeadLetterRecorder;
import com.alertrouter.core.handler.GuardedNotifierExecutor;
import com.alertrouter.core.metric.AlertRouterMetrics;
import com.alertrouter.core.notify.route.DestinationNotifierRouter;
import com.alertrouter.core.ratelimit.RouteRateLimiter;
import com.alertrouter.core.route.RouteCompiler;
import com.alertrouter.core.route.RouteMatcher;
import com.alertrouter.core.serializer.JacksonPayloadSerializer;
import com.alertrouter.core.silence.SilenceRegistry;
import com.alertrouter.core.spi.StateStore;
import com.alertrouter.core.store.InMemoryStateStore;
import com.alertrouter.exception.StoreException;
import com.alertrouter.model.Alert;
import com.alertrouter.model.DlqRecord;
import com.alertrouter.model.IngestReport;
import com.alertrouter.model.enums.DropReason;
import com.alertrouter.model.enums.StateNamespace;
import com.alertrouter.support.MutableClock;
import com.alertrouter.support.RecordingNotifier;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AlertRouterTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:10Z");

    private MutableClock clock;
    private StateStore store;
    private AlertRouterProperties props;
    private AlertRouterMetrics metrics;
    private RecordingNotifier notifier;
    private GuardedNotifierExecutor guard;
    private SilenceRegistry silences;
    private DeadLetterRecorder dlq;
    private AlertRouter router;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryStateStore();
        props = new AlertRouterProperties();
        // 只在 stop 时 flush, 结果可确定
        props.setMinFlushInterval(Duration.ofHours(1));
        props.setFailureBackoff(Duration.ofMillis(10));
        metrics = AlertRouterMetrics.noop();
        notifier = new RecordingNotifier();
    }

    @AfterEach
    void tearDown() {
        if (router != null) {
            router.stop();
        }
        if (guard != null) {
            guard.shutdown();
        }
    }

    private RouteConfig route(String name, String label, String regex, int ratePerMin) {
        RouteConfig cfg = new RouteConfig();
        cfg.setName(name);
        cfg.setMatchers(List.of(new MatcherConfig(label, regex)));
        cfg.setDedupeWindow(Duration.ofMinutes(2));
        cfg.setGroupWindow(Duration.ofSeconds(30));
        cfg.setRateLimitPerMin(ratePerMin);
        Chat chat = new Chat();
        chat.setWebhook("https://chat.example.com/hooks/" + name);
        cfg.setChat(chat);
        return cfg;
    }

    private AlertRouter start(RouteConfig... routes) {
        props.setRoutes(List.of(routes));
        JacksonPayloadSerializer serializer = new JacksonPayloadSerializer();
        silences = new SilenceRegistry(store, serializer, clock);
        dlq = new DeadLetterRecorder(store, serializer, metrics);
        guard = new GuardedNotifierExecutor(new AlertGuardProperties());
        Deliverer deliverer = new Deliverer(new DestinationNotifierRouter(List.of(), notifier), guard,
                new BatchFormatter(), dlq, serializer, metrics, clock);
        router = new AlertRouter(new RouteMatcher(RouteCompiler.compileAll(props.getRoutes())), silences,
                new RouteRateLimiter(store), new DedupEngine(store), deliverer, metrics, clock, props);
        router.start();
        return router;
    }

    private IngestReport ingest(Alert... alerts) {
        return router.ingest(List.of(alerts), "test");
    }

    @Test
    void shouldDeliverFirstAndDedupeRepeatUntilWindowElapses() {
        // given
        start(route("critical", "severity", "^critical$", 0));

        // when
        IngestReport first = ingest(alert("severity", "critical", "instance", "db1"));
        clock.advance(Duration.ofSeconds(1));
        IngestReport second = ingest(alert("severity", "critical", "instance", "db1"));
        clock.advance(Duration.ofMinutes(2));
        IngestReport third = ingest(alert("instance", "db1", "severity", "critical"));
        router.stop();

        // then
        assertThat(first.getEnqueued()).isEqualTo(1);
        assertThat(second.getEnqueued()).isZero();
        assertThat(second.getDropped(DropReason.DEDUPED)).isEqualTo(1);
        assertThat(third.getEnqueued()).isEqualTo(1);
        assertThat(metrics.dropped(DropReason.DEDUPED)).isEqualTo(1.0);
        assertThat(notifier.sent()).singleElement().satisfies(text -> assertThat(text).startsWith("*2 alert(s) severity=critical*"));
    }

    @Test
    void shouldAdmitOnlyRateLimitPerMinute() {
        // given
        start(route("limited", "severity", ".*", 3));
        List<Alert> alerts = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            alerts.add(alert("severity", "warning", "instance", "host" + i));
        }

        // when
        IngestReport report = router.ingest(alerts, "test");

        // then
        assertThat(report.getEnqueued()).isEqualTo(3);
        assertThat(report.getDropped(DropReason.RATE_LIMITED)).isEqualTo(2);
    }

    @Test
    void shouldDropSilencedAlertsRegardlessOfRoutes() {
        // given
        start(route("web", "team", "^web$", 0));
        silences.create("severity", "^critical$", T0.plus(Duration.ofHours(1)));

        // when
        IngestReport report = ingest(
                alert("severity", "critical", "team", "web"),
                alert("severity", "critical", "team", "nobody"),
                alert("severity", "warning", "team", "web"));

        // then
        assertThat(report.getDropped(DropReason.SILENCED)).isEqualTo(2);
        assertThat(report.getEnqueued()).isEqualTo(1);
    }

    @Test
    void shouldStopSilencingOnceExpired() {
        // given
        start(route("critical", "severity", "^critical$", 0));
        silences.create("severity", "^critical$", T0.plus(Duration.ofMinutes(1)));
        clock.advance(Duration.ofMinutes(2));

        // when
        IngestReport report = ingest(alert("severity", "critical"));

        // then
        assertThat(report.getEnqueued()).isEqualTo(1);
    }

    @Test
    void shouldDeliverBatchInEnqueueOrder() {
        // given
        start(route("critical", "severity", "^critical$", 0));

        // when
        ingest(alert("severity", "critical", "summary", "one"),
                alert("severity", "critical", "summary", "two"),
                alert("severity", "critical", "summary", "three"));
        router.stop();

        // then
        assertThat(notifier.sent()).containsExactly("""
                *3 alert(s) severity=critical*
                - one [sev:critical]
                - two [sev:critical]
                - three [sev:critical]
                """);
    }

    @Test
    void shouldFanOutToEveryMatchingRouteWithSharedDedupe() {
        // given
        start(route("a", "severity", "critical", 0), route("b", "team", "db", 0));

        // when
        IngestReport report = ingest(alert("severity", "critical", "team", "db"));

        // then
        assertThat(report.getEnqueued()).isEqualTo(1);
        assertThat(report.getDropped(DropReason.DEDUPED)).isEqualTo(1);
    }

    @Test
    void shouldCountUnmatchedAlerts() {
        // given
        start(route("critical", "severity", "^critical$", 0));

        // when
        IngestReport report = ingest(alert("severity", "info"));

        // then
        assertThat(report.getUnmatched()).isEqualTo(1);
        assertThat(report.getEnqueued()).isZero();
    }

    @Test
    void shouldDropNewestWhenQueueFull() {
        // given
        props.setQueueCapacity(2);
        RouteConfig cfg = route("small", "severity", ".*", 0);
        cfg.setDedupeWindow(Duration.ZERO);
        start(cfg);
        router.getBatchers().get("small").stop(Duration.ofSeconds(5));

        // when
        IngestReport report = ingest(alert("n", "1", "severity", "x"), alert("n", "2", "severity", "x"),
                alert("n", "3", "severity", "x"));

        // then
        assertThat(report.getEnqueued()).isEqualTo(2);
        assertThat(report.getDropped(DropReason.QUEUE_FULL)).isEqualTo(1);
        assertThat(metrics.dropped(DropReason.QUEUE_FULL)).isEqualTo(1.0);
    }

    @Test
    void shouldRecordOneDeadLetterWhenSendFails() {
        // given
        start(route("critical", "severity", "^critical$", 0));
        notifier.failWith(new IOException("webhook returned status 503"));

        // when
        ingest(alert("severity", "critical", "instance", "db1"));
        router.stop();

        // then
        List<DlqRecord> records = dlq.list();
        assertThat(records).hasSize(1);
        DlqRecord rec = records.get(0);
        assertThat(rec.getRoute()).isEqualTo("critical");
        assertThat(rec.getDestination()).isEqualTo("chat");
        assertThat(rec.getPayload()).contains("db1");
        assertThat(rec.getError()).contains("503");
    }

    @Test
    void shouldFailClosedWhenStoreUnavailable() {
        // given
        store = mock(StateStore.class);
        given(store.scan(any())).willThrow(new StoreException("down", null));
        start(route("critical", "severity", "^critical$", 0));

        // when
        IngestReport report = ingest(alert("severity", "critical"));

        // then
        assertThat(report.getEnqueued()).isZero();
        assertThat(report.getDropped(DropReason.SILENCED)).isEqualTo(1);
        assertThat(metrics.storeErrors()).isEqualTo(1.0);
    }

    @Test
    void shouldFailClosedWhenRateCounterUnavailable() {
        // given
        StateStore backing = new InMemoryStateStore();
        store = mock(StateStore.class);
        given(store.scan(any())).willAnswer(inv -> backing.scan(inv.getArgument(0)));
        given(store.increment(any(), anyString())).willThrow(new StoreException("down", null));
        start(route("limited", "severity", ".*", 5));

        // when
        IngestReport report = ingest(alert("severity", "critical"));

        // then
        assertThat(report.getDropped(DropReason.RATE_LIMITED)).isEqualTo(1);
        assertThat(metrics.storeErrors()).isEqualTo(1.0);
    }

    @Test
    void shouldRejectIngestWhenStopped() {
        // given
        start(route("critical", "severity", "^critical$", 0));
        router.stop();

        // when/then
        assertThatThrownBy(() -> ingest(alert("severity", "critical")))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldComputeMissingFingerprint() {
        // given
        start(route("critical", "severity", "^critical$", 0));
        Alert a = alert("severity", "critical");

        // when
        ingest(a);

        // then
        assertThat(a.getFingerprint()).hasSize(40);
    }

    @Test
    void shouldDropCorruptDedupeRecordAndKeepProcessingBatch() {
        // given
        start(route("critical", "severity", "^critical$", 0));
        Alert corrupt = alert("severity", "critical", "instance", "db1");
        Fingerprinter.ensure(corrupt);
        store.set(StateNamespace.DEDUPE, corrupt.getFingerprint(), "not-a-timestamp");

        // when
        IngestReport report = ingest(corrupt, alert("severity", "critical", "instance", "db2"));

        // then
        assertThat(report.getReceived()).isEqualTo(2);
        assertThat(report.getDropped(DropReason.DEDUPED)).isEqualTo(1);
        assertThat(report.getEnqueued()).isEqualTo(1);
        assertThat(metrics.storeErrors()).isEqualTo(1.0);
    }

    @Test
    void shouldDeliverAlertIngestedWhileStopping() throws Exception {
        // given
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        store = new InMemoryStateStore() {
            @Override
            public long increment(StateNamespace ns, String key) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return super.increment(ns, key);
            }
        };
        start(route("limited", "severity", ".*", 5));
        CompletableFuture<IngestReport> inFlight =
                CompletableFuture.supplyAsync(() -> ingest(alert("severity", "critical", "instance", "db1")));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        // when
        CompletableFuture<Void> stopping = CompletableFuture.runAsync(router::stop);
        Thread.sleep(100);
        boolean runningWhileIngestInFlight = router.isRunning();
        release.countDown();
        IngestReport report = inFlight.get(5, TimeUnit.SECONDS);
        stopping.get(10, TimeUnit.SECONDS);

        // then
        assertThat(runningWhileIngestInFlight).isTrue();
        assertThat(report.getEnqueued()).isEqualTo(1);
        assertThat(router.isRunning()).isFalse();
        assertThat(notifier.sent()).singleElement().satisfies(text -> assertThat(text).contains("db1"));
    }
}
