package com.alertrouter.core.deliver;

import com.alertrouter.core.dlq.DeadLetterRecorder;
import com.alertrouter.core.handler.GuardedNotifierExecutor;
import com.alertrouter.core.metric.AlertRouterMetrics;
import com.alertrouter.core.spi.PayloadSerializer;
import com.alertrouter.core.spi.notify.MessageTemplate;
import com.alertrouter.core.spi.notify.Notifier;
import com.alertrouter.core.spi.notify.NotifierRouter;
import com.alertrouter.exception.TransientDeliveryException;
import com.alertrouter.model.Alert;
import com.alertrouter.model.Destination;
import com.alertrouter.model.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 批次投递
 * chat 与 email 相互独立, 每个失败的目的地写一条 DLQ, 不重试
 */
public class Deliverer {

    private static final Logger log = LoggerFactory.getLogger(Deliverer.class);

    private final NotifierRouter router;

    private final GuardedNotifierExecutor guard;

    private final MessageTemplate template;

    private final DeadLetterRecorder dlq;

    private final PayloadSerializer serializer;

    private final AlertRouterMetrics metrics;

    private final Clock clock;

    public Deliverer(NotifierRouter router, GuardedNotifierExecutor guard, MessageTemplate template,
                     DeadLetterRecorder dlq, PayloadSerializer serializer, AlertRouterMetrics metrics, Clock clock) {
        this.router = router;
        this.guard = guard;
        this.template = template;
        this.dlq = dlq;
        this.serializer = serializer;
        this.metrics = metrics;
        this.clock = clock;
    }

    public DeliveryResult deliver(Route route, List<Alert> batch) {
        if (batch == null || batch.isEmpty()) {
            return DeliveryResult.nothing();
        }
        String text = template.renderBody(batch);

        List<Destination> targets = new ArrayList<>(2);
        if (route.hasChat()) targets.add(route.getChat());
        if (route.hasEmail()) targets.add(route.getEmail());
        if (targets.isEmpty()) {
            log.warn("[Deliver] route={} has no destination, batch of {} discarded", route.getName(), batch.size());
            return DeliveryResult.nothing();
        }

        List<TransientDeliveryException> failures = new ArrayList<>();
        for (Destination dest : targets) {
            TransientDeliveryException failure = attempt(route, dest, text, batch);
            if (failure != null) {
                failures.add(failure);
            }
        }
        return new DeliveryResult(targets.size(), failures);
    }

    private TransientDeliveryException attempt(Route route, Destination dest, String text, List<Alert> batch) {
        Notifier notifier = router.route(dest);
        try {
            guard.send(notifier, dest, text);
            metrics.incDelivered(dest.name());
            log.debug("[Deliver] route={}, dest={}, notifier={}, alerts={}", route.getName(), dest.name(), notifier.name(), batch.size());
            return null;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            TransientDeliveryException ex = new TransientDeliveryException(dest.name(), e);
            metrics.incDeliveryError(dest.name());
            log.warn("[Deliver] route={}, dest={} failed: {}", route.getName(), dest.name(), ex.getMessage());
            dlq.record(route.getName(), dest.name(), payload(route, text, batch), ex.getMessage(), clock.instant());
            return ex;
        }
    }

    private String payload(Route route, String text, List<Alert> batch) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("route", route.getName());
        p.put("text", text);
        p.put("alerts", batch);
        return serializer.serialize(p);
    }
}
