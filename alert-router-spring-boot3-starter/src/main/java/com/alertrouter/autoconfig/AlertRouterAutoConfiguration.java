package com.alertrouter.autoconfig;

import com.alertrouter.config.AlertGuardProperties;
import com.alertrouter.config.AlertRouterProperties;
import com.alertrouter.core.AlertRouter;
import com.alertrouter.core.AlertRouterLifecycle;
import com.alertrouter.core.dedup.DedupEngine;
import com.alertrouter.core.deliver.BatchFormatter;
import com.alertrouter.core.deliver.Deliverer;
import com.alertrouter.core.dlq.DeadLetterRecorder;
import com.alertrouter.core.handler.GuardedNotifierExecutor;
import com.alertrouter.core.metric.AlertRouterMetrics;
import com.alertrouter.core.ratelimit.RouteRateLimiter;
import com.alertrouter.core.route.RouteCompiler;
import com.alertrouter.core.route.RouteMatcher;
import com.alertrouter.core.serializer.JacksonPayloadSerializer;
import com.alertrouter.core.silence.SilenceReaper;
import com.alertrouter.core.silence.SilenceRegistry;
import com.alertrouter.core.spi.PayloadSerializer;
import com.alertrouter.core.spi.StateStore;
import com.alertrouter.core.spi.notify.MessageTemplate;
import com.alertrouter.core.spi.notify.NotifierRouter;
import com.alertrouter.core.store.InMemoryStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * 路由管线各组件及生命周期
 */
@AutoConfiguration(after = {
        AlertRouterMetricsAutoConfiguration.class,
        AlertRouterNotifierAutoConfiguration.class,
        AlertRouterMybatisAutoConfiguration.class
})
@EnableConfigurationProperties({
        AlertRouterProperties.class,
        AlertGuardProperties.class
})
public class AlertRouterAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AlertRouterAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock alertRouterClock() {
        return Clock.systemUTC();
    }

    /**
     * 默认序列化
     */
    @Bean
    @ConditionalOnMissingBean(PayloadSerializer.class)
    public PayloadSerializer payloadSerializer() {
        return new JacksonPayloadSerializer();
    }

    /**
     * 未配置数据库时的兜底存储, 进程重启后状态丢失
     */
    @Bean
    @ConditionalOnMissingBean(StateStore.class)
    public StateStore inMemoryStateStore() {
        log.warn("[Alert-Router] no DataSource configured, using in-memory state store: dedupe/silence/DLQ state is lost on restart");
        return new InMemoryStateStore();
    }

    @Bean
    @ConditionalOnMissingBean(MessageTemplate.class)
    public MessageTemplate messageTemplate() {
        return new BatchFormatter();
    }

    @Bean
    public SilenceRegistry silenceRegistry(StateStore store, PayloadSerializer serializer, Clock clock) {
        return new SilenceRegistry(store, serializer, clock);
    }

    @Bean
    public SilenceReaper silenceReaper(SilenceRegistry registry, Clock clock, AlertRouterProperties props) {
        return new SilenceReaper(registry, clock, props.getReaper().getInterval());
    }

    @Bean
    public RouteRateLimiter routeRateLimiter(StateStore store) {
        return new RouteRateLimiter(store);
    }

    @Bean
    public DedupEngine dedupEngine(StateStore store) {
        return new DedupEngine(store);
    }

    @Bean
    public RouteMatcher routeMatcher(AlertRouterProperties props) {
        return new RouteMatcher(RouteCompiler.compileAll(props.getRoutes()));
    }

    @Bean
    public DeadLetterRecorder deadLetterRecorder(StateStore store, PayloadSerializer serializer,
                                                 AlertRouterMetrics metrics) {
        return new DeadLetterRecorder(store, serializer, metrics);
    }

    @Bean
    public Deliverer deliverer(NotifierRouter router, GuardedNotifierExecutor guard, MessageTemplate template,
                               DeadLetterRecorder dlq, PayloadSerializer serializer,
                               AlertRouterMetrics metrics, Clock clock) {
        return new Deliverer(router, guard, template, dlq, serializer, metrics, clock);
    }

    /**
     * 路由引擎
     */
    @Bean
    public AlertRouter alertRouter(RouteMatcher matcher, SilenceRegistry silences, RouteRateLimiter rateLimiter,
                                   DedupEngine dedup, Deliverer deliverer, AlertRouterMetrics metrics,
                                   Clock clock, AlertRouterProperties props) {
        return new AlertRouter(matcher, silences, rateLimiter, dedup, deliverer, metrics, clock, props);
    }

    /**
     * 启动 worker 与静默清理, 关闭时做最后一次 flush
     */
    @Bean
    public AlertRouterLifecycle alertRouterLifecycle(AlertRouter router, SilenceReaper reaper,
                                                     GuardedNotifierExecutor guard, StateStore store,
                                                     AlertRouterProperties props, AlertGuardProperties guardProps) {
        return new AlertRouterLifecycle(router, reaper, guard, store, props, guardProps);
    }
}
