package com.alertrouter.config;

import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 告警路由配置（绑定前缀：alert.router）
 *
 * YAML 示例：
 * alert:
 *   router:
 *     enabled: true
 *     queue-capacity: 1024
 *     min-flush-interval: 5s
 *     failure-backoff: 2s
 *     reaper:
 *       enabled: true
 *       interval: 1m
 *     shutdown:
 *       await: 30s
 *     routes:
 *       - name: oncall
 *         matchers:
 *           - label: severity
 *             regex: ^(critical|high)$
 *         dedupe-window: 2m
 *         group-window: 30s
 *         rate-limit-per-min: 60
 *         chat:
 *           webhook: https://chat.example.com/hooks/abc
 *           channel: "#oncall"
 *         email-to:
 *           - oncall@example.com
 */
@Validated
@ConfigurationProperties(prefix = "alert.router")
public class AlertRouterProperties {

    /** 是否启动路由 worker 与静默清理 */
    private boolean enabled = true;

    /** 每条路由的队列容量 */
    @Min(1)
    private int queueCapacity = 1024;

    /** flush 定时器下限 */
    private Duration minFlushInterval = Duration.ofSeconds(5);

    /** 投递失败后 worker 暂停时长 */
    private Duration failureBackoff = Duration.ofSeconds(2);

    private Reaper reaper = new Reaper();

    private Shutdown shutdown = new Shutdown();

    private List<RouteConfig> routes = new ArrayList<>();

    // ----------------- 嵌套配置对象 -----------------

    public static class Reaper {
        /** 是否启动过期静默清理 */
        private boolean enabled = true;

        /** 清理周期 */
        private Duration interval = Duration.ofMinutes(1);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
    }

    public static class Shutdown {
        /** 停机时等待每个 worker 最后一次 flush 的时长 */
        private Duration await = Duration.ofSeconds(30);

        public Duration getAwait() { return await; }
        public void setAwait(Duration await) { this.await = await; }
    }

    public static class RouteConfig {
        private String name;

        /** 全部满足才命中 */
        private List<MatcherConfig> matchers = new ArrayList<>();

        /** 去重窗口 */
        private Duration dedupeWindow = Duration.ofMinutes(2);

        /** 聚合窗口 */
        private Duration groupWindow = Duration.ofSeconds(30);

        /** 每分钟最大放行数, <=0 不限 */
        private int rateLimitPerMin = 0;

        private Chat chat;

        private List<String> emailTo = new ArrayList<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public List<MatcherConfig> getMatchers() { return matchers; }
        public void setMatchers(List<MatcherConfig> matchers) { this.matchers = matchers; }
        public Duration getDedupeWindow() { return dedupeWindow; }
        public void setDedupeWindow(Duration dedupeWindow) { this.dedupeWindow = dedupeWindow; }
        public Duration getGroupWindow() { return groupWindow; }
        public void setGroupWindow(Duration groupWindow) { this.groupWindow = groupWindow; }
        public int getRateLimitPerMin() { return rateLimitPerMin; }
        public void setRateLimitPerMin(int rateLimitPerMin) { this.rateLimitPerMin = rateLimitPerMin; }
        public Chat getChat() { return chat; }
        public void setChat(Chat chat) { this.chat = chat; }
        public List<String> getEmailTo() { return emailTo; }
        public void setEmailTo(List<String> emailTo) { this.emailTo = emailTo; }
    }

    public static class MatcherConfig {
        private String label;

        private String regex;

        public MatcherConfig() {}

        public MatcherConfig(String label, String regex) {
            this.label = label;
            this.regex = regex;
        }

        public String getLabel() { return label; }
        public void setLabel(String label) { this.label = label; }
        public String getRegex() { return regex; }
        public void setRegex(String regex) { this.regex = regex; }
    }

    public static class Chat {
        private String webhook;

        /** 仅用于展示 */
        private String channel;

        public String getWebhook() { return webhook; }
        public void setWebhook(String webhook) { this.webhook = webhook; }
        public String getChannel() { return channel; }
        public void setChannel(String channel) { this.channel = channel; }
    }

    // ----------------- getters/setters 顶层 -----------------

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }

    public Duration getMinFlushInterval() { return minFlushInterval; }
    public void setMinFlushInterval(Duration minFlushInterval) { this.minFlushInterval = minFlushInterval; }

    public Duration getFailureBackoff() { return failureBackoff; }
    public void setFailureBackoff(Duration failureBackoff) { this.failureBackoff = failureBackoff; }

    public Reaper getReaper() { return reaper; }
    public void setReaper(Reaper reaper) { this.reaper = reaper; }

    public Shutdown getShutdown() { return shutdown; }
    public void setShutdown(Shutdown shutdown) { this.shutdown = shutdown; }

    public List<RouteConfig> getRoutes() { return routes; }
    public void setRoutes(List<RouteConfig> routes) { this.routes = routes; }
}
