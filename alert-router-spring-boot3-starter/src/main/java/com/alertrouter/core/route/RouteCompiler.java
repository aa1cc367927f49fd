package com.alertrouter.core.route;

import com.alertrouter.config.AlertRouterProperties;
import com.alertrouter.exception.ValidationException;
import com.alertrouter.model.Destination;
import com.alertrouter.model.LabelMatcher;
import com.alertrouter.model.Route;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * 将路由配置编译为不可变的 Route 列表
 * 不合法的路由整条丢弃并记录日志, 其余路由照常加载
 */
public final class RouteCompiler {

    private static final Logger log = LoggerFactory.getLogger(RouteCompiler.class);

    private RouteCompiler() {}

    public static List<Route> compileAll(List<AlertRouterProperties.RouteConfig> configs) {
        List<Route> routes = new ArrayList<>();
        Set<String> names = new HashSet<>();
        if (configs == null) {
            return routes;
        }
        for (AlertRouterProperties.RouteConfig cfg : configs) {
            try {
                Route route = compile(cfg);
                if (!names.add(route.getName())) {
                    throw new ValidationException("duplicate route name: " + route.getName());
                }
                routes.add(route);
            } catch (ValidationException e) {
                log.error("[Route-Compiler] route skipped, name={}: {}", cfg.getName(), e.getMessage());
            }
        }
        return List.copyOf(routes);
    }

    public static Route compile(AlertRouterProperties.RouteConfig cfg) {
        if (cfg.getName() == null || cfg.getName().isBlank()) {
            throw new ValidationException("route name is required");
        }
        Route.RouteBuilder b = Route.builder()
                .name(cfg.getName())
                .dedupeWindow(nonNegative(cfg.getDedupeWindow()))
                .groupWindow(nonNegative(cfg.getGroupWindow()))
                .rateLimitPerMin(cfg.getRateLimitPerMin());
        if (cfg.getMatchers() != null) {
            for (AlertRouterProperties.MatcherConfig m : cfg.getMatchers()) {
                b.matcher(compileMatcher(m));
            }
        }
        if (cfg.getChat() != null && cfg.getChat().getWebhook() != null && !cfg.getChat().getWebhook().isBlank()) {
            b.chat(Destination.chat(cfg.getChat().getWebhook(), cfg.getChat().getChannel()));
        }
        if (cfg.getEmailTo() != null && !cfg.getEmailTo().isEmpty()) {
            b.email(Destination.email(cfg.getEmailTo()));
        }
        return b.build();
    }

    public static LabelMatcher compileMatcher(AlertRouterProperties.MatcherConfig m) {
        if (m.getLabel() == null || m.getLabel().isBlank()) {
            throw new ValidationException("matcher label is required");
        }
        if (m.getRegex() == null) {
            throw new ValidationException("matcher regex is required, label=" + m.getLabel());
        }
        try {
            return new LabelMatcher(m.getLabel(), Pattern.compile(m.getRegex()));
        } catch (PatternSyntaxException e) {
            throw new ValidationException("invalid matcher regex: " + m.getLabel() + "=~" + m.getRegex(), e);
        }
    }

    private static Duration nonNegative(Duration d) {
        return d == null || d.isNegative() ? Duration.ZERO : d;
    }
}
