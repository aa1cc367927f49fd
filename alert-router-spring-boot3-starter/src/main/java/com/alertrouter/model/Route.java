package com.alertrouter.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 路由, 启动时由配置编译, 进程生命周期内不可变
 */
@Value
@Builder
public class Route {

    String name;

    @Singular
    List<LabelMatcher> matchers;

    Duration dedupeWindow;

    Duration groupWindow;

    /** <=0 不限流 */
    int rateLimitPerMin;

    /** 可为空 */
    Destination chat;

    /** 可为空 */
    Destination email;

    /**
     * 全部匹配器满足才算命中
     */
    public boolean matches(Map<String, String> labels) {
        for (LabelMatcher m : matchers) {
            if (!m.matches(labels)) {
                return false;
            }
        }
        return true;
    }

    public boolean hasChat() {
        return chat != null;
    }

    public boolean hasEmail() {
        return email != null;
    }
}
