package com.alertrouter.core.ratelimit;

import com.alertrouter.core.spi.StateStore;
import com.alertrouter.model.Route;
import com.alertrouter.model.enums.StateNamespace;

import java.time.Instant;

/**
 * 路由级固定窗口限流
 * key = route:floor(now/60s), 计数保存在 StateStore 的 rate 命名空间
 * 窗口边界处允许两次突发, 旧窗口不清理
 */
public class RouteRateLimiter {

    private static final long BUCKET_SECONDS = 60;

    private final StateStore store;

    public RouteRateLimiter(StateStore store) {
        this.store = store;
    }

    /**
     * 原子自增当前窗口计数, 用自增前的值与上限比较
     * @throws com.alertrouter.exception.StoreException 存储失败, 调用方需失败关闭
     */
    public boolean admit(Route route, Instant now) {
        int limit = route.getRateLimitPerMin();
        if (limit <= 0) {
            return true;
        }
        long after = store.increment(StateNamespace.RATE, bucketKey(route.getName(), now));
        return after - 1 < limit;
    }

    static String bucketKey(String route, Instant now) {
        return route + ":" + Math.floorDiv(now.getEpochSecond(), BUCKET_SECONDS);
    }
}
