package com.alertrouter.core.dedup;

import com.alertrouter.core.spi.StateStore;
import com.alertrouter.exception.StoreException;
import com.alertrouter.model.enums.StateNamespace;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 按指纹去重, 状态在所有路由间共享
 * 窗口只以最近一次放行时间计算, 被抑制的重复不会刷新记录
 */
public class DedupEngine {

    /** 并发覆盖时的最大重读次数 */
    private static final int MAX_CAS_ATTEMPTS = 8;

    private final StateStore store;

    public DedupEngine(StateStore store) {
        this.store = store;
    }

    /**
     * 无记录或记录早于 now - window 时放行
     */
    public boolean shouldSuppress(String fingerprint, Duration window, Instant now) {
        return suppressed(fingerprint, readRaw(fingerprint), window, now);
    }

    /**
     * 记录放行时间, 不会回退
     */
    public void markSeen(String fingerprint, Instant now) {
        Optional<Instant> last = lastSeen(fingerprint);
        if (last.isPresent() && last.get().isAfter(now)) {
            return;
        }
        store.set(StateNamespace.DEDUPE, fingerprint, Long.toString(now.toEpochMilli()));
    }

    /**
     * 判定与记录合为一次条件写入
     * 同一指纹并发提交时只有一个能放行
     * @return true 放行并已记录, false 抑制
     */
    public boolean tryAdmit(String fingerprint, Duration window, Instant now) {
        String next = Long.toString(now.toEpochMilli());
        for (int i = 0; i < MAX_CAS_ATTEMPTS; i++) {
            Optional<String> raw = readRaw(fingerprint);
            if (suppressed(fingerprint, raw, window, now)) {
                return false;
            }
            if (store.compareAndSet(StateNamespace.DEDUPE, fingerprint, raw.orElse(null), next)) {
                return true;
            }
        }
        // 一直被其他写入抢先, 说明同一指纹刚被放行
        return false;
    }

    public Optional<Instant> lastSeen(String fingerprint) {
        return readRaw(fingerprint).map(v -> parse(fingerprint, v));
    }

    private Optional<String> readRaw(String fingerprint) {
        return store.get(StateNamespace.DEDUPE, fingerprint);
    }

    private static boolean suppressed(String fingerprint, Optional<String> raw, Duration window, Instant now) {
        return raw.isPresent() && parse(fingerprint, raw.get()).plus(window).isAfter(now);
    }

    private static Instant parse(String fingerprint, String value) {
        try {
            return Instant.ofEpochMilli(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new StoreException("corrupt dedupe record, fp=" + fingerprint + ", value=" + value, e);
        }
    }
}
