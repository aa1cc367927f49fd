package com.alertrouter.core.dlq;

import com.alertrouter.core.metric.AlertRouterMetrics;
import com.alertrouter.core.spi.PayloadSerializer;
import com.alertrouter.core.spi.StateStore;
import com.alertrouter.exception.StoreException;
import com.alertrouter.model.DlqRecord;
import com.alertrouter.model.enums.StateNamespace;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 死信记录, 每次调用追加一条, 不修改不重放
 */
public class DeadLetterRecorder {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterRecorder.class);

    private static final int MAX_ERROR_LEN = 4000;

    private static final TypeReference<DlqRecord> RECORD_TYPE = new TypeReference<>() {};

    private final StateStore store;

    private final PayloadSerializer serializer;

    private final AlertRouterMetrics metrics;

    public DeadLetterRecorder(StateStore store, PayloadSerializer serializer, AlertRouterMetrics metrics) {
        this.store = store;
        this.serializer = serializer;
        this.metrics = metrics;
    }

    /**
     * 写入失败只记录日志与指标, 不向 worker 抛出
     * @return 是否写入成功
     */
    public boolean record(String route, String destination, String payload, String error, Instant now) {
        DlqRecord rec = DlqRecord.builder()
                .when(now)
                .route(route)
                .destination(destination)
                .payload(payload)
                .error(truncate(error))
                .build();
        // 毫秒前缀保证 scan 按时间有序
        String key = String.format("%013d-%s", now.toEpochMilli(), UUID.randomUUID());
        try {
            store.set(StateNamespace.DLQ, key, serializer.serialize(rec));
        } catch (StoreException e) {
            metrics.incStoreErr();
            log.error("[DLQ] failed to persist record route={}, dest={}, error={}", route, destination, error, e);
            return false;
        }
        metrics.incDlq();
        log.warn("[DLQ] recorded route={}, dest={}, key={}", route, destination, key);
        return true;
    }

    /**
     * 按写入时间顺序返回全部记录
     */
    public List<DlqRecord> list() {
        List<DlqRecord> out = new ArrayList<>();
        store.scan(StateNamespace.DLQ).values()
                .forEach(json -> out.add(serializer.deserialize(json, RECORD_TYPE)));
        return out;
    }

    private static String truncate(String s) {
        if (s == null) return null;
        return s.length() > MAX_ERROR_LEN ? s.substring(0, MAX_ERROR_LEN) : s;
    }
}
