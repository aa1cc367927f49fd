package com.alertrouter.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * 告警事件
 * 仅在一次路由过程及路由内存批次中存在, 不单独持久化
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    /** 标签 决定指纹 */
    @Builder.Default
    private Map<String, String> labels = new HashMap<>();

    /** 注解 不参与指纹 */
    @Builder.Default
    private Map<String, String> annotations = new HashMap<>();

    private Instant startsAt;

    /** 可为空 */
    private Instant endsAt;

    /** 来源链接 */
    private String generatorUrl;

    /** 为空时由 Fingerprinter 计算 */
    private String fingerprint;

    public String label(String name) {
        return labels == null ? null : labels.get(name);
    }

    public String annotation(String name) {
        return annotations == null ? null : annotations.get(name);
    }
}
