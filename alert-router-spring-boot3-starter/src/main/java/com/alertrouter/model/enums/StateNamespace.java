package com.alertrouter.model.enums;

/**
 * 状态存储的逻辑命名空间
 */
public enum StateNamespace {

    /** fingerprint -> 最近一次放行时间(epoch ms) */
    DEDUPE("dedupe"),

    /** silence id -> json */
    SILENCE("silence"),

    /** route:minute -> count */
    RATE("rate"),

    /** 时间有序key -> json */
    DLQ("dlq");

    private final String code;

    StateNamespace(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
