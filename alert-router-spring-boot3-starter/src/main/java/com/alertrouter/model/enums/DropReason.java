package com.alertrouter.model.enums;

/**
 * 丢弃原因, 每次丢弃只归因一个
 */
public enum DropReason {

    /** 命中静默 */
    SILENCED("silenced"),

    /** 路由限流 */
    RATE_LIMITED("ratelimit"),

    /** 去重窗口内重复 */
    DEDUPED("dedupe"),

    /** 路由队列已满 */
    QUEUE_FULL("queue_full");

    private final String tag;

    DropReason(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
