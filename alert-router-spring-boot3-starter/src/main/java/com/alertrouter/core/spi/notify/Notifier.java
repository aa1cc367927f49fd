package com.alertrouter.core.spi.notify;

import com.alertrouter.model.Destination;

/**
 * 通知发送器, 传输层的唯一契约
 * 超时由实现自身在传输边界保证
 */
public interface Notifier {

    /**
     * 渠道名称, 用于路由日志与指标纬度
     */
    String name();

    /**
     * 能否处理此目的地
     */
    default boolean supports(Destination destination) {
        return true;
    }

    /**
     * 同步发送, 失败抛出异常
     */
    void send(Destination destination, String text) throws Exception;
}
