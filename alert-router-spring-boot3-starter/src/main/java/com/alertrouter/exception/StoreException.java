package com.alertrouter.exception;

/**
 * 状态存储未能确认读写
 * 接入侧对该 告警/路由 失败关闭
 */
public class StoreException extends RuntimeException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
