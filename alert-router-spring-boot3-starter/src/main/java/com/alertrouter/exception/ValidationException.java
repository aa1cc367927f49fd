package com.alertrouter.exception;

/**
 * 静默/匹配器不合法 (缺字段、正则错误)
 * 创建或加载时拒绝, 不影响运行中的系统
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
