package com.alertrouter.exception;

/**
 * 目的地发送失败
 * 记录到 DLQ, 不自动重试
 */
public class TransientDeliveryException extends RuntimeException {

    private final String destination;

    public TransientDeliveryException(String destination, Throwable cause) {
        super("delivery to " + destination + " failed: " + describe(cause), cause);
        this.destination = destination;
    }

    public String getDestination() {
        return destination;
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown";
        }
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }
}
