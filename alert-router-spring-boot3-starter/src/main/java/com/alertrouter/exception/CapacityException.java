package com.alertrouter.exception;

/**
 * 路由队列已满, 告警被丢弃, 生产方不阻塞
 */
public class CapacityException extends RuntimeException {

    private final String route;

    public CapacityException(String route, int capacity) {
        super("route queue full, route=" + route + ", capacity=" + capacity);
        this.route = route;
    }

    public String getRoute() {
        return route;
    }
}
