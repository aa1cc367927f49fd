package com.alertrouter.core.route;

import com.alertrouter.model.Alert;
import com.alertrouter.model.Route;

import java.util.ArrayList;
import java.util.List;

/**
 * 选出告警需要扇出的路由, 保持配置顺序
 */
public class RouteMatcher {

    private final List<Route> routes;

    public RouteMatcher(List<Route> routes) {
        this.routes = List.copyOf(routes);
    }

    public List<Route> matchingRoutes(Alert alert) {
        List<Route> out = new ArrayList<>();
        for (Route r : routes) {
            if (r.matches(alert.getLabels())) {
                out.add(r);
            }
        }
        return out;
    }

    public List<Route> routes() {
        return routes;
    }
}
