package com.alertrouter.core.notify.route;

import com.alertrouter.core.spi.notify.Notifier;
import com.alertrouter.core.spi.notify.NotifierRouter;
import com.alertrouter.model.Destination;

import java.util.List;

/**
 * 按目的地选择第一个支持的 Notifier
 * 都不支持时走 log
 */
public class DestinationNotifierRouter implements NotifierRouter {

    private final List<Notifier> notifiers;

    private final Notifier fallback;

    public DestinationNotifierRouter(List<Notifier> notifiers, Notifier fallback) {
        this.notifiers = notifiers == null ? List.of() : List.copyOf(notifiers);
        this.fallback = fallback;
    }

    @Override
    public Notifier route(Destination destination) {
        for (Notifier n : notifiers) {
            if (n != fallback && n.supports(destination)) {
                return n;
            }
        }
        return fallback;
    }
}
