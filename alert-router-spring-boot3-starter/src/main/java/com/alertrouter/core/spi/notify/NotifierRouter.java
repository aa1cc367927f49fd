package com.alertrouter.core.spi.notify;

import com.alertrouter.model.Destination;

/**
 * 路由：根据目的地 → 选择 Notifier
 */
public interface NotifierRouter {

    Notifier route(Destination destination);
}
