package com.alertrouter.core.notify.notifier;

import com.alertrouter.core.spi.notify.Notifier;
import com.alertrouter.model.Destination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知, 兜底渠道
 */
public class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void send(Destination destination, String text) {
        log.info("[Notify-log] dest={}, target={}, text={}", destination.name(), target(destination), truncate(text));
    }

    private String target(Destination d) {
        if (d.getChannel() != null) return d.getChannel();
        if (d.getRecipients() != null) return String.join(",", d.getRecipients());
        return d.getWebhook();
    }

    private String truncate(String s) {
        return s == null ? null : (s.length() > 2000 ? s.substring(0, 2000) : s);
    }
}
