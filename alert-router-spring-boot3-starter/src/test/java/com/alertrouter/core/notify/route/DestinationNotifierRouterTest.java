package com.alertrouter.core.notify.route;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.alertrouter.core.notify.notifier.EmailNotifier;
import com.alertrouter.core.notify.notifier.LoggingNotifier;
import com.alertrouter.core.notify.notifier.WebhookNotifier;
import com.alertrouter.model.Destination;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.mail.javamail.JavaMailSender;

class DestinationNotifierRouterTest {

    private final LoggingNotifier logging = new LoggingNotifier();
    private final WebhookNotifier webhook = new WebhookNotifier(Duration.ofSeconds(1));
    private final EmailNotifier email = new EmailNotifier(mock(JavaMailSender.class), "a@example.com", "");

    @Test
    void shouldPickNotifierSupportingDestination() {
        // given
        DestinationNotifierRouter router = new DestinationNotifierRouter(List.of(logging, webhook, email), logging);

        // when/then
        assertThat(router.route(Destination.chat("https://h", "#c"))).isSameAs(webhook);
        assertThat(router.route(Destination.email(List.of("x@example.com")))).isSameAs(email);
    }

    @Test
    void shouldFallBackToLogging() {
        // given
        DestinationNotifierRouter router = new DestinationNotifierRouter(List.of(logging, webhook), logging);

        // when/then
        assertThat(router.route(Destination.email(List.of("x@example.com")))).isSameAs(logging);
    }
}
