package com.alertrouter.autoconfig;

import com.alertrouter.config.AlertGuardProperties;
import com.alertrouter.config.AlertNotifierProperties;
import com.alertrouter.core.handler.GuardedNotifierExecutor;
import com.alertrouter.core.notify.notifier.EmailNotifier;
import com.alertrouter.core.notify.notifier.LoggingNotifier;
import com.alertrouter.core.notify.notifier.WebhookNotifier;
import com.alertrouter.core.notify.route.DestinationNotifierRouter;
import com.alertrouter.core.spi.notify.Notifier;
import com.alertrouter.core.spi.notify.NotifierRouter;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import java.net.http.HttpClient;

@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration",
        "org.springframework.boot.autoconfigure.mail.MailSenderAutoConfiguration"
})
@EnableConfigurationProperties({
        AlertNotifierProperties.class,
        AlertGuardProperties.class
})
public class AlertRouterNotifierAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "loggingNotifier")
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }

    @Bean
    @ConditionalOnMissingBean(name = "webhookNotifier")
    public Notifier webhookNotifier(AlertNotifierProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        AlertNotifierProperties.Webhook cfg = props.getWebhook();
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(cfg.getTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new WebhookNotifier(client, objectMapper.getIfAvailable(ObjectMapper::new), cfg.getTimeout());
    }

    @Bean
    @ConditionalOnMissingBean(NotifierRouter.class)
    public NotifierRouter notifierRouter(ObjectProvider<Notifier> notifiers,
                                         @Qualifier("loggingNotifier") Notifier logging) {
        return new DestinationNotifierRouter(notifiers.orderedStream().toList(), logging);
    }

    /**
     * notifier 统一发送入口
     */
    @Bean
    @ConditionalOnMissingBean
    public GuardedNotifierExecutor guardedNotifierExecutor(AlertGuardProperties props) {
        return new GuardedNotifierExecutor(props);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(JavaMailSender.class)
    @ConditionalOnBean(JavaMailSender.class)
    static class EmailNotifierConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "emailNotifier")
        public Notifier emailNotifier(JavaMailSender mailSender, AlertNotifierProperties props) {
            AlertNotifierProperties.Email cfg = props.getEmail();
            return new EmailNotifier(mailSender, cfg.getFrom(), cfg.getSubjectPrefix());
        }
    }
}
