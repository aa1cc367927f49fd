package com.alertrouter.autoconfig;

import com.alertrouter.core.metric.AlertRouterMeterRegistryProvider;
import com.alertrouter.core.metric.AlertRouterMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(afterName = {
        "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration"
})
public class AlertRouterMetricsAutoConfiguration {

    @Bean
    public AlertRouterMeterRegistryProvider alertRouterMeterRegistryProvider(
            ObjectProvider<MeterRegistry> discovered) {
        return new AlertRouterMeterRegistryProvider(discovered.orderedStream().toList());
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertRouterMetrics alertRouterMetrics(AlertRouterMeterRegistryProvider provider) {
        return AlertRouterMetrics.create(provider.getRegistry());
    }
}
