package com.perseverance.autoconfig;

import com.perseverance.core.metric.RetryMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

@AutoConfiguration
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnProperty(prefix = "perseverance.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
public class PerseveranceMetricsAutoConfiguration {

    /**
     * 接入容器中已有的 MeterRegistry（如 actuator 提供的）
     */
    @Bean
    public RetryMetrics retryMetrics(ObjectProvider<MeterRegistry> discovered) {
        return RetryMetrics.create(discovered.orderedStream().collect(Collectors.toList()));
    }
}
