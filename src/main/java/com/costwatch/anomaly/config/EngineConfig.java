package com.costwatch.anomaly.config;

import com.costwatch.anomaly.engine.AnomalyEngine;
import com.costwatch.anomaly.engine.CheckRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
public class EngineConfig {

    @Bean
    public AnomalyEngine anomalyEngine(CheckRegistry checkRegistry, AnomalyProperties properties) {
        return new AnomalyEngine(checkRegistry, properties.toSettings());
    }

    @Bean
    public Clock clock(AnomalyProperties properties) {
        return Clock.system(ZoneId.of(properties.getAlertZone()));
    }
}
