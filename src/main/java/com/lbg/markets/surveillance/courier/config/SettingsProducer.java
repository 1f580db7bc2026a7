package com.lbg.markets.surveillance.courier.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

@ApplicationScoped
public class SettingsProducer {

    @Produces
    @Singleton
    PipelineSettings pipelineSettings(CourierConfig config) {
        return PipelineSettings.from(config);
    }
}
