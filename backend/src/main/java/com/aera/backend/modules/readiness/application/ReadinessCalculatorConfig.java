package com.aera.backend.modules.readiness.application;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ReadinessCalculatorConfig {

    @Bean
    @ConditionalOnMissingBean(ReadinessCalculator.class)
    public ReadinessCalculator unscoredReadinessCalculator() {
        return input -> ReadinessResult.unscored();
    }
}
