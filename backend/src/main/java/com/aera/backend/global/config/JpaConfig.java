package com.aera.backend.global.config;

import com.aera.backend.global.common.time.TimeConfig;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

@Configuration
@EnableJpaRepositories(basePackages = "com.aera.backend.modules")
@EnableJpaAuditing(dateTimeProviderRef = TimeConfig.AUDITING_DATE_TIME_PROVIDER)
public class JpaConfig {
}
