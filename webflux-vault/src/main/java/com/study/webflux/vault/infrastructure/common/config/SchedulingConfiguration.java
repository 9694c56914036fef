package com.study.webflux.vault.infrastructure.common.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/** 수집이 켜져 있을 때만 스케줄링을 활성화합니다. */
@Configuration
@EnableScheduling
@ConditionalOnProperty(name = "vault.ingestion.enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConfiguration {
}
