package com.study.webflux.vault.infrastructure.common.config;

import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.config.CorsRegistry;
import org.springframework.web.reactive.config.WebFluxConfigurer;

/** 히스토리 조회 API는 읽기 전용이므로 GET과 preflight만 허용합니다. */
@Configuration
public class WebFluxCorsConfiguration implements WebFluxConfigurer {

	private final List<String> allowedOrigins;

	public WebFluxCorsConfiguration(
		@Value("${web.cors.allowed-origins:}") List<String> allowedOrigins) {
		this.allowedOrigins = allowedOrigins.stream().map(String::trim)
			.filter(origin -> !origin.isBlank()).toList();
	}

	@Override
	public void addCorsMappings(CorsRegistry registry) {
		if (allowedOrigins.isEmpty()) {
			return;
		}

		registry.addMapping("/api/**")
			.allowedOrigins(allowedOrigins.toArray(String[]::new))
			.allowedMethods("GET", "OPTIONS")
			.allowedHeaders("*")
			.maxAge(3600);
	}
}
