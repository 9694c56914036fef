package com.study.webflux.vault.infrastructure.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;

@Configuration
public class OpenApiConfiguration {

	@Bean
	public OpenAPI openAPI() {
		return new OpenAPI()
			.info(new Info()
				.title("Midgard Vault API")
				.description("Bucketed THORChain history served from locally ingested Midgard snapshots")
				.version("1.0.0"));
	}
}
