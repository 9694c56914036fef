package com.study.webflux.vault.infrastructure.common.config.properties;

import java.time.Duration;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/** {@code vault.*} 설정을 바인딩합니다. */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "vault")
public class VaultProperties {

	@Valid
	private Midgard midgard = new Midgard();

	@Valid
	private Ingestion ingestion = new Ingestion();

	@Valid
	private Store store = new Store();

	@Valid
	private Query query = new Query();

	@Getter
	@Setter
	public static class Midgard {
		@NotBlank
		private String baseUrl = "https://midgard.ninerealms.com/v2/history";

		@NotNull
		private Duration timeout = Duration.ofSeconds(30);

		@Min(1)
		@Max(400)
		private int pageSize = 400;

		/** 업스트림에 요청하는 구간 단위. 조회 시 재집계하므로 가장 잘게 받습니다. */
		@NotBlank
		private String interval = "hour";

		@NotBlank
		private String depthPool = "BTC.BTC";
	}

	@Getter
	@Setter
	public static class Ingestion {
		private boolean enabled = true;

		/** 저장된 데이터가 없을 때 거슬러 올라갈 기간 */
		@NotNull
		private Duration lookback = Duration.ofDays(1);

		@NotNull
		private Duration period = Duration.ofHours(1);

		@NotNull
		private Duration initialDelay = Duration.ofSeconds(30);

		@Min(1)
		private int maxPagesPerCycle = 1000;
	}

	@Getter
	@Setter
	public static class Store {
		/** {@code mongo} 또는 {@code memory} */
		@NotBlank
		private String type = "mongo";

		private boolean createIndexes = true;

		/** 기동 시 인덱스 준비를 기다리는 최대 시간 */
		@NotNull
		private Duration indexTimeout = Duration.ofSeconds(30);
	}

	@Getter
	@Setter
	public static class Query {
		@Min(1)
		private int maxCount = 400;

		@Min(1)
		private int defaultCount = 10;
	}
}
