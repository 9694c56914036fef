package com.study.webflux.vault.infrastructure.ingestion.adapter;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.ingestion.exception.HistorySourceException;
import com.study.webflux.vault.domain.ingestion.port.HistorySourcePort;
import com.study.webflux.vault.infrastructure.common.config.properties.VaultProperties;
import reactor.core.publisher.Mono;

/**
 * Midgard 히스토리 API를 호출해 응답 본문을 그대로 반환하는 어댑터입니다.
 *
 * <p>
 * 전송 오류, 2xx가 아닌 상태, 타임아웃은 모두 {@link HistorySourceException}으로 바꿔 전달합니다.
 */
@Slf4j
@Component
public class MidgardHistoryClient implements HistorySourcePort {

	private final WebClient webClient;
	private final VaultProperties.Midgard midgard;

	public MidgardHistoryClient(WebClient.Builder webClientBuilder, VaultProperties properties) {
		this.midgard = properties.getMidgard();
		this.webClient = webClientBuilder
			.baseUrl(trimTrailingSlash(midgard.getBaseUrl()))
			.build();
	}

	@Override
	public Mono<String> fetch(HistoryDataset dataset, long from) {
		String path = "/" + dataset.upstreamPath(midgard.getDepthPool());
		Duration timeout = midgard.getTimeout();
		log.debug("Midgard 히스토리 요청 - dataset: {}, path: {}, from: {}", dataset, path, from);

		return webClient.get()
			.uri(uriBuilder -> uriBuilder
				.path(path)
				.queryParam("interval", midgard.getInterval())
				.queryParam("count", midgard.getPageSize())
				.queryParam("from", from)
				.build())
			.retrieve()
			.onStatus(status -> !status.is2xxSuccessful(),
				response -> response.bodyToMono(String.class)
					.defaultIfEmpty("")
					.flatMap(body -> Mono.error(new HistorySourceException(
						"Midgard 응답 오류 status=" + response.statusCode().value() + " path=" + path
							+ " body=" + body))))
			.bodyToMono(String.class)
			.switchIfEmpty(Mono.error(new HistorySourceException("Midgard 응답 본문이 비어 있습니다. path=" + path)))
			.timeout(timeout)
			.onErrorMap(error -> !(error instanceof HistorySourceException),
				error -> new HistorySourceException(describe(error, path, timeout), error));
	}

	private String describe(Throwable error, String path, Duration timeout) {
		if (error instanceof TimeoutException) {
			return "Midgard 요청 시간 초과 path=" + path + " timeout=" + timeout;
		}
		return "Midgard 요청 실패 path=" + path + " 이유=" + error.getMessage();
	}

	private String trimTrailingSlash(String url) {
		if (url.endsWith("/")) {
			return url.substring(0, url.length() - 1);
		}
		return url;
	}
}
