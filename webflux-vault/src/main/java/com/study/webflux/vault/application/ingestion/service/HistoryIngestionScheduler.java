package com.study.webflux.vault.application.ingestion.service;

import java.util.List;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.ingestion.model.IngestionOutcome;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 주기적으로 모든 데이터셋을 순서대로 수집합니다.
 *
 * <p>
 * 한 사이클이 끝날 때까지 스케줄러 스레드가 기다리므로 사이클이 길어지면 다음 실행이 밀릴 뿐 겹치지 않습니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "vault.ingestion.enabled", havingValue = "true", matchIfMissing = true)
public class HistoryIngestionScheduler {

	private final HistoryIngestionPump ingestionPump;

	@Scheduled(
		fixedRateString = "${vault.ingestion.period:PT1H}",
		initialDelayString = "${vault.ingestion.initial-delay:PT30S}")
	public void runCycle() {
		log.info("히스토리 수집 사이클 시작: datasets={}", HistoryDataset.values().length);
		List<IngestionOutcome> outcomes = Flux.fromArray(HistoryDataset.values())
			.concatMap(ingestionPump::ingest)
			.doOnNext(this::logOutcome)
			.collectList()
			.doOnError(error -> log.error("히스토리 수집 사이클 실패: {}", error.getMessage(), error))
			.onErrorResume(error -> Mono.just(List.of()))
			.block();

		long failed = outcomes == null ? 0 : outcomes.stream().filter(IngestionOutcome::isFailed).count();
		log.info("히스토리 수집 사이클 종료: completed={}, failed={}",
			outcomes == null ? 0 : outcomes.size(),
			failed);
	}

	private void logOutcome(IngestionOutcome outcome) {
		if (outcome.isFailed()) {
			log.warn("[{}] 수집 실패 pages={}, cursor={}, 이유={}", outcome.dataset(),
				outcome.pagesStored(), outcome.cursor(), outcome.reason());
			return;
		}
		log.info("[{}] 수집 완료 pages={}, cursor={}, 사유={}", outcome.dataset(), outcome.pagesStored(),
			outcome.cursor(), outcome.reason());
	}
}
