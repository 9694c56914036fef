package com.study.webflux.vault.application.ingestion.service;

import java.time.Clock;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.vault.domain.history.model.HistoryBatch;
import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.history.port.SeriesStore;
import com.study.webflux.vault.domain.ingestion.model.IngestionOutcome;
import com.study.webflux.vault.domain.ingestion.model.IngestionState;
import com.study.webflux.vault.domain.ingestion.port.HistoryBatchDecoder;
import com.study.webflux.vault.domain.ingestion.port.HistorySourcePort;
import com.study.webflux.vault.infrastructure.common.config.properties.VaultProperties;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import reactor.core.publisher.Mono;

/**
 * 데이터셋 하나를 체크포인트부터 현재 시각까지 페이지 단위로 수집하는 상태 머신입니다.
 *
 * <p>
 * {@code FETCHING → PARSING → STORING → ADVANCING}을 반복하며, 응답의 {@code meta.endTime}이 커서보다 클 때만 다음 페이지로
 * 넘어갑니다. 요청, 해석, 저장 중 하나라도 실패하면 커서를 옮기지 않고 FAILED로 끝나며 다음 사이클이 저장소의 체크포인트부터 다시
 * 시작합니다.
 */
@Slf4j
@Service
public class HistoryIngestionPump {

	static final String REASON_CAUGHT_UP = "caught-up";
	static final String REASON_EMPTY_PAGE = "empty-page";
	static final String REASON_NON_ADVANCING = "non-advancing-marker";
	static final String REASON_PAGE_LIMIT = "page-limit";

	private final CheckpointResolver checkpointResolver;
	private final HistorySourcePort historySource;
	private final HistoryBatchDecoder batchDecoder;
	private final SeriesStore seriesStore;
	private final VaultProperties properties;
	private final MeterRegistry meterRegistry;
	private final Clock clock;

	public HistoryIngestionPump(CheckpointResolver checkpointResolver,
		HistorySourcePort historySource,
		HistoryBatchDecoder batchDecoder,
		SeriesStore seriesStore,
		VaultProperties properties,
		MeterRegistry meterRegistry,
		Clock clock) {
		this.checkpointResolver = checkpointResolver;
		this.historySource = historySource;
		this.batchDecoder = batchDecoder;
		this.seriesStore = seriesStore;
		this.properties = properties;
		this.meterRegistry = meterRegistry;
		this.clock = clock;
	}

	public Mono<IngestionOutcome> ingest(HistoryDataset dataset) {
		return checkpointResolver.resolve(dataset)
			.doOnNext(cursor -> log.debug("[{}] {} 커서 확정: {}", dataset, IngestionState.IDLE, cursor))
			.flatMap(cursor -> fetchFrom(dataset, cursor, 0))
			.onErrorResume(error -> {
				log.error("[{}] 체크포인트 조회 실패: {}", dataset, error.getMessage(), error);
				return Mono.just(IngestionOutcome.failed(dataset, 0, -1L, error.getMessage()));
			})
			.doOnNext(this::recordOutcome);
	}

	private Mono<IngestionOutcome> fetchFrom(HistoryDataset dataset, long cursor, int pagesStored) {
		long now = clock.instant().getEpochSecond();
		if (cursor >= now) {
			return Mono.just(IngestionOutcome.done(dataset, pagesStored, cursor, REASON_CAUGHT_UP));
		}
		if (pagesStored >= properties.getIngestion().getMaxPagesPerCycle()) {
			log.info("[{}] 사이클당 최대 페이지 수에 도달했습니다. pages={}, cursor={}", dataset, pagesStored,
				cursor);
			return Mono.just(IngestionOutcome.done(dataset, pagesStored, cursor, REASON_PAGE_LIMIT));
		}

		log.debug("[{}] {} from={}", dataset, IngestionState.FETCHING, cursor);
		return historySource.fetch(dataset, cursor)
			.map(body -> decode(dataset, body))
			.flatMap(batch -> store(dataset, batch))
			.map(Optional::of)
			.defaultIfEmpty(Optional.empty())
			.flatMap(stored -> stored
				.map(batch -> advance(dataset, cursor, pagesStored + 1, batch))
				.orElseGet(() -> Mono.just(
					IngestionOutcome.done(dataset, pagesStored, cursor, REASON_EMPTY_PAGE))))
			.onErrorResume(error -> {
				log.error("[{}] {} cursor={}, 이유={}", dataset, IngestionState.FAILED, cursor,
					error.getMessage(), error);
				return Mono.just(IngestionOutcome.failed(dataset, pagesStored, cursor, error.getMessage()));
			});
	}

	private HistoryBatch decode(HistoryDataset dataset, String body) {
		log.debug("[{}] {} {} bytes", dataset, IngestionState.PARSING, body.length());
		return batchDecoder.decode(dataset, body);
	}

	/** 구간이 없는 응답은 저장하지 않고 빈 값으로 끝냅니다. */
	private Mono<HistoryBatch> store(HistoryDataset dataset, HistoryBatch batch) {
		if (batch.isEmpty()) {
			log.debug("[{}] 구간이 없는 응답이라 저장하지 않습니다. meta.endTime={}", dataset,
				batch.meta().endTime());
			return Mono.empty();
		}
		log.debug("[{}] {} intervals={}", dataset, IngestionState.STORING, batch.intervals().size());
		return seriesStore.insertBatch(batch)
			.doOnNext(stored -> pagesCounter(dataset).increment());
	}

	private Mono<IngestionOutcome> advance(HistoryDataset dataset, long cursor, int pagesStored,
		HistoryBatch stored) {
		long marker = stored.meta().endTime();
		log.debug("[{}] {} {} -> {}", dataset, IngestionState.ADVANCING, cursor, marker);
		if (marker <= cursor) {
			log.warn("[{}] meta.endTime이 커서보다 크지 않아 수집을 멈춥니다. cursor={}, endTime={}", dataset,
				cursor, marker);
			return Mono.just(IngestionOutcome.done(dataset, pagesStored, cursor, REASON_NON_ADVANCING));
		}
		return Mono.defer(() -> fetchFrom(dataset, marker, pagesStored));
	}

	private Counter pagesCounter(HistoryDataset dataset) {
		return Counter.builder("vault.ingestion.pages")
			.tag("dataset", dataset.collectionName())
			.description("저장된 업스트림 응답 수")
			.register(meterRegistry);
	}

	private void recordOutcome(IngestionOutcome outcome) {
		Counter.builder("vault.ingestion.runs")
			.tag("dataset", outcome.dataset().collectionName())
			.tag("outcome", outcome.state().name().toLowerCase())
			.description("데이터셋별 수집 실행 결과")
			.register(meterRegistry)
			.increment();
	}
}
