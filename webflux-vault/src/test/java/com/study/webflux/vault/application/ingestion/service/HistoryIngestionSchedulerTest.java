package com.study.webflux.vault.application.ingestion.service;

import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.ingestion.model.IngestionOutcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HistoryIngestionSchedulerTest {

	@Mock
	private HistoryIngestionPump ingestionPump;

	@InjectMocks
	private HistoryIngestionScheduler scheduler;

	@Test
	@DisplayName("한 사이클에서 네 데이터셋을 정해진 순서로 수집한다")
	void runCycle_ingestsEveryDatasetInOrder() {
		when(ingestionPump.ingest(any(HistoryDataset.class)))
			.thenAnswer(invocation -> Mono.just(
				IngestionOutcome.done(invocation.getArgument(0), 1, 3_600L, "caught-up")));

		scheduler.runCycle();

		InOrder order = inOrder(ingestionPump);
		order.verify(ingestionPump).ingest(HistoryDataset.DEPTH);
		order.verify(ingestionPump).ingest(HistoryDataset.EARNINGS);
		order.verify(ingestionPump).ingest(HistoryDataset.SWAPS);
		order.verify(ingestionPump).ingest(HistoryDataset.RUNE_POOL);
	}

	@Test
	@DisplayName("한 데이터셋이 실패해도 나머지를 계속 수집한다")
	void runCycle_continuesAfterFailedDataset() {
		when(ingestionPump.ingest(any(HistoryDataset.class)))
			.thenAnswer(invocation -> {
				HistoryDataset dataset = invocation.getArgument(0);
				if (dataset == HistoryDataset.EARNINGS) {
					return Mono.just(IngestionOutcome.failed(dataset, 0, 0L, "status=500"));
				}
				return Mono.just(IngestionOutcome.done(dataset, 0, 0L, "caught-up"));
			});

		scheduler.runCycle();

		InOrder order = inOrder(ingestionPump);
		order.verify(ingestionPump).ingest(HistoryDataset.EARNINGS);
		order.verify(ingestionPump).ingest(HistoryDataset.SWAPS);
		order.verify(ingestionPump).ingest(HistoryDataset.RUNE_POOL);
	}

	@Test
	@DisplayName("예상하지 못한 오류가 나도 스케줄러 스레드로 예외를 던지지 않는다")
	void runCycle_doesNotThrowOnUnexpectedError() {
		when(ingestionPump.ingest(any(HistoryDataset.class)))
			.thenReturn(Mono.error(new IllegalStateException("boom")));

		assertThatCode(() -> scheduler.runCycle()).doesNotThrowAnyException();
	}
}
