package com.study.webflux.vault.application.history;

import java.time.Clock;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.study.webflux.vault.application.ingestion.service.HistoryIngestionPump;
import com.study.webflux.vault.config.annotation.InMemoryApplicationTest;
import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.history.model.HistoryInterval;
import com.study.webflux.vault.domain.history.port.SeriesStore;
import com.study.webflux.vault.domain.ingestion.model.IngestionState;
import com.study.webflux.vault.domain.ingestion.port.HistorySourcePort;
import com.study.webflux.vault.fixture.HistoryBatchFixture;
import com.study.webflux.vault.fixture.IntervalSampleFixture;
import com.study.webflux.vault.fixture.MidgardResponseFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@InMemoryApplicationTest
class HistoryApiIntegrationTest {

	private static final long DAY = 86_400L;

	@Autowired
	private WebTestClient webTestClient;

	@Autowired
	private SeriesStore seriesStore;

	@Autowired
	private HistoryIngestionPump ingestionPump;

	@Autowired
	private Clock clock;

	@MockitoBean
	private HistorySourcePort historySource;

	@Test
	@DisplayName("저장된 시간 단위 구간을 일 단위로 묶어 응답한다")
	void getSwapsHistory_groupsStoredSamplesByDay() {
		StepVerifier.create(seriesStore.insertBatch(HistoryBatchFixture.of(HistoryDataset.SWAPS,
			IntervalSampleFixture.swaps(0, 2, 100),
			IntervalSampleFixture.swaps(IntervalSampleFixture.HOUR, 3, 50),
			IntervalSampleFixture.swaps(DAY, 7, 10))))
			.expectNextCount(1)
			.verifyComplete();

		webTestClient.get()
			.uri("/api/swaps-history?interval=day&from=0&to={to}", 2 * DAY)
			.exchange()
			.expectStatus().isOk()
			.expectBody()
			.jsonPath("$.intervals.length()").isEqualTo(2)
			.jsonPath("$.intervals[0].startTime").isEqualTo(0)
			.jsonPath("$.intervals[0].totalCount").isEqualTo(5)
			.jsonPath("$.intervals[0].totalVolume").isEqualTo(150.0)
			.jsonPath("$.intervals[1].totalCount").isEqualTo(7);
	}

	@Test
	@DisplayName("수집한 Midgard 응답을 API로 다시 조회할 수 있다")
	void ingestedDepthHistory_isQueryable() {
		when(historySource.fetch(eq(HistoryDataset.DEPTH), anyLong()))
			.thenAnswer(invocation -> {
				long from = invocation.getArgument(1);
				return Mono.just(MidgardResponseFixture.depth(from, from + 2 * DAY));
			});
		long expectedStart = HistoryInterval.alignDown(clock.instant().getEpochSecond() - DAY,
			IntervalSampleFixture.HOUR);

		StepVerifier.create(ingestionPump.ingest(HistoryDataset.DEPTH))
			.assertNext(outcome -> {
				assertThat(outcome.state()).isEqualTo(IngestionState.DONE);
				assertThat(outcome.pagesStored()).isEqualTo(1);
			})
			.verifyComplete();

		webTestClient.get()
			.uri("/api/depth-history?interval=hour&from=0")
			.exchange()
			.expectStatus().isOk()
			.expectBody()
			.jsonPath("$.intervals.length()").isEqualTo(1)
			.jsonPath("$.intervals[0].startTime").isEqualTo(expectedStart)
			.jsonPath("$.intervals[0].assetDepth").isEqualTo(1500.0)
			.jsonPath("$.intervals[0].membersCount").isEqualTo(12);
	}

	@Test
	@DisplayName("허용된 Origin의 preflight 요청에 CORS 헤더를 돌려준다")
	void preflight_allowsConfiguredOrigin() {
		webTestClient.method(HttpMethod.OPTIONS)
			.uri("http://localhost/api/earnings-history")
			.header(HttpHeaders.ORIGIN, "http://localhost:3000")
			.header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET")
			.exchange()
			.expectStatus().isOk()
			.expectHeader().valueEquals(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "http://localhost:3000");
	}

	@Test
	@DisplayName("OpenAPI 문서에 히스토리 조회 경로가 노출된다")
	void apiDocs_exposeHistoryEndpoint() {
		webTestClient.get()
			.uri("/v3/api-docs")
			.exchange()
			.expectStatus().isOk()
			.expectBody(String.class)
			.value(body -> assertThat(body).contains("Midgard Vault API").contains("/api/"));
	}
}
