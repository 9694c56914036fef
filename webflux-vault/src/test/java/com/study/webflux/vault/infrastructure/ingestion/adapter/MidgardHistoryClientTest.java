package com.study.webflux.vault.infrastructure.ingestion.adapter;

import java.net.URI;
import java.time.Duration;

import org.springframework.http.HttpStatus;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.http.server.reactive.HttpHandler;
import org.springframework.http.server.reactive.ReactorHttpHandlerAdapter;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.util.UriComponentsBuilder;

import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.ingestion.exception.HistorySourceException;
import com.study.webflux.vault.fixture.MidgardResponseFixture;
import com.study.webflux.vault.infrastructure.common.config.properties.VaultProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;

class MidgardHistoryClientTest {

	private FakeMidgardServer fakeServer;
	private DisposableServer server;
	private VaultProperties properties;

	@BeforeEach
	void setUp() {
		fakeServer = new FakeMidgardServer();
		HttpHandler httpHandler = RouterFunctions.toHttpHandler(fakeServer.routes());
		server = HttpServer.create().port(0).handle(new ReactorHttpHandlerAdapter(httpHandler)).bindNow();

		properties = new VaultProperties();
		properties.getMidgard().setBaseUrl("http://localhost:" + server.port() + "/v2/history/");
		properties.getMidgard().setTimeout(Duration.ofSeconds(5));
	}

	@AfterEach
	void tearDown() {
		if (server != null) {
			server.disposeNow();
		}
	}

	@Test
	@DisplayName("데이터셋 경로와 interval, count, from 파라미터로 요청한다")
	void fetch_requestsDatasetPathWithPagingParams() {
		String body = MidgardResponseFixture.depth(3_600, 7_200);
		fakeServer.respond(HttpStatus.OK, body);

		StepVerifier.create(client().fetch(HistoryDataset.DEPTH, 3_600))
			.assertNext(response -> assertThat(response).contains("\"assetDepth\": \"1500\""))
			.verifyComplete();

		assertThat(fakeServer.requests()).hasSize(1);
		URI request = fakeServer.requests().get(0);
		assertThat(request.getPath()).isEqualTo("/v2/history/depths/BTC.BTC");
		var query = UriComponentsBuilder.fromUri(request).build().getQueryParams();
		assertThat(query.getFirst("interval")).isEqualTo("hour");
		assertThat(query.getFirst("count")).isEqualTo("400");
		assertThat(query.getFirst("from")).isEqualTo("3600");
	}

	@Test
	@DisplayName("풀이 없는 데이터셋은 경로에 풀을 붙이지 않는다")
	void fetch_usesPlainPathForOtherDatasets() {
		fakeServer.respond(HttpStatus.OK, MidgardResponseFixture.emptyIntervals(0, 3_600));

		StepVerifier.create(client().fetch(HistoryDataset.RUNE_POOL, 0))
			.expectNextCount(1)
			.verifyComplete();

		assertThat(fakeServer.requests().get(0).getPath()).isEqualTo("/v2/history/runepool");
	}

	@Test
	@DisplayName("2xx가 아닌 응답은 상태 코드를 담은 HistorySourceException으로 바뀐다")
	void fetch_mapsErrorStatus() {
		fakeServer.respond(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\": \"db down\"}");

		StepVerifier.create(client().fetch(HistoryDataset.SWAPS, 0))
			.expectErrorSatisfies(error -> assertThat(error)
				.isInstanceOf(HistorySourceException.class)
				.hasMessageContaining("status=500")
				.hasMessageContaining("db down"))
			.verify();
	}

	@Test
	@DisplayName("본문이 없는 성공 응답도 실패로 본다")
	void fetch_rejectsEmptyBody() {
		fakeServer.respond(HttpStatus.OK, "");

		StepVerifier.create(client().fetch(HistoryDataset.EARNINGS, 0))
			.expectError(HistorySourceException.class)
			.verify();
	}

	@Test
	@DisplayName("타임아웃을 넘기면 HistorySourceException으로 끝난다")
	void fetch_timesOut() {
		properties.getMidgard().setTimeout(Duration.ofMillis(200));
		fakeServer.respond(HttpStatus.OK, MidgardResponseFixture.emptyIntervals(0, 3_600));
		fakeServer.delay(Duration.ofSeconds(2));

		StepVerifier.create(client().fetch(HistoryDataset.DEPTH, 0))
			.expectErrorSatisfies(error -> assertThat(error)
				.isInstanceOf(HistorySourceException.class)
				.hasMessageContaining("시간 초과"))
			.verify(Duration.ofSeconds(5));
	}

	@Test
	@DisplayName("연결할 수 없는 주소도 HistorySourceException으로 바뀐다")
	void fetch_mapsConnectionFailure() {
		int port = server.port();
		server.disposeNow();
		server = null;
		properties.getMidgard().setBaseUrl("http://localhost:" + port + "/v2/history");

		StepVerifier.create(client().fetch(HistoryDataset.DEPTH, 0))
			.expectError(HistorySourceException.class)
			.verify(Duration.ofSeconds(10));
	}

	private MidgardHistoryClient client() {
		WebClient.Builder builder = WebClient.builder()
			.clientConnector(new ReactorClientHttpConnector());
		return new MidgardHistoryClient(builder, properties);
	}
}
