package com.study.webflux.vault.infrastructure.history.config;

import java.time.Duration;
import java.util.List;

import org.springframework.data.mongodb.core.ReactiveMongoOperations;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.ReactiveIndexOperations;

import com.study.webflux.vault.infrastructure.common.config.properties.VaultProperties;
import org.bson.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HistoryIndexInitializerTest {

	@Mock
	private ReactiveMongoOperations mongoOperations;

	@Mock
	private ReactiveIndexOperations indexOperations;

	@Test
	@DisplayName("네 컬렉션마다 체크포인트 인덱스와 구간 시작 인덱스를 만든다")
	void run_ensuresIndexesForEveryCollection() {
		when(mongoOperations.indexOps(anyString())).thenReturn(indexOperations);
		when(indexOperations.ensureIndex(any())).thenReturn(Mono.just("idx"));

		new HistoryIndexInitializer(mongoOperations, new VaultProperties()).run(null);

		verify(mongoOperations).indexOps("depth_history");
		verify(mongoOperations).indexOps("earnings_history");
		verify(mongoOperations).indexOps("swaps_history");
		verify(mongoOperations).indexOps("rune_pool_history");

		ArgumentCaptor<Index> captor = ArgumentCaptor.forClass(Index.class);
		verify(indexOperations, times(8)).ensureIndex(captor.capture());
		List<Document> keys = captor.getAllValues().stream().map(Index::getIndexKeys).toList();
		assertThat(keys.get(0)).containsEntry("meta.endTime", -1);
		assertThat(keys.get(1)).containsEntry("intervals.startTime", 1);
	}

	@Test
	@DisplayName("인덱스 생성이 꺼져 있으면 아무것도 하지 않는다")
	void run_skipsWhenDisabled() {
		VaultProperties properties = new VaultProperties();
		properties.getStore().setCreateIndexes(false);

		new HistoryIndexInitializer(mongoOperations, properties).run(null);

		verify(mongoOperations, never()).indexOps(anyString());
	}

	@Test
	@DisplayName("인덱스 생성 실패가 애플리케이션 기동을 막지 않는다")
	void run_doesNotFailStartupOnIndexError() {
		when(mongoOperations.indexOps(anyString())).thenReturn(indexOperations);
		when(indexOperations.ensureIndex(any()))
			.thenReturn(Mono.error(new IllegalStateException("not primary")));

		assertThatCode(() -> new HistoryIndexInitializer(mongoOperations, new VaultProperties()).run(null))
			.doesNotThrowAnyException();
	}

	@Test
	@DisplayName("응답하지 않는 Mongo를 기다리다 시간이 지나도 기동을 막지 않는다")
	void run_doesNotFailStartupWhenMongoHangs() {
		VaultProperties properties = new VaultProperties();
		properties.getStore().setIndexTimeout(Duration.ofMillis(100));
		when(mongoOperations.indexOps(anyString())).thenReturn(indexOperations);
		when(indexOperations.ensureIndex(any())).thenReturn(Mono.never());

		assertThatCode(() -> new HistoryIndexInitializer(mongoOperations, properties).run(null))
			.doesNotThrowAnyException();
	}
}
