package com.study.webflux.vault.infrastructure.history.config;

import java.time.Duration;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoOperations;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.stereotype.Component;

import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.infrastructure.common.config.properties.VaultProperties;
import com.study.webflux.vault.infrastructure.history.entity.HistoryRecordEntity;
import reactor.core.publisher.Flux;

/**
 * 데이터셋 컬렉션마다 체크포인트 조회용 {@code meta.endTime} 인덱스와 구간 조회용 {@code intervals.startTime} 인덱스를
 * 준비합니다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "vault.store.type", havingValue = "mongo", matchIfMissing = true)
public class HistoryIndexInitializer implements ApplicationRunner {

	private final ReactiveMongoOperations mongoOperations;
	private final VaultProperties properties;

	public HistoryIndexInitializer(ReactiveMongoOperations mongoOperations,
		VaultProperties properties) {
		this.mongoOperations = mongoOperations;
		this.properties = properties;
	}

	@Override
	public void run(ApplicationArguments args) {
		if (!properties.getStore().isCreateIndexes()) {
			log.info("히스토리 인덱스 자동 생성이 비활성화되어 초기화를 건너뜁니다.");
			return;
		}

		Duration timeout = properties.getStore().getIndexTimeout();
		try {
			Flux.fromArray(HistoryDataset.values())
				.concatMap(dataset -> ensureIndexes(dataset.collectionName()))
				.timeout(timeout)
				.doOnError(error -> log.error("히스토리 인덱스 생성 실패: {}", error.getMessage(), error))
				.onErrorResume(error -> Flux.empty())
				.blockLast(timeout.plusSeconds(1));
		} catch (Exception e) {
			log.warn("히스토리 인덱스 초기화 오류, 인덱스 없이 기동합니다: {}", e.getMessage());
		}
	}

	private Flux<String> ensureIndexes(String collectionName) {
		var indexOps = mongoOperations.indexOps(collectionName);
		return Flux.concat(
			indexOps.ensureIndex(new Index().on(HistoryRecordEntity.META_END_TIME, Sort.Direction.DESC)),
			indexOps.ensureIndex(new Index().on(HistoryRecordEntity.INTERVAL_START_TIME,
				Sort.Direction.ASC)))
			.doOnNext(indexName -> log.info("히스토리 인덱스를 준비했습니다. collection={}, index={}",
				collectionName,
				indexName));
	}
}
