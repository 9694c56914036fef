package com.study.webflux.vault.domain.history.port;

import com.study.webflux.vault.domain.history.model.BucketPage;
import com.study.webflux.vault.domain.history.model.HistoryBatch;
import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.history.model.SeriesQuery;
import reactor.core.publisher.Mono;

/**
 * 데이터셋별 원본 구간과 메타를 보관하는 저장소 포트입니다.
 *
 * <p>
 * 쓰기는 추가만 하고 읽기는 상태를 바꾸지 않으므로 여러 조회와 단일 수집 작업이 잠금 없이 함께 사용합니다.
 */
public interface SeriesStore {

	/** 업스트림 응답 하나를 레코드 하나로 추가합니다. 겹치는 범위의 중복 제거는 하지 않습니다. */
	Mono<HistoryBatch> insertBatch(HistoryBatch batch);

	/** 조회 단계를 순서대로 실행해 버킷 한 페이지를 돌려줍니다. 결과가 없어도 빈 페이지를 반환합니다. */
	Mono<BucketPage> queryBuckets(HistoryDataset dataset, SeriesQuery query);

	/** 가장 최근 메타의 종료 시각. 데이터셋이 비어 있으면 빈 Mono입니다. */
	Mono<Long> lastCheckpoint(HistoryDataset dataset);
}
