package com.study.webflux.vault.domain.history.model;

import java.util.List;
import java.util.Map;

/**
 * 업스트림 응답 하나가 덮는 전체 범위와 데이터셋별 시작/종료 집계값입니다.
 *
 * <p>
 * {@code endTime}은 다음 수집 요청의 시작점(체크포인트)으로 사용됩니다. 업스트림이 값을 비워 보낸 경우 0입니다.
 */
public record HistoryMeta(
	long startTime,
	long endTime,
	Map<String, Double> values,
	List<PoolEarnings> pools
) {
	public HistoryMeta {
		values = values == null ? Map.of() : Map.copyOf(values);
		pools = pools == null ? List.of() : List.copyOf(pools);
	}

	public static HistoryMeta of(long startTime, long endTime) {
		return new HistoryMeta(startTime, endTime, Map.of(), List.of());
	}
}
