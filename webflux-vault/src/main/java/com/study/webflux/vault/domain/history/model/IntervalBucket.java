package com.study.webflux.vault.domain.history.model;

import java.util.List;
import java.util.Map;

/**
 * 조회 시점에 계산되는 집계 버킷입니다. 저장되지 않습니다.
 *
 * <p>
 * {@code bucketStart}는 간격 경계로 정렬된 그룹 키이고, {@code startTime}/{@code endTime}은 그룹에 속한 구간들의
 * 최소 시작 시각과 최대 종료 시각입니다.
 */
public record IntervalBucket(
	long bucketStart,
	long startTime,
	long endTime,
	Map<String, Double> values,
	List<PoolEarnings> pools
) {
	public IntervalBucket {
		values = values == null ? Map.of() : Map.copyOf(values);
		pools = pools == null ? List.of() : List.copyOf(pools);
	}

	public double value(String field) {
		return values.getOrDefault(field, 0.0);
	}

	/** 정렬용 값. 시간 경계 필드도 값으로 취급합니다. */
	public double sortValue(String field) {
		if (HistoryDataset.START_TIME.equals(field)) {
			return startTime;
		}
		if (HistoryDataset.END_TIME.equals(field)) {
			return endTime;
		}
		return value(field);
	}
}
