package com.study.webflux.vault.domain.history.model;

import java.util.List;
import java.util.Map;

/**
 * 업스트림에서 받은 원본 구간 하나입니다. {@code [startTime, endTime)} 범위를 가집니다.
 */
public record IntervalSample(
	long startTime,
	long endTime,
	Map<String, Double> values,
	List<PoolEarnings> pools
) {
	public IntervalSample {
		if (startTime >= endTime) {
			throw new IllegalArgumentException(
				"startTime must be before endTime: " + startTime + " >= " + endTime);
		}
		values = values == null ? Map.of() : Map.copyOf(values);
		pools = pools == null ? List.of() : List.copyOf(pools);
	}

	public static IntervalSample of(long startTime, long endTime, Map<String, Double> values) {
		return new IntervalSample(startTime, endTime, values, List.of());
	}

	/** 필드 값. 없으면 0을 반환합니다. */
	public double value(String field) {
		return values.getOrDefault(field, 0.0);
	}
}
