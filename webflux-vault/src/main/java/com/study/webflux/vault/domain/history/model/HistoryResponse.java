package com.study.webflux.vault.domain.history.model;

import java.util.List;
import java.util.Map;

/**
 * 데이터셋 조회 응답입니다. 결과가 없어도 {@code meta}와 빈 {@code intervals}를 가진 동일한 형태를 유지합니다.
 */
public record HistoryResponse(
	Meta meta,
	List<Map<String, Object>> intervals
) {
	public HistoryResponse {
		intervals = intervals == null ? List.of() : List.copyOf(intervals);
	}

	public record Meta(
		long startTime,
		long endTime) {
	}
}
