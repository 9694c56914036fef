package com.study.webflux.vault.domain.history.model;

import java.util.List;

/** 업스트림 응답 하나. 메타와 구간 목록이 한 레코드로 저장됩니다. */
public record HistoryBatch(
	HistoryDataset dataset,
	HistoryMeta meta,
	List<IntervalSample> intervals
) {
	public HistoryBatch {
		if (dataset == null) {
			throw new IllegalArgumentException("dataset cannot be null");
		}
		if (meta == null) {
			throw new IllegalArgumentException("meta cannot be null");
		}
		intervals = intervals == null ? List.of() : List.copyOf(intervals);
	}

	public boolean isEmpty() {
		return intervals.isEmpty();
	}
}
