package com.study.webflux.vault.domain.history.model;

import java.util.List;

/**
 * 한 페이지의 버킷과 실제로 관측된 시작/종료 시각입니다.
 *
 * <p>
 * 결과가 비어 있으면 주어진 대체 시각으로 채우므로 메타는 항상 채워집니다.
 */
public record BucketPage(
	List<IntervalBucket> intervals,
	long observedStart,
	long observedEnd
) {
	public BucketPage {
		intervals = intervals == null ? List.of() : List.copyOf(intervals);
	}

	public static BucketPage of(List<IntervalBucket> intervals, long fallbackStart,
		long fallbackEnd) {
		if (intervals == null || intervals.isEmpty()) {
			return new BucketPage(List.of(), fallbackStart, fallbackEnd);
		}
		return new BucketPage(
			intervals,
			intervals.get(0).startTime(),
			intervals.get(intervals.size() - 1).endTime());
	}

	public static BucketPage empty(long fallbackStart, long fallbackEnd) {
		return new BucketPage(List.of(), fallbackStart, fallbackEnd);
	}
}
