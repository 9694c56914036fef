package com.study.webflux.vault.fixture;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.study.webflux.vault.domain.history.model.IntervalSample;
import com.study.webflux.vault.domain.history.model.PoolEarnings;

public final class IntervalSampleFixture {

	public static final long HOUR = 3_600L;

	private IntervalSampleFixture() {
	}

	/** 한 시간짜리 depth 구간을 만듭니다. */
	public static IntervalSample depth(long startTime, double assetDepth) {
		return IntervalSample.of(startTime, startTime + HOUR, Map.of(
			"assetDepth", assetDepth,
			"runeDepth", assetDepth * 2,
			"assetPrice", 2.0,
			"membersCount", 10.0));
	}

	public static IntervalSample depth(long startTime, long endTime, Map<String, Double> values) {
		return IntervalSample.of(startTime, endTime, values);
	}

	public static IntervalSample swaps(long startTime, double totalCount, double totalVolume) {
		return IntervalSample.of(startTime, startTime + HOUR, Map.of(
			"totalCount", totalCount,
			"totalVolume", totalVolume,
			"runePriceUSD", 5.0));
	}

	public static IntervalSample earnings(long startTime, double earnings, String... pools) {
		List<PoolEarnings> poolEarnings = Arrays.stream(pools)
			.map(pool -> new PoolEarnings(pool, 1.0, 2.0, 3.0, 4.0, 5.0, earnings))
			.toList();
		return new IntervalSample(startTime, startTime + HOUR,
			Map.of("earnings", earnings, "avgNodeCount", 100.0),
			poolEarnings);
	}
}
