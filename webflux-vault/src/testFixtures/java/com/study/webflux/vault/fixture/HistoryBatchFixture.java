package com.study.webflux.vault.fixture;

import java.util.List;

import com.study.webflux.vault.domain.history.model.HistoryBatch;
import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.history.model.HistoryMeta;
import com.study.webflux.vault.domain.history.model.IntervalSample;

public final class HistoryBatchFixture {

	private HistoryBatchFixture() {
	}

	/** 메타 범위를 구간들의 최소 시작 시각과 최대 종료 시각으로 채운 레코드를 만듭니다. */
	public static HistoryBatch of(HistoryDataset dataset, IntervalSample... samples) {
		List<IntervalSample> intervals = List.of(samples);
		long start = intervals.stream().mapToLong(IntervalSample::startTime).min().orElse(0L);
		long end = intervals.stream().mapToLong(IntervalSample::endTime).max().orElse(0L);
		return new HistoryBatch(dataset, HistoryMeta.of(start, end), intervals);
	}

	public static HistoryBatch withMeta(HistoryDataset dataset, long metaStart, long metaEnd,
		IntervalSample... samples) {
		return new HistoryBatch(dataset, HistoryMeta.of(metaStart, metaEnd), List.of(samples));
	}

	/** 시작 시각부터 한 시간 간격으로 이어지는 depth 구간들을 담은 레코드를 만듭니다. */
	public static HistoryBatch hourlyDepth(long startTime, double... assetDepths) {
		IntervalSample[] samples = new IntervalSample[assetDepths.length];
		for (int i = 0; i < assetDepths.length; i++) {
			samples[i] = IntervalSampleFixture.depth(startTime + i * IntervalSampleFixture.HOUR,
				assetDepths[i]);
		}
		return of(HistoryDataset.DEPTH, samples);
	}
}
