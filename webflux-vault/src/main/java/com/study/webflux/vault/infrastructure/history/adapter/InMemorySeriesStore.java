package com.study.webflux.vault.infrastructure.history.adapter;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.study.webflux.vault.domain.history.model.BucketPage;
import com.study.webflux.vault.domain.history.model.HistoryBatch;
import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.history.model.HistoryInterval;
import com.study.webflux.vault.domain.history.model.IntervalBucket;
import com.study.webflux.vault.domain.history.model.IntervalSample;
import com.study.webflux.vault.domain.history.model.PoolEarnings;
import com.study.webflux.vault.domain.history.model.QueryStage;
import com.study.webflux.vault.domain.history.model.Reducer;
import com.study.webflux.vault.domain.history.model.SeriesField;
import com.study.webflux.vault.domain.history.model.SeriesFilter;
import com.study.webflux.vault.domain.history.model.SeriesQuery;
import com.study.webflux.vault.domain.history.model.SortDirection;
import com.study.webflux.vault.domain.history.port.SeriesStore;
import reactor.core.publisher.Mono;

/**
 * 조회 단계를 메모리에서 순서대로 실행하는 저장소입니다.
 *
 * <p>
 * 로컬 실행과 테스트용이며 Mongo 파이프라인과 같은 결과를 내도록 단계 의미를 맞춥니다.
 */
@Component
@ConditionalOnProperty(name = "vault.store.type", havingValue = "memory")
public class InMemorySeriesStore implements SeriesStore {

	private final Map<HistoryDataset, List<HistoryBatch>> records = new ConcurrentHashMap<>();

	@Override
	public Mono<HistoryBatch> insertBatch(HistoryBatch batch) {
		return Mono.fromCallable(() -> {
			records.computeIfAbsent(batch.dataset(), key -> new CopyOnWriteArrayList<>()).add(batch);
			return batch;
		});
	}

	@Override
	public Mono<BucketPage> queryBuckets(HistoryDataset dataset, SeriesQuery query) {
		return Mono.fromCallable(() -> execute(dataset, query));
	}

	/** 가장 큰 메타 종료 시각을 반환합니다. 저장된 레코드가 없으면 빈 값입니다. */
	@Override
	public Mono<Long> lastCheckpoint(HistoryDataset dataset) {
		return Mono.fromCallable(() -> batchesOf(dataset).stream()
			.map(batch -> batch.meta().endTime())
			.max(Long::compare)
			.orElse(null));
	}

	private BucketPage execute(HistoryDataset dataset, SeriesQuery query) {
		QueryStage.MatchRange range = query.range();
		List<IntervalSample> samples = List.of();
		List<IntervalBucket> buckets = List.of();
		for (QueryStage stage : query.stages()) {
			if (stage instanceof QueryStage.MatchRange matchRange) {
				samples = matchRange(dataset, matchRange);
			} else if (stage instanceof QueryStage.DeduplicateSamples) {
				samples = deduplicate(samples);
			} else if (stage instanceof QueryStage.MatchFilters matchFilters) {
				samples = samples.stream()
					.filter(sample -> matchesAll(sample, matchFilters.filters()))
					.toList();
			} else if (stage instanceof QueryStage.GroupBuckets grouping) {
				buckets = group(samples, grouping);
			} else if (stage instanceof QueryStage.SortBuckets sort) {
				buckets = buckets.stream().sorted(comparator(sort)).toList();
			} else if (stage instanceof QueryStage.Skip skip) {
				buckets = buckets.stream().skip(skip.count()).toList();
			} else if (stage instanceof QueryStage.Limit limit) {
				buckets = buckets.stream().limit(limit.count()).toList();
			} else {
				throw new IllegalArgumentException("Unsupported query stage: " + stage);
			}
		}
		return BucketPage.of(buckets, range.from(), range.to());
	}

	private List<IntervalSample> matchRange(HistoryDataset dataset, QueryStage.MatchRange range) {
		return batchesOf(dataset).stream()
			.filter(batch -> batch.meta().startTime() <= range.to()
				&& batch.meta().endTime() >= range.from())
			.flatMap(batch -> batch.intervals().stream())
			.filter(sample -> sample.startTime() >= range.from() && sample.endTime() <= range.to())
			.toList();
	}

	/** 저장 순서상 나중에 들어온 구간이 앞선 구간을 덮어씁니다. */
	private List<IntervalSample> deduplicate(List<IntervalSample> samples) {
		Map<Long, IntervalSample> latest = new LinkedHashMap<>();
		for (IntervalSample sample : samples) {
			latest.put(sample.startTime(), sample);
		}
		return new ArrayList<>(latest.values());
	}

	private boolean matchesAll(IntervalSample sample, List<SeriesFilter> filters) {
		for (SeriesFilter filter : filters) {
			if (!filter.matches(filterValue(sample, filter.field()))) {
				return false;
			}
		}
		return true;
	}

	private double filterValue(IntervalSample sample, String field) {
		if (HistoryDataset.START_TIME.equals(field)) {
			return sample.startTime();
		}
		if (HistoryDataset.END_TIME.equals(field)) {
			return sample.endTime();
		}
		return sample.value(field);
	}

	private List<IntervalBucket> group(List<IntervalSample> samples,
		QueryStage.GroupBuckets grouping) {
		Map<Long, BucketAggregate> aggregates = new TreeMap<>();
		for (IntervalSample sample : samples) {
			long key = HistoryInterval.alignDown(sample.startTime(), grouping.intervalSeconds());
			aggregates.computeIfAbsent(key, BucketAggregate::new).add(sample, grouping);
		}
		return aggregates.values().stream()
			.map(aggregate -> aggregate.toBucket(grouping))
			.toList();
	}

	private Comparator<IntervalBucket> comparator(QueryStage.SortBuckets sort) {
		Comparator<IntervalBucket> byKey = Comparator.comparingLong(IntervalBucket::bucketStart);
		if (sort.byKey()) {
			return sort.direction() == SortDirection.DESC ? byKey.reversed() : byKey;
		}
		Comparator<IntervalBucket> byField = Comparator.comparingDouble(
			bucket -> bucket.sortValue(sort.field()));
		if (sort.direction() == SortDirection.DESC) {
			byField = byField.reversed();
		}
		return byField.thenComparing(byKey);
	}

	private List<HistoryBatch> batchesOf(HistoryDataset dataset) {
		return records.getOrDefault(dataset, List.of());
	}

	private static final class BucketAggregate {
		private final long bucketStart;
		private long startTime = Long.MAX_VALUE;
		private long endTime = Long.MIN_VALUE;
		private final Map<String, Double> sums = new LinkedHashMap<>();
		private final Map<String, Integer> counts = new LinkedHashMap<>();
		private final List<PoolEarnings> pools = new ArrayList<>();

		private BucketAggregate(long bucketStart) {
			this.bucketStart = bucketStart;
		}

		private void add(IntervalSample sample, QueryStage.GroupBuckets grouping) {
			startTime = Math.min(startTime, sample.startTime());
			endTime = Math.max(endTime, sample.endTime());
			for (SeriesField field : grouping.fields()) {
				Double value = sample.values().get(field.name());
				if (value == null) {
					continue;
				}
				sums.merge(field.name(), value, Double::sum);
				counts.merge(field.name(), 1, Integer::sum);
			}
			if (grouping.collectPools()) {
				pools.addAll(sample.pools());
			}
		}

		private IntervalBucket toBucket(QueryStage.GroupBuckets grouping) {
			Map<String, Double> values = new LinkedHashMap<>();
			for (SeriesField field : grouping.fields()) {
				Double sum = sums.get(field.name());
				if (field.reducer() == Reducer.SUM) {
					values.put(field.name(), sum == null ? 0.0 : sum);
				} else if (sum != null) {
					values.put(field.name(), sum / counts.get(field.name()));
				}
			}
			return new IntervalBucket(bucketStart, startTime, endTime, values, pools);
		}
	}
}
