package com.study.webflux.vault.domain.history.model;

import java.util.ArrayList;
import java.util.List;

/**
 * 검증된 파라미터로 만든 버킷 조회 단계 목록입니다.
 *
 * <p>
 * 단계 순서는 항상 범위 매칭, 중복 제거, 필터, 그룹, 정렬, 페이지(Limit/Skip) 순입니다. 저장소 구현은 이 순서를 그대로 실행합니다.
 */
public record SeriesQuery(
	List<QueryStage> stages
) {
	public SeriesQuery {
		stages = List.copyOf(stages);
		if (stages.isEmpty() || !(stages.get(0) instanceof QueryStage.MatchRange)) {
			throw new IllegalArgumentException("query must start with a range match");
		}
		if (stages.stream().noneMatch(QueryStage.GroupBuckets.class::isInstance)) {
			throw new IllegalArgumentException("query must group samples into buckets");
		}
	}

	public QueryStage.MatchRange range() {
		return (QueryStage.MatchRange) stages.get(0);
	}

	public QueryStage.GroupBuckets grouping() {
		return stages.stream()
			.filter(QueryStage.GroupBuckets.class::isInstance)
			.map(QueryStage.GroupBuckets.class::cast)
			.findFirst()
			.orElseThrow();
	}

	public static Builder builder(long from, long to) {
		return new Builder(from, to);
	}

	public static final class Builder {
		private final QueryStage.MatchRange range;
		private final List<SeriesFilter> filters = new ArrayList<>();
		private QueryStage.GroupBuckets grouping;
		private QueryStage.SortBuckets sort = QueryStage.SortBuckets.byBucketStart();
		private Long countCap;
		private Long skip;
		private Long pageLimit;

		private Builder(long from, long to) {
			this.range = new QueryStage.MatchRange(from, to);
		}

		public Builder filters(List<SeriesFilter> filters) {
			this.filters.addAll(filters);
			return this;
		}

		public Builder groupBy(long intervalSeconds, HistoryDataset dataset) {
			this.grouping = new QueryStage.GroupBuckets(intervalSeconds, dataset.fields(),
				dataset.hasPools());
			return this;
		}

		public Builder sort(String field, SortDirection direction) {
			this.sort = new QueryStage.SortBuckets(field, direction);
			return this;
		}

		/** 앞에서부터 {@code count}개만 남깁니다. */
		public Builder countCap(long count) {
			this.countCap = count;
			return this;
		}

		/** {@code (page - 1) * limit}개를 건너뛰고 {@code limit}개를 가져옵니다. */
		public Builder page(long page, long limit) {
			this.skip = (page - 1) * limit;
			this.pageLimit = limit;
			return this;
		}

		public SeriesQuery build() {
			if (grouping == null) {
				throw new IllegalStateException("groupBy must be called before build");
			}
			List<QueryStage> stages = new ArrayList<>();
			stages.add(range);
			stages.add(new QueryStage.DeduplicateSamples());
			if (!filters.isEmpty()) {
				stages.add(new QueryStage.MatchFilters(filters));
			}
			stages.add(grouping);
			stages.add(sort);
			if (countCap != null) {
				stages.add(new QueryStage.Limit(countCap));
			}
			if (pageLimit != null) {
				if (skip > 0) {
					stages.add(new QueryStage.Skip(skip));
				}
				stages.add(new QueryStage.Limit(pageLimit));
			}
			return new SeriesQuery(stages);
		}
	}
}
