package com.study.webflux.vault.domain.history.model;

import java.util.List;

/**
 * 버킷 조회를 구성하는 단계입니다. {@link SeriesQuery}가 순서대로 보관하고 저장소 어댑터가 자신의 질의 언어로 옮깁니다.
 */
public sealed interface QueryStage {

	/** 레코드와 구간을 {@code [from, to]} 범위로 거릅니다. {@code from}은 이미 간격 경계로 정렬된 값입니다. */
	record MatchRange(long from, long to) implements QueryStage {
		public MatchRange {
			if (from > to) {
				throw new IllegalArgumentException("from must not be after to: " + from + " > " + to);
			}
		}
	}

	/** 같은 시작 시각을 가진 구간이 여러 번 저장된 경우 가장 나중에 저장된 구간만 남깁니다. */
	record DeduplicateSamples() implements QueryStage {
	}

	/** 모든 필터를 AND로 적용합니다. */
	record MatchFilters(List<SeriesFilter> filters) implements QueryStage {
		public MatchFilters {
			filters = filters == null ? List.of() : List.copyOf(filters);
		}
	}

	/** 구간 시작 시각을 경계로 내림해 묶고 데이터셋 스키마의 리듀서로 합칩니다. */
	record GroupBuckets(long intervalSeconds, List<SeriesField> fields, boolean collectPools)
		implements
			QueryStage {
		public GroupBuckets {
			if (intervalSeconds <= 0) {
				throw new IllegalArgumentException("intervalSeconds must be positive");
			}
			fields = fields == null ? List.of() : List.copyOf(fields);
		}
	}

	/** {@code field}가 null이면 버킷 키(정렬된 시작 시각) 기준으로 정렬합니다. */
	record SortBuckets(String field, SortDirection direction) implements QueryStage {
		public SortBuckets {
			if (direction == null) {
				direction = SortDirection.ASC;
			}
		}

		public static SortBuckets byBucketStart() {
			return new SortBuckets(null, SortDirection.ASC);
		}

		public boolean byKey() {
			return field == null;
		}
	}

	record Skip(long count) implements QueryStage {
		public Skip {
			if (count < 0) {
				throw new IllegalArgumentException("skip must not be negative");
			}
		}
	}

	record Limit(long count) implements QueryStage {
		public Limit {
			if (count < 1) {
				throw new IllegalArgumentException("limit must be positive");
			}
		}
	}
}
