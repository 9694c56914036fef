package com.study.webflux.vault.domain.history.model;

import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeriesQueryTest {

	@Test
	@DisplayName("단계는 범위, 중복 제거, 필터, 그룹, 정렬, 페이지 순서로 쌓인다")
	void build_ordersStages() {
		SeriesFilter filter = new SeriesFilter("assetDepth", ComparisonOperator.GREATER, 1000);

		SeriesQuery query = SeriesQuery.builder(0, 7_200)
			.filters(List.of(filter))
			.groupBy(86_400, HistoryDataset.DEPTH)
			.sort("assetDepth", SortDirection.DESC)
			.countCap(50)
			.page(3, 10)
			.build();

		assertThat(query.stages()).containsExactly(
			new QueryStage.MatchRange(0, 7_200),
			new QueryStage.DeduplicateSamples(),
			new QueryStage.MatchFilters(List.of(filter)),
			new QueryStage.GroupBuckets(86_400, HistoryDataset.DEPTH.fields(), false),
			new QueryStage.SortBuckets("assetDepth", SortDirection.DESC),
			new QueryStage.Limit(50),
			new QueryStage.Skip(20),
			new QueryStage.Limit(10));
		assertThat(query.range()).isEqualTo(new QueryStage.MatchRange(0, 7_200));
		assertThat(query.grouping().intervalSeconds()).isEqualTo(86_400);
	}

	@Test
	@DisplayName("필터가 없고 첫 페이지면 필터와 Skip 단계를 만들지 않는다")
	void build_omitsEmptyStages() {
		SeriesQuery query = SeriesQuery.builder(0, 100)
			.groupBy(3_600, HistoryDataset.EARNINGS)
			.page(1, 10)
			.build();

		assertThat(query.stages())
			.noneMatch(QueryStage.MatchFilters.class::isInstance)
			.noneMatch(QueryStage.Skip.class::isInstance);
		assertThat(query.grouping().collectPools()).isTrue();
		assertThat(query.stages()).contains(QueryStage.SortBuckets.byBucketStart());
	}

	@Test
	@DisplayName("그룹 단계 없이 만들 수 없다")
	void build_requiresGrouping() {
		assertThatThrownBy(() -> SeriesQuery.builder(0, 100).build())
			.isInstanceOf(IllegalStateException.class);
	}

	@Test
	@DisplayName("시작이 끝보다 늦은 범위는 거부한다")
	void range_rejectsInverted() {
		assertThatThrownBy(() -> SeriesQuery.builder(200, 100))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	@DisplayName("범위 매칭으로 시작하지 않는 단계 목록은 거부한다")
	void constructor_requiresLeadingRange() {
		assertThatThrownBy(() -> new SeriesQuery(List.of(new QueryStage.Limit(1))))
			.isInstanceOf(IllegalArgumentException.class);
	}
}
