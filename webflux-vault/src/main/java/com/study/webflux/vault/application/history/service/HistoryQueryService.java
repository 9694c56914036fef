package com.study.webflux.vault.application.history.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.vault.domain.history.model.BucketPage;
import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.history.model.HistoryInterval;
import com.study.webflux.vault.domain.history.model.HistoryQueryParams;
import com.study.webflux.vault.domain.history.model.HistoryResponse;
import com.study.webflux.vault.domain.history.model.IntervalBucket;
import com.study.webflux.vault.domain.history.model.PoolEarnings;
import com.study.webflux.vault.domain.history.model.SeriesField;
import com.study.webflux.vault.domain.history.model.SeriesFilter;
import com.study.webflux.vault.domain.history.model.SeriesFilterParser;
import com.study.webflux.vault.domain.history.model.SeriesQuery;
import com.study.webflux.vault.domain.history.model.SortDirection;
import com.study.webflux.vault.domain.history.port.HistoryQueryUseCase;
import com.study.webflux.vault.domain.history.port.SeriesStore;
import com.study.webflux.vault.infrastructure.common.config.properties.VaultProperties;
import reactor.core.publisher.Mono;

/**
 * 조회 파라미터를 보정해 {@link SeriesQuery}로 만들고 저장소 결과를 공개 응답 형태로 바꿉니다.
 *
 * <p>
 * 잘못된 입력은 오류 대신 보정합니다. 알 수 없는 간격은 hour, 해석할 수 없는 필터와 스키마에 없는 필드는 버리고, 페이지 값은 허용 범위로
 * 자릅니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HistoryQueryService implements HistoryQueryUseCase {

	static final int MAX_PAGE_LIMIT = 400;
	static final int DEFAULT_PAGE_LIMIT = 10;

	private final SeriesStore seriesStore;
	private final VaultProperties properties;

	@Override
	public Mono<HistoryResponse> query(HistoryDataset dataset, HistoryQueryParams params) {
		HistoryInterval interval = HistoryInterval.resolveOrDefault(params.interval());
		long requestedFrom = resolveFrom(params.from());
		long from = interval.alignDown(requestedFrom);
		long to = params.to() == null ? Long.MAX_VALUE : params.to();
		if (from > to) {
			log.debug("조회 범위가 비어 있습니다. dataset={}, from={}, to={}", dataset, from, to);
			return Mono.just(toResponse(dataset, BucketPage.empty(requestedFrom, to)));
		}

		SeriesQuery query = buildQuery(dataset, params, interval, from, to);
		return seriesStore.queryBuckets(dataset, query)
			.map(page -> page.intervals().isEmpty() ? BucketPage.empty(requestedFrom, to) : page)
			.map(page -> toResponse(dataset, page));
	}

	/** 요청 시각은 unix 초이므로 음수는 0으로 올립니다. 빈 결과의 메타 시작 시각은 이 값을 그대로 씁니다. */
	private long resolveFrom(Long from) {
		return from == null ? 0L : Math.max(0L, from);
	}

	SeriesQuery buildQuery(HistoryDataset dataset, HistoryQueryParams params,
		HistoryInterval interval, long from, long to) {
		SeriesQuery.Builder builder = SeriesQuery.builder(from, to)
			.filters(resolveFilters(dataset, params.filters()))
			.groupBy(interval.seconds(), dataset);

		String sortField = resolveSortField(dataset, params.sort()).orElse(null);
		builder.sort(sortField, SortDirection.fromOrder(params.order()));

		if (params.count() != null || !params.pageMode()) {
			builder.countCap(resolveCount(params.count()));
		}
		if (params.pageMode()) {
			builder.page(resolvePage(params.page()), resolvePageLimit(params.limit()));
		}
		return builder.build();
	}

	private List<SeriesFilter> resolveFilters(HistoryDataset dataset, List<String> expressions) {
		List<SeriesFilter> filters = new ArrayList<>();
		for (String expression : expressions) {
			Optional<SeriesFilter> parsed = SeriesFilterParser.parse(expression);
			if (parsed.isEmpty()) {
				log.warn("해석할 수 없는 필터를 무시합니다. dataset={}, filter={}", dataset, expression);
				continue;
			}
			SeriesFilter filter = parsed.get();
			if (!dataset.isQueryable(filter.field())) {
				log.warn("스키마에 없는 필드의 필터를 무시합니다. dataset={}, filter={}", dataset,
					filter.toExpression());
				continue;
			}
			filters.add(filter);
		}
		return filters;
	}

	private Optional<String> resolveSortField(HistoryDataset dataset, String sort) {
		if (sort == null || sort.isBlank()) {
			return Optional.empty();
		}
		String field = sort.trim();
		if (!dataset.isQueryable(field)) {
			log.debug("알 수 없는 정렬 필드를 무시합니다. dataset={}, sort={}", dataset, field);
			return Optional.empty();
		}
		return Optional.of(field);
	}

	private long resolveCount(Integer count) {
		int maxCount = properties.getQuery().getMaxCount();
		if (count == null) {
			return Math.min(properties.getQuery().getDefaultCount(), maxCount);
		}
		return Math.max(1, Math.min(count, maxCount));
	}

	private long resolvePage(Integer page) {
		return page == null ? 1 : Math.max(1, page);
	}

	private long resolvePageLimit(Integer limit) {
		if (limit == null) {
			return DEFAULT_PAGE_LIMIT;
		}
		return Math.max(1, Math.min(limit, MAX_PAGE_LIMIT));
	}

	private HistoryResponse toResponse(HistoryDataset dataset, BucketPage page) {
		List<Map<String, Object>> intervals = page.intervals().stream()
			.map(bucket -> toInterval(dataset, bucket))
			.toList();
		return new HistoryResponse(
			new HistoryResponse.Meta(page.observedStart(), page.observedEnd()),
			intervals);
	}

	private Map<String, Object> toInterval(HistoryDataset dataset, IntervalBucket bucket) {
		Map<String, Object> interval = new LinkedHashMap<>();
		interval.put(HistoryDataset.START_TIME, bucket.startTime());
		interval.put(HistoryDataset.END_TIME, bucket.endTime());
		for (SeriesField field : dataset.fields()) {
			Double value = bucket.values().get(field.name());
			if (value == null) {
				interval.put(field.name(), null);
			} else if (field.integral()) {
				interval.put(field.name(), Math.round(value));
			} else {
				interval.put(field.name(), value);
			}
		}
		if (dataset.hasPools()) {
			interval.put("pools", bucket.pools().stream().map(this::toPool).toList());
		}
		return interval;
	}

	private Map<String, Object> toPool(PoolEarnings pool) {
		Map<String, Object> shaped = new LinkedHashMap<>();
		shaped.put("pool", pool.pool());
		shaped.put("assetLiquidityFees", pool.assetLiquidityFees());
		shaped.put("runeLiquidityFees", pool.runeLiquidityFees());
		shaped.put("totalLiquidityFeesRune", pool.totalLiquidityFeesRune());
		shaped.put("saverEarning", pool.saverEarning());
		shaped.put("rewards", pool.rewards());
		shaped.put("earnings", pool.earnings());
		return shaped;
	}
}
