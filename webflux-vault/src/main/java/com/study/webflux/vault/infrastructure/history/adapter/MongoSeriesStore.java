package com.study.webflux.vault.infrastructure.history.adapter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.RequiredArgsConstructor;

import org.bson.Document;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.ReactiveMongoOperations;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.aggregation.ArithmeticOperators;
import org.springframework.data.mongodb.core.aggregation.Fields;
import org.springframework.data.mongodb.core.aggregation.GroupOperation;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Repository;

import com.study.webflux.vault.domain.history.model.BucketPage;
import com.study.webflux.vault.domain.history.model.HistoryBatch;
import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.history.model.IntervalBucket;
import com.study.webflux.vault.domain.history.model.PoolEarnings;
import com.study.webflux.vault.domain.history.model.QueryStage;
import com.study.webflux.vault.domain.history.model.Reducer;
import com.study.webflux.vault.domain.history.model.SeriesField;
import com.study.webflux.vault.domain.history.model.SeriesFilter;
import com.study.webflux.vault.domain.history.model.SeriesQuery;
import com.study.webflux.vault.domain.history.port.SeriesStore;
import com.study.webflux.vault.infrastructure.history.entity.HistoryRecordEntity;
import reactor.core.publisher.Mono;

/**
 * 조회 단계를 Mongo 집계 파이프라인으로 옮겨 실행하는 저장소입니다.
 *
 * <p>
 * 응답 하나가 문서 하나이므로 범위 매칭 후 {@code intervals}를 펼쳐 구간 단위로 필터링과 그룹핑을 수행합니다.
 */
@Repository
@RequiredArgsConstructor
@ConditionalOnProperty(name = "vault.store.type", havingValue = "mongo", matchIfMissing = true)
public class MongoSeriesStore implements SeriesStore {

	static final String SAMPLE_KEY = "sampleStart";
	static final String BUCKET_KEY = "bucketStart";
	static final String POOLS = "pools";

	private final ReactiveMongoOperations mongoOperations;
	private final Clock clock;

	@Override
	public Mono<HistoryBatch> insertBatch(HistoryBatch batch) {
		return Mono.just(batch)
			.map(toStore -> HistoryRecordEntity.fromDomain(toStore, clock.instant()))
			.flatMap(entity -> mongoOperations.insert(entity, batch.dataset().collectionName()))
			.map(entity -> entity.toDomain(batch.dataset()));
	}

	@Override
	public Mono<BucketPage> queryBuckets(HistoryDataset dataset, SeriesQuery query) {
		QueryStage.MatchRange range = query.range();
		QueryStage.GroupBuckets grouping = query.grouping();
		return mongoOperations.aggregate(toAggregation(query), dataset.collectionName(),
			Document.class)
			.map(document -> toBucket(document, grouping))
			.collectList()
			.map(buckets -> BucketPage.of(buckets, range.from(), range.to()));
	}

	@Override
	public Mono<Long> lastCheckpoint(HistoryDataset dataset) {
		Query query = new Query()
			.with(Sort.by(Sort.Direction.DESC, HistoryRecordEntity.META_END_TIME))
			.limit(1);
		return mongoOperations.findOne(query, HistoryRecordEntity.class, dataset.collectionName())
			.filter(entity -> entity.meta() != null)
			.map(entity -> entity.meta().endTime());
	}

	Aggregation toAggregation(SeriesQuery query) {
		List<AggregationOperation> operations = new ArrayList<>();
		for (QueryStage stage : query.stages()) {
			operations.addAll(toOperations(stage));
		}
		return Aggregation.newAggregation(operations);
	}

	private List<AggregationOperation> toOperations(QueryStage stage) {
		if (stage instanceof QueryStage.MatchRange range) {
			return List.of(
				Aggregation.match(Criteria.where(HistoryRecordEntity.META_START_TIME).lte(range.to())
					.and(HistoryRecordEntity.META_END_TIME).gte(range.from())),
				Aggregation.unwind(HistoryRecordEntity.INTERVALS),
				Aggregation.match(
					Criteria.where(HistoryRecordEntity.INTERVAL_START_TIME).gte(range.from())
						.and(HistoryRecordEntity.INTERVAL_END_TIME).lte(range.to())));
		}
		if (stage instanceof QueryStage.DeduplicateSamples) {
			return List.of(
				Aggregation.sort(Sort.by(Sort.Direction.ASC, HistoryRecordEntity.INGESTED_AT,
					Fields.UNDERSCORE_ID)),
				Aggregation.group(Fields.from(
					Fields.field(SAMPLE_KEY, HistoryRecordEntity.INTERVAL_START_TIME)))
					.last(HistoryRecordEntity.INTERVALS).as(HistoryRecordEntity.INTERVALS));
		}
		if (stage instanceof QueryStage.MatchFilters matchFilters) {
			Criteria[] criteria = matchFilters.filters().stream()
				.map(this::toCriteria)
				.toArray(Criteria[]::new);
			return List.of(Aggregation.match(new Criteria().andOperator(criteria)));
		}
		if (stage instanceof QueryStage.GroupBuckets grouping) {
			return List.of(
				Aggregation.addFields()
					.addField(BUCKET_KEY)
					.withValueOf(ArithmeticOperators.valueOf(HistoryRecordEntity.INTERVAL_START_TIME)
						.subtract(ArithmeticOperators.valueOf(HistoryRecordEntity.INTERVAL_START_TIME)
							.mod(grouping.intervalSeconds())))
					.build(),
				toGroup(grouping));
		}
		if (stage instanceof QueryStage.SortBuckets sort) {
			Sort.Direction direction = Sort.Direction.valueOf(sort.direction().name());
			if (sort.byKey()) {
				return List.of(Aggregation.sort(Sort.by(direction, Fields.UNDERSCORE_ID)));
			}
			return List.of(Aggregation.sort(Sort.by(
				new Sort.Order(direction, sort.field()),
				Sort.Order.asc(Fields.UNDERSCORE_ID))));
		}
		if (stage instanceof QueryStage.Skip skip) {
			return List.of(Aggregation.skip(skip.count()));
		}
		if (stage instanceof QueryStage.Limit limit) {
			return List.of(Aggregation.limit(limit.count()));
		}
		throw new IllegalArgumentException("Unsupported query stage: " + stage);
	}

	private GroupOperation toGroup(QueryStage.GroupBuckets grouping) {
		GroupOperation group = Aggregation.group(BUCKET_KEY)
			.min(HistoryRecordEntity.INTERVAL_START_TIME).as(HistoryDataset.START_TIME)
			.max(HistoryRecordEntity.INTERVAL_END_TIME).as(HistoryDataset.END_TIME);
		for (SeriesField field : grouping.fields()) {
			String source = HistoryRecordEntity.INTERVAL_VALUES + field.name();
			group = field.reducer() == Reducer.SUM
				? group.sum(source).as(field.name())
				: group.avg(source).as(field.name());
		}
		if (grouping.collectPools()) {
			group = group.push(HistoryRecordEntity.INTERVAL_POOLS).as(POOLS);
		}
		return group;
	}

	private Criteria toCriteria(SeriesFilter filter) {
		Criteria criteria = Criteria.where(fieldPath(filter.field()));
		return switch (filter.operator()) {
			case GREATER_EQ -> criteria.gte(filter.value());
			case LESS_EQ -> criteria.lte(filter.value());
			case GREATER -> criteria.gt(filter.value());
			case LESS -> criteria.lt(filter.value());
			case EQUAL -> criteria.is(filter.value());
		};
	}

	private String fieldPath(String field) {
		if (HistoryDataset.START_TIME.equals(field)) {
			return HistoryRecordEntity.INTERVAL_START_TIME;
		}
		if (HistoryDataset.END_TIME.equals(field)) {
			return HistoryRecordEntity.INTERVAL_END_TIME;
		}
		return HistoryRecordEntity.INTERVAL_VALUES + field;
	}

	private IntervalBucket toBucket(Document document, QueryStage.GroupBuckets grouping) {
		Map<String, Double> values = new LinkedHashMap<>();
		for (SeriesField field : grouping.fields()) {
			Object value = document.get(field.name());
			if (value instanceof Number number) {
				values.put(field.name(), number.doubleValue());
			}
		}
		List<PoolEarnings> pools = grouping.collectPools()
			? flattenPools(document.get(POOLS))
			: List.of();
		return new IntervalBucket(
			asLong(document.get(Fields.UNDERSCORE_ID)),
			asLong(document.get(HistoryDataset.START_TIME)),
			asLong(document.get(HistoryDataset.END_TIME)),
			values,
			pools);
	}

	/** 구간별 풀 배열의 배열을 하나의 목록으로 펼칩니다. 형식이 맞지 않는 항목은 버립니다. */
	static List<PoolEarnings> flattenPools(Object raw) {
		if (!(raw instanceof List<?> groups)) {
			return List.of();
		}
		List<PoolEarnings> flattened = new ArrayList<>();
		for (Object group : groups) {
			if (!(group instanceof List<?> entries)) {
				continue;
			}
			for (Object entry : entries) {
				if (entry instanceof Document poolDocument) {
					toPoolEarnings(poolDocument).ifPresent(flattened::add);
				}
			}
		}
		return flattened;
	}

	private static Optional<PoolEarnings> toPoolEarnings(Document document) {
		if (!(document.get("pool") instanceof String pool) || pool.isBlank()) {
			return Optional.empty();
		}
		Object[] numbers = {
			document.get("assetLiquidityFees"),
			document.get("runeLiquidityFees"),
			document.get("totalLiquidityFeesRune"),
			document.get("saverEarning"),
			document.get("rewards"),
			document.get("earnings")};
		for (Object number : numbers) {
			if (!(number instanceof Number)) {
				return Optional.empty();
			}
		}
		return Optional.of(new PoolEarnings(
			pool,
			((Number) numbers[0]).doubleValue(),
			((Number) numbers[1]).doubleValue(),
			((Number) numbers[2]).doubleValue(),
			((Number) numbers[3]).doubleValue(),
			((Number) numbers[4]).doubleValue(),
			((Number) numbers[5]).doubleValue()));
	}

	private static long asLong(Object value) {
		return value instanceof Number number ? number.longValue() : 0L;
	}
}
