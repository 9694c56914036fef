package com.study.webflux.vault.infrastructure.history.entity;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.springframework.data.annotation.Id;

import com.study.webflux.vault.domain.history.model.HistoryBatch;
import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.history.model.HistoryMeta;
import com.study.webflux.vault.domain.history.model.IntervalSample;
import com.study.webflux.vault.domain.history.model.PoolEarnings;

/**
 * 업스트림 응답 하나를 담는 Mongo 문서입니다. 컬렉션은 데이터셋마다 다르므로 {@code @Document}를 붙이지 않고 저장 시 이름을
 * 지정합니다.
 *
 * <p>
 * {@code ingestedAt}은 같은 구간이 여러 번 저장됐을 때 나중 것을 고르는 기준입니다.
 */
public record HistoryRecordEntity(
	@Id String id,
	Instant ingestedAt,
	MetaEntity meta,
	List<IntervalEntity> intervals
) {
	public static final String INGESTED_AT = "ingestedAt";
	public static final String META_START_TIME = "meta.startTime";
	public static final String META_END_TIME = "meta.endTime";
	public static final String INTERVALS = "intervals";
	public static final String INTERVAL_START_TIME = "intervals.startTime";
	public static final String INTERVAL_END_TIME = "intervals.endTime";
	public static final String INTERVAL_VALUES = "intervals.values.";
	public static final String INTERVAL_POOLS = "intervals.pools";

	public record MetaEntity(
		long startTime,
		long endTime,
		Map<String, Double> values,
		List<PoolEarningsEntity> pools) {
		public static MetaEntity fromDomain(HistoryMeta domain) {
			return new MetaEntity(
				domain.startTime(),
				domain.endTime(),
				domain.values(),
				PoolEarningsEntity.fromDomain(domain.pools()));
		}

		public HistoryMeta toDomain() {
			return new HistoryMeta(startTime, endTime, values, PoolEarningsEntity.toDomain(pools));
		}
	}

	public record IntervalEntity(
		long startTime,
		long endTime,
		Map<String, Double> values,
		List<PoolEarningsEntity> pools) {
		public static IntervalEntity fromDomain(IntervalSample domain) {
			return new IntervalEntity(
				domain.startTime(),
				domain.endTime(),
				domain.values(),
				PoolEarningsEntity.fromDomain(domain.pools()));
		}

		public IntervalSample toDomain() {
			return new IntervalSample(startTime, endTime, values, PoolEarningsEntity.toDomain(pools));
		}
	}

	public record PoolEarningsEntity(
		String pool,
		double assetLiquidityFees,
		double runeLiquidityFees,
		double totalLiquidityFeesRune,
		double saverEarning,
		double rewards,
		double earnings) {
		public static PoolEarningsEntity fromDomain(PoolEarnings domain) {
			return new PoolEarningsEntity(
				domain.pool(),
				domain.assetLiquidityFees(),
				domain.runeLiquidityFees(),
				domain.totalLiquidityFeesRune(),
				domain.saverEarning(),
				domain.rewards(),
				domain.earnings());
		}

		public PoolEarnings toDomain() {
			return new PoolEarnings(pool, assetLiquidityFees, runeLiquidityFees,
				totalLiquidityFeesRune, saverEarning, rewards, earnings);
		}

		static List<PoolEarningsEntity> fromDomain(List<PoolEarnings> pools) {
			return pools == null ? List.of() : pools.stream().map(PoolEarningsEntity::fromDomain).toList();
		}

		static List<PoolEarnings> toDomain(List<PoolEarningsEntity> pools) {
			return pools == null ? List.of() : pools.stream().map(PoolEarningsEntity::toDomain).toList();
		}
	}

	public static HistoryRecordEntity fromDomain(HistoryBatch domain, Instant ingestedAt) {
		return new HistoryRecordEntity(
			null,
			ingestedAt,
			MetaEntity.fromDomain(domain.meta()),
			domain.intervals().stream().map(IntervalEntity::fromDomain).toList());
	}

	public HistoryBatch toDomain(HistoryDataset dataset) {
		return new HistoryBatch(
			dataset,
			meta != null ? meta.toDomain() : HistoryMeta.of(0, 0),
			intervals == null
				? List.of()
				: intervals.stream().map(IntervalEntity::toDomain).toList());
	}
}
