package com.study.webflux.vault.domain.history.model;

/** 수익 구간 안의 풀별 수익 내역입니다. */
public record PoolEarnings(
	String pool,
	double assetLiquidityFees,
	double runeLiquidityFees,
	double totalLiquidityFeesRune,
	double saverEarning,
	double rewards,
	double earnings
) {
	public PoolEarnings {
		if (pool == null || pool.isBlank()) {
			throw new IllegalArgumentException("pool cannot be null or blank");
		}
	}
}
