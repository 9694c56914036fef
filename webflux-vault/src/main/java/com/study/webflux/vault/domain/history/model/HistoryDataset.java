package com.study.webflux.vault.domain.history.model;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * 수집 및 조회 대상 데이터셋과 그 스키마를 정의합니다.
 *
 * <p>
 * 데이터셋마다 컬렉션 이름, 업스트림 경로, 공개 API 경로, 구간 필드 목록(필드별 리듀서 포함), 메타 집계 필드 목록을 가집니다. 조회와 수집
 * 로직은 이 스키마만 보고 동작하므로 데이터셋별 핸들러를 따로 두지 않습니다.
 */
public enum HistoryDataset {

	DEPTH(
		"depth_history",
		"depths",
		true,
		"depth-history",
		List.of(
			SeriesField.sum("assetDepth"),
			SeriesField.avg("assetPrice"),
			SeriesField.avg("assetPriceUSD"),
			SeriesField.sum("liquidityUnits"),
			SeriesField.avgCount("membersCount"),
			SeriesField.sum("runeDepth"),
			SeriesField.sum("synthSupply"),
			SeriesField.sum("synthUnits"),
			SeriesField.sum("units"),
			SeriesField.avg("luvi")),
		List.of(
			"startAssetDepth", "endAssetDepth",
			"startRuneDepth", "endRuneDepth",
			"startLPUnits", "endLPUnits",
			"startMemberCount", "endMemberCount",
			"startSynthUnits", "endSynthUnits",
			"luviIncrease", "priceShiftLoss"),
		false),

	EARNINGS(
		"earnings_history",
		"earnings",
		false,
		"earnings-history",
		List.of(
			SeriesField.sum("liquidityFees"),
			SeriesField.sum("blockRewards"),
			SeriesField.sum("earnings"),
			SeriesField.sum("bondingEarnings"),
			SeriesField.sum("liquidityEarnings"),
			SeriesField.avg("avgNodeCount"),
			SeriesField.avg("runePriceUSD")),
		List.of(
			"liquidityFees", "blockRewards", "earnings", "bondingEarnings",
			"liquidityEarnings", "avgNodeCount", "runePriceUSD"),
		true),

	SWAPS(
		"swaps_history",
		"swaps",
		false,
		"swaps-history",
		List.of(
			SeriesField.sumCount("toAssetCount"),
			SeriesField.sumCount("toRuneCount"),
			SeriesField.sumCount("toTradeCount"),
			SeriesField.sumCount("fromTradeCount"),
			SeriesField.sumCount("toSecuredCount"),
			SeriesField.sumCount("fromSecuredCount"),
			SeriesField.sumCount("synthMintCount"),
			SeriesField.sumCount("synthRedeemCount"),
			SeriesField.sumCount("totalCount"),
			SeriesField.sum("toAssetVolume"),
			SeriesField.sum("toRuneVolume"),
			SeriesField.sum("toTradeVolume"),
			SeriesField.sum("fromTradeVolume"),
			SeriesField.sum("toSecuredVolume"),
			SeriesField.sum("fromSecuredVolume"),
			SeriesField.sum("synthMintVolume"),
			SeriesField.sum("synthRedeemVolume"),
			SeriesField.sum("totalVolume"),
			SeriesField.avg("runePriceUSD")),
		List.of(
			"toAssetCount", "toRuneCount", "toTradeCount", "fromTradeCount",
			"toSecuredCount", "fromSecuredCount", "synthMintCount", "synthRedeemCount",
			"totalCount", "toAssetVolume", "toRuneVolume", "toTradeVolume",
			"fromTradeVolume", "toSecuredVolume", "fromSecuredVolume", "synthMintVolume",
			"synthRedeemVolume", "totalVolume", "runePriceUSD"),
		false),

	RUNE_POOL(
		"rune_pool_history",
		"runepool",
		false,
		"rune-pool-history",
		List.of(
			SeriesField.sumCount("count"),
			SeriesField.sum("units")),
		List.of("startUnits", "startCount", "endUnits", "endCount"),
		false);

	public static final String START_TIME = "startTime";
	public static final String END_TIME = "endTime";

	private final String collectionName;
	private final String upstreamPath;
	private final boolean poolScoped;
	private final String apiPath;
	private final List<SeriesField> fields;
	private final List<String> metaFields;
	private final boolean hasPools;

	HistoryDataset(String collectionName,
		String upstreamPath,
		boolean poolScoped,
		String apiPath,
		List<SeriesField> fields,
		List<String> metaFields,
		boolean hasPools) {
		this.collectionName = collectionName;
		this.upstreamPath = upstreamPath;
		this.poolScoped = poolScoped;
		this.apiPath = apiPath;
		this.fields = fields;
		this.metaFields = metaFields;
		this.hasPools = hasPools;
	}

	public String collectionName() {
		return collectionName;
	}

	/** 업스트림 경로. 풀 단위 데이터셋은 뒤에 풀 이름이 붙습니다. */
	public String upstreamPath(String pool) {
		if (poolScoped) {
			return upstreamPath + "/" + pool;
		}
		return upstreamPath;
	}

	public String apiPath() {
		return apiPath;
	}

	public List<SeriesField> fields() {
		return fields;
	}

	public List<String> metaFields() {
		return metaFields;
	}

	public boolean hasPools() {
		return hasPools;
	}

	public Optional<SeriesField> field(String name) {
		return fields.stream().filter(field -> field.name().equals(name)).findFirst();
	}

	/** 필터와 정렬에 쓸 수 있는 필드인지 확인합니다. 시간 경계 필드도 포함합니다. */
	public boolean isQueryable(String name) {
		return START_TIME.equals(name) || END_TIME.equals(name) || field(name).isPresent();
	}

	public static Optional<HistoryDataset> fromApiPath(String apiPath) {
		return Arrays.stream(values())
			.filter(dataset -> dataset.apiPath.equals(apiPath))
			.findFirst();
	}
}
