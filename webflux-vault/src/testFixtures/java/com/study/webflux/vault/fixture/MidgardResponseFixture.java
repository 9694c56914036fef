package com.study.webflux.vault.fixture;

public final class MidgardResponseFixture {

	private MidgardResponseFixture() {
	}

	/** 구간 하나를 가진 depth 응답. 숫자는 Midgard처럼 문자열로 옵니다. */
	public static String depth(long startTime, long endTime) {
		return """
			{
			  "meta": {
			    "startTime": "%d",
			    "endTime": "%d",
			    "startAssetDepth": "100",
			    "endAssetDepth": "200",
			    "priceShiftLoss": "0.5"
			  },
			  "intervals": [
			    {
			      "startTime": "%d",
			      "endTime": "%d",
			      "assetDepth": "1500",
			      "assetPrice": "2.5",
			      "membersCount": "12",
			      "runeDepth": 3000
			    }
			  ]
			}
			""".formatted(startTime, endTime, startTime, endTime);
	}

	public static String emptyIntervals(long startTime, long endTime) {
		return """
			{"meta": {"startTime": "%d", "endTime": "%d"}, "intervals": []}
			""".formatted(startTime, endTime);
	}

	public static String earnings(long startTime, long endTime) {
		return """
			{
			  "meta": {
			    "startTime": "%d",
			    "endTime": "%d",
			    "earnings": "10",
			    "pools": [
			      {"pool": "BTC.BTC", "assetLiquidityFees": "1", "runeLiquidityFees": "2",
			       "totalLiquidityFeesRune": "3", "saverEarning": "4", "rewards": "5", "earnings": "6"}
			    ]
			  },
			  "intervals": [
			    {
			      "startTime": "%d",
			      "endTime": "%d",
			      "earnings": "10",
			      "avgNodeCount": "99.5",
			      "pools": [
			        {"pool": "BTC.BTC", "assetLiquidityFees": "1", "runeLiquidityFees": "2",
			         "totalLiquidityFeesRune": "3", "saverEarning": "4", "rewards": "5", "earnings": "6"},
			        {"pool": "ETH.ETH", "assetLiquidityFees": 1, "runeLiquidityFees": 2,
			         "totalLiquidityFeesRune": 3, "saverEarning": 4, "rewards": 5, "earnings": 6}
			      ]
			    }
			  ]
			}
			""".formatted(startTime, endTime, startTime, endTime);
	}
}
