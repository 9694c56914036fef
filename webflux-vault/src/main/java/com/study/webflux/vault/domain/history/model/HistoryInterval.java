package com.study.webflux.vault.domain.history.model;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 조회 시 버킷 폭으로 사용하는 이름 있는 시간 간격입니다.
 *
 * <p>
 * 알 수 없는 이름은 {@link #resolve(String)}에서 빈 값으로 돌려주며, 기본값({@link #HOUR}) 적용은 호출 측 책임입니다.
 */
public enum HistoryInterval {

	FIVE_MINUTES("5min", 300),
	HOUR("hour", 3_600),
	DAY("day", 86_400),
	WEEK("week", 604_800),
	MONTH("month", 2_592_000),
	QUARTER("quarter", 7_776_000),
	YEAR("year", 31_536_000);

	private static final Map<String, HistoryInterval> BY_NAME = Arrays.stream(values())
		.collect(Collectors.toMap(HistoryInterval::label, Function.identity()));

	private final String label;
	private final long seconds;

	HistoryInterval(String label, long seconds) {
		this.label = label;
		this.seconds = seconds;
	}

	public String label() {
		return label;
	}

	public long seconds() {
		return seconds;
	}

	/** 이 간격의 경계로 타임스탬프를 내림합니다. */
	public long alignDown(long timestamp) {
		return alignDown(timestamp, seconds);
	}

	/** 이름으로 간격을 찾습니다. 대소문자와 앞뒤 공백은 무시합니다. */
	public static Optional<HistoryInterval> resolve(String name) {
		if (name == null || name.isBlank()) {
			return Optional.empty();
		}
		return Optional.ofNullable(BY_NAME.get(name.trim().toLowerCase()));
	}

	/** 이름을 해석하고 실패하면 {@link #HOUR}를 반환합니다. */
	public static HistoryInterval resolveOrDefault(String name) {
		return resolve(name).orElse(HOUR);
	}

	/**
	 * {@code timestamp - (timestamp mod intervalSeconds)}를 계산합니다.
	 *
	 * <p>
	 * 음수 타임스탬프도 아래쪽 경계로 내려가도록 {@link Math#floorMod(long, long)}를 사용합니다.
	 */
	public static long alignDown(long timestamp, long intervalSeconds) {
		if (intervalSeconds <= 0) {
			throw new IllegalArgumentException("intervalSeconds must be positive");
		}
		return timestamp - Math.floorMod(timestamp, intervalSeconds);
	}
}
