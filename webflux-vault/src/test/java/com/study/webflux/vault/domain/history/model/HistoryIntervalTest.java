package com.study.webflux.vault.domain.history.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HistoryIntervalTest {

	@Test
	@DisplayName("이름으로 간격을 찾으면 초 단위 폭을 돌려준다")
	void resolve_knownNames() {
		assertThat(HistoryInterval.resolve("5min")).contains(HistoryInterval.FIVE_MINUTES);
		assertThat(HistoryInterval.resolve("hour").orElseThrow().seconds()).isEqualTo(3_600L);
		assertThat(HistoryInterval.resolve("day").orElseThrow().seconds()).isEqualTo(86_400L);
		assertThat(HistoryInterval.resolve("week").orElseThrow().seconds()).isEqualTo(604_800L);
		assertThat(HistoryInterval.resolve("month").orElseThrow().seconds()).isEqualTo(2_592_000L);
		assertThat(HistoryInterval.resolve("quarter").orElseThrow().seconds()).isEqualTo(7_776_000L);
		assertThat(HistoryInterval.resolve("year").orElseThrow().seconds()).isEqualTo(31_536_000L);
	}

	@Test
	@DisplayName("대소문자와 앞뒤 공백은 무시한다")
	void resolve_ignoresCaseAndWhitespace() {
		assertThat(HistoryInterval.resolve("  Day ")).contains(HistoryInterval.DAY);
	}

	@ParameterizedTest
	@ValueSource(strings = {"minute", "", "   ", "hours"})
	@DisplayName("알 수 없는 이름은 빈 값이고 기본 해석은 hour다")
	void resolve_unknownName(String name) {
		assertThat(HistoryInterval.resolve(name)).isEmpty();
		assertThat(HistoryInterval.resolveOrDefault(name)).isEqualTo(HistoryInterval.HOUR);
	}

	@Test
	@DisplayName("null 이름도 hour로 해석한다")
	void resolveOrDefault_null() {
		assertThat(HistoryInterval.resolveOrDefault(null)).isEqualTo(HistoryInterval.HOUR);
	}

	@Test
	@DisplayName("경계 내림은 멱등이다")
	void alignDown_isIdempotent() {
		long[] timestamps = {0L, 1L, 3_599L, 3_600L, 1_700_000_123L, -1L};
		for (HistoryInterval interval : HistoryInterval.values()) {
			for (long timestamp : timestamps) {
				long aligned = interval.alignDown(timestamp);
				assertThat(interval.alignDown(aligned)).isEqualTo(aligned);
				assertThat(aligned).isLessThanOrEqualTo(timestamp);
				assertThat(timestamp - aligned).isLessThan(interval.seconds());
			}
		}
	}

	@Test
	@DisplayName("음수 타임스탬프도 아래쪽 경계로 내린다")
	void alignDown_negative() {
		assertThat(HistoryInterval.alignDown(-1L, 3_600L)).isEqualTo(-3_600L);
	}

	@Test
	@DisplayName("간격 폭이 양수가 아니면 예외를 던진다")
	void alignDown_nonPositiveInterval() {
		assertThatThrownBy(() -> HistoryInterval.alignDown(10L, 0L))
			.isInstanceOf(IllegalArgumentException.class);
	}
}
