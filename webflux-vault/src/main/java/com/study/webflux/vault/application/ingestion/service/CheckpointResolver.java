package com.study.webflux.vault.application.ingestion.service;

import java.time.Clock;
import java.time.Duration;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Service;

import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.history.model.HistoryInterval;
import com.study.webflux.vault.domain.history.port.SeriesStore;
import com.study.webflux.vault.infrastructure.common.config.properties.VaultProperties;
import reactor.core.publisher.Mono;

/**
 * 데이터셋 수집을 시작할 커서를 결정합니다.
 *
 * <p>
 * 저장된 레코드가 있으면 가장 최근 메타 종료 시각을 쓰고, 없으면 {@code now - lookback}을 시간 경계로 내린 값을 씁니다. 쓰기가
 * 없는 동안에는 같은 시계에 대해 항상 같은 값을 반환합니다.
 *
 * <p>
 * 마지막 응답이 아직 끝나지 않은 현재 시간 구간까지 덮고 있으면 커서를 그 구간의 시작으로 되돌립니다. 다음 실행이 해당 구간을 다시 받아
 * 저장하고, 조회 시 중복 제거 단계가 나중에 저장된 구간을 남깁니다.
 */
@Service
@RequiredArgsConstructor
public class CheckpointResolver {

	private final SeriesStore seriesStore;
	private final VaultProperties properties;
	private final Clock clock;

	public Mono<Long> resolve(HistoryDataset dataset) {
		return seriesStore.lastCheckpoint(dataset)
			.map(this::reopenCurrentHour)
			.switchIfEmpty(Mono.fromSupplier(this::defaultCheckpoint));
	}

	long reopenCurrentHour(long checkpoint) {
		long currentHourStart = HistoryInterval.alignDown(clock.instant().getEpochSecond(),
			HistoryInterval.HOUR.seconds());
		return Math.min(checkpoint, currentHourStart);
	}

	long defaultCheckpoint() {
		Duration lookback = properties.getIngestion().getLookback();
		long now = clock.instant().getEpochSecond();
		return HistoryInterval.alignDown(now - lookback.getSeconds(), HistoryInterval.HOUR.seconds());
	}
}
