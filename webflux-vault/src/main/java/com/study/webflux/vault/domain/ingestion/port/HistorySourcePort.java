package com.study.webflux.vault.domain.ingestion.port;

import com.study.webflux.vault.domain.history.model.HistoryDataset;
import reactor.core.publisher.Mono;

/** 업스트림 분석 API에서 한 페이지의 응답 본문을 가져옵니다. */
public interface HistorySourcePort {

	/**
	 * {@code from}부터 고정 간격·고정 개수의 구간을 요청합니다.
	 *
	 * @return 응답 본문. 전송 실패나 오류 상태 코드는
	 *         {@link com.study.webflux.vault.domain.ingestion.exception.HistorySourceException}으로 끝납니다.
	 */
	Mono<String> fetch(HistoryDataset dataset, long from);
}
