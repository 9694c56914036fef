package com.study.webflux.vault.domain.ingestion.port;

import com.study.webflux.vault.domain.history.model.HistoryBatch;
import com.study.webflux.vault.domain.history.model.HistoryDataset;

public interface HistoryBatchDecoder {

	/**
	 * 응답 본문을 배치로 변환합니다.
	 *
	 * @throws com.study.webflux.vault.domain.ingestion.exception.HistoryParseException
	 *             본문이 JSON이 아니거나 스키마와 맞지 않는 경우
	 */
	HistoryBatch decode(HistoryDataset dataset, String body);
}
