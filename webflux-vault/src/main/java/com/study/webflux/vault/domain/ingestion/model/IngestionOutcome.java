package com.study.webflux.vault.domain.ingestion.model;

import com.study.webflux.vault.domain.history.model.HistoryDataset;

/**
 * 한 사이클에서 데이터셋 하나의 수집 결과입니다.
 *
 * @param cursor
 *            마지막으로 저장이 확인된 위치. 다음 사이클은 이 값이 아니라 저장소의 체크포인트에서 다시 시작합니다.
 * @param reason
 *            종료 사유. 실패 시 원인 메시지가 들어갑니다.
 */
public record IngestionOutcome(
	HistoryDataset dataset,
	IngestionState state,
	int pagesStored,
	long cursor,
	String reason
) {
	public IngestionOutcome {
		if (state == null || !state.isTerminal()) {
			throw new IllegalArgumentException("outcome state must be terminal: " + state);
		}
	}

	public static IngestionOutcome done(HistoryDataset dataset, int pagesStored, long cursor,
		String reason) {
		return new IngestionOutcome(dataset, IngestionState.DONE, pagesStored, cursor, reason);
	}

	public static IngestionOutcome failed(HistoryDataset dataset, int pagesStored, long cursor,
		String reason) {
		return new IngestionOutcome(dataset, IngestionState.FAILED, pagesStored, cursor, reason);
	}

	public boolean isFailed() {
		return state == IngestionState.FAILED;
	}
}
