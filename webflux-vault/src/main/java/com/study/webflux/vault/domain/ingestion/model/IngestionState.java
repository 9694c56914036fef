package com.study.webflux.vault.domain.ingestion.model;

/** 데이터셋 하나의 수집 상태 머신 상태입니다. DONE과 FAILED는 한 사이클의 종료 상태입니다. */
public enum IngestionState {
	IDLE,
	FETCHING,
	PARSING,
	STORING,
	ADVANCING,
	DONE,
	FAILED;

	public boolean isTerminal() {
		return this == DONE || this == FAILED;
	}
}
