package com.study.webflux.vault.domain.ingestion.exception;

/** 응답 본문을 해석할 수 없거나 데이터셋 스키마와 맞지 않는 경우입니다. */
public class HistoryParseException extends RuntimeException {

	public HistoryParseException(String message) {
		super(message);
	}

	public HistoryParseException(String message, Throwable cause) {
		super(message, cause);
	}
}
