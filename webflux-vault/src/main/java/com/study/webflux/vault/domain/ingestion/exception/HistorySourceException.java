package com.study.webflux.vault.domain.ingestion.exception;

/** 업스트림 호출이 전송 오류나 오류 상태 코드로 끝난 경우입니다. */
public class HistorySourceException extends RuntimeException {

	public HistorySourceException(String message) {
		super(message);
	}

	public HistorySourceException(String message, Throwable cause) {
		super(message, cause);
	}
}
