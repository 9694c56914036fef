package com.study.webflux.vault.domain.history.model;

/** 버킷 안에서 필드 값을 합치는 방식입니다. */
public enum Reducer {
	/** 카운트, 거래량, 유닛 합계처럼 누적되는 값 */
	SUM,
	/** 가격, 멤버 수, 비율처럼 평균을 내야 하는 값 */
	AVG
}
