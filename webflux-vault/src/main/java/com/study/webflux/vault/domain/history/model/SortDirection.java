package com.study.webflux.vault.domain.history.model;

public enum SortDirection {
	ASC,
	DESC;

	/** {@code desc}만 내림차순으로 보고 나머지는 오름차순으로 처리합니다. */
	public static SortDirection fromOrder(String order) {
		if (order != null && "desc".equalsIgnoreCase(order.trim())) {
			return DESC;
		}
		return ASC;
	}
}
