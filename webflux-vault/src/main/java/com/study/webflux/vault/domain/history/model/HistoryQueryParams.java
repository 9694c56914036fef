package com.study.webflux.vault.domain.history.model;

import java.util.List;

/**
 * 조회 요청 파라미터 원본입니다. 모든 값은 선택이며 기본값과 보정은 조회 서비스가 적용합니다.
 *
 * <p>
 * {@code count}는 앞에서부터 자르는 방식이고 {@code limit}/{@code page}는 건너뛰기 + 개수 방식입니다. 둘 다 주어지면 count 상한을
 * 먼저 적용한 뒤 페이지를 자릅니다.
 */
public record HistoryQueryParams(
	String interval,
	Integer count,
	Integer limit,
	Integer page,
	Long from,
	Long to,
	List<String> filters,
	String sort,
	String order
) {
	public HistoryQueryParams {
		filters = filters == null ? List.of() : List.copyOf(filters);
	}

	public static HistoryQueryParams defaults() {
		return new HistoryQueryParams(null, null, null, null, null, null, List.of(), null, null);
	}

	public boolean pageMode() {
		return limit != null || page != null;
	}
}
