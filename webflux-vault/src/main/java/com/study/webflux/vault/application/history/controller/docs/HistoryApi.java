package com.study.webflux.vault.application.history.controller.docs;

import java.util.List;

import org.springframework.http.MediaType;

import com.study.webflux.vault.domain.history.model.HistoryResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import reactor.core.publisher.Mono;

@Tag(
	name = "히스토리 API",
	description = "수집된 Midgard 히스토리를 간격 단위로 재집계해 조회"
)
public interface HistoryApi {

	@Operation(
		summary = "데이터셋 히스토리 조회",
		description = "depth-history, earnings-history, swaps-history, rune-pool-history 중 하나를 "
			+ "요청한 간격으로 묶어 반환합니다. 결과가 없어도 meta와 빈 intervals를 반환합니다"
	)
	@ApiResponse(
		responseCode = "200",
		description = "버킷 목록과 관측된 시작/종료 시각",
		content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE)
	)
	Mono<HistoryResponse> getHistory(
		@Parameter(description = "데이터셋 경로", example = "depth-history") String dataset,
		@Parameter(description = "버킷 간격 (5min, hour, day, week, month, quarter, year)", example = "day") String interval,
		@Parameter(description = "앞에서부터 가져올 버킷 수 (최대 400)", example = "10") Integer count,
		@Parameter(description = "페이지 크기 (최대 400)", example = "10") Integer limit,
		@Parameter(description = "1부터 시작하는 페이지 번호", example = "1") Integer page,
		@Parameter(description = "시작 시각 (unix 초, 간격 경계로 내림)", example = "1700000000") Long from,
		@Parameter(description = "종료 시각 (unix 초)", example = "1700086400") Long to,
		@Parameter(description = "비교 필터, 반복 가능", example = "assetDepth>=1000") List<String> filters,
		@Parameter(description = "정렬 필드", example = "assetDepth") String sort,
		@Parameter(description = "sort의 별칭") String sortBy,
		@Parameter(description = "정렬 방향 (asc, desc)", example = "desc") String order
	);
}
