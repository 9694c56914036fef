package com.study.webflux.vault.application.history.controller;

import java.util.List;

import lombok.RequiredArgsConstructor;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import com.study.webflux.vault.application.history.controller.docs.HistoryApi;
import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.history.model.HistoryQueryParams;
import com.study.webflux.vault.domain.history.model.HistoryResponse;
import com.study.webflux.vault.domain.history.port.HistoryQueryUseCase;
import reactor.core.publisher.Mono;

/** 데이터셋별 히스토리 조회 REST 컨트롤러입니다. */
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class HistoryController implements HistoryApi {

	private final HistoryQueryUseCase historyQueryUseCase;

	@GetMapping("/{dataset:depth-history|earnings-history|swaps-history|rune-pool-history}")
	public Mono<HistoryResponse> getHistory(
		@PathVariable String dataset,
		@RequestParam(required = false) String interval,
		@RequestParam(required = false) Integer count,
		@RequestParam(required = false) Integer limit,
		@RequestParam(required = false) Integer page,
		@RequestParam(required = false) Long from,
		@RequestParam(required = false) Long to,
		@RequestParam(required = false) List<String> filters,
		@RequestParam(required = false) String sort,
		@RequestParam(name = "sort_by", required = false) String sortBy,
		@RequestParam(required = false) String order) {

		HistoryDataset target = HistoryDataset.fromApiPath(dataset)
			.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
				"Unknown dataset: " + dataset));

		HistoryQueryParams params = new HistoryQueryParams(
			interval,
			count,
			limit,
			page,
			from,
			to,
			filters,
			sort != null ? sort : sortBy,
			order);
		return historyQueryUseCase.query(target, params);
	}
}
