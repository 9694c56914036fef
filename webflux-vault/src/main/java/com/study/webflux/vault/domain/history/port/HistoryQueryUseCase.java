package com.study.webflux.vault.domain.history.port;

import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.history.model.HistoryQueryParams;
import com.study.webflux.vault.domain.history.model.HistoryResponse;
import reactor.core.publisher.Mono;

public interface HistoryQueryUseCase {

	Mono<HistoryResponse> query(HistoryDataset dataset, HistoryQueryParams params);
}
