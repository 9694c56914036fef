package com.study.webflux.vault.infrastructure.ingestion.adapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.RequiredArgsConstructor;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.vault.domain.history.model.HistoryBatch;
import com.study.webflux.vault.domain.history.model.HistoryDataset;
import com.study.webflux.vault.domain.history.model.HistoryMeta;
import com.study.webflux.vault.domain.history.model.IntervalSample;
import com.study.webflux.vault.domain.history.model.PoolEarnings;
import com.study.webflux.vault.domain.history.model.SeriesField;
import com.study.webflux.vault.domain.ingestion.exception.HistoryParseException;
import com.study.webflux.vault.domain.ingestion.port.HistoryBatchDecoder;

/**
 * Midgard 응답 JSON을 {@link HistoryBatch}로 변환합니다.
 *
 * <p>
 * 숫자는 문자열이나 숫자 어느 쪽으로 와도 받습니다. 메타 시각은 빈 문자열, {@code "null"}, JSON null, 누락을 0으로 보며 이는
 * 수집 커서를 더 진행하지 않는다는 뜻입니다. 그 밖에 숫자로 읽을 수 없는 값은 응답 전체를 거부합니다.
 */
@Component
@RequiredArgsConstructor
public class MidgardHistoryParser implements HistoryBatchDecoder {

	private static final String META = "meta";
	private static final String INTERVALS = "intervals";
	private static final String POOLS = "pools";
	private static final String POOL = "pool";

	private final ObjectMapper objectMapper;

	@Override
	public HistoryBatch decode(HistoryDataset dataset, String body) {
		JsonNode root = readTree(body);
		JsonNode meta = root.path(META);
		JsonNode intervals = root.path(INTERVALS);
		if (!meta.isObject()) {
			throw new HistoryParseException(dataset + " 응답에 meta 객체가 없습니다.");
		}
		if (!intervals.isArray()) {
			throw new HistoryParseException(dataset + " 응답에 intervals 배열이 없습니다.");
		}

		List<IntervalSample> samples = new ArrayList<>();
		for (JsonNode interval : intervals) {
			samples.add(toSample(dataset, interval));
		}
		return new HistoryBatch(dataset, toMeta(dataset, meta), samples);
	}

	private JsonNode readTree(String body) {
		if (body == null || body.isBlank()) {
			throw new HistoryParseException("응답 본문이 비어 있습니다.");
		}
		try {
			return objectMapper.readTree(body);
		} catch (JsonProcessingException e) {
			throw new HistoryParseException("응답 JSON을 해석할 수 없습니다: " + e.getOriginalMessage(), e);
		}
	}

	private HistoryMeta toMeta(HistoryDataset dataset, JsonNode meta) {
		Map<String, Double> values = new LinkedHashMap<>();
		for (String field : dataset.metaFields()) {
			readNumber(meta, field).ifPresent(value -> values.put(field, value));
		}
		List<PoolEarnings> pools = dataset.hasPools() ? toPools(meta.path(POOLS)) : List.of();
		return new HistoryMeta(
			coerceTimestamp(meta.get(HistoryDataset.START_TIME)),
			coerceTimestamp(meta.get(HistoryDataset.END_TIME)),
			values,
			pools);
	}

	private IntervalSample toSample(HistoryDataset dataset, JsonNode interval) {
		if (!interval.isObject()) {
			throw new HistoryParseException(dataset + " 구간 항목이 객체가 아닙니다: " + interval);
		}
		long startTime = coerceTimestamp(interval.get(HistoryDataset.START_TIME));
		long endTime = coerceTimestamp(interval.get(HistoryDataset.END_TIME));
		if (startTime >= endTime) {
			throw new HistoryParseException(
				dataset + " 구간의 시작 시각이 종료 시각보다 늦거나 같습니다: " + startTime + " >= " + endTime);
		}

		Map<String, Double> values = new LinkedHashMap<>();
		for (SeriesField field : dataset.fields()) {
			readNumber(interval, field.name()).ifPresent(value -> values.put(field.name(), value));
		}
		List<PoolEarnings> pools = dataset.hasPools() ? toPools(interval.path(POOLS)) : List.of();
		return new IntervalSample(startTime, endTime, values, pools);
	}

	private List<PoolEarnings> toPools(JsonNode pools) {
		if (!pools.isArray()) {
			return List.of();
		}
		List<PoolEarnings> parsed = new ArrayList<>();
		for (JsonNode pool : pools) {
			String name = pool.path(POOL).asText("");
			if (name.isBlank()) {
				throw new HistoryParseException("풀 이름이 없는 수익 항목입니다: " + pool);
			}
			parsed.add(new PoolEarnings(
				name,
				requireNumber(pool, "assetLiquidityFees"),
				requireNumber(pool, "runeLiquidityFees"),
				requireNumber(pool, "totalLiquidityFeesRune"),
				requireNumber(pool, "saverEarning"),
				requireNumber(pool, "rewards"),
				requireNumber(pool, "earnings")));
		}
		return parsed;
	}

	private double requireNumber(JsonNode node, String field) {
		return readNumber(node, field)
			.orElseThrow(() -> new HistoryParseException("필수 숫자 필드가 없습니다: " + field));
	}

	/** 누락이나 null은 빈 값, 빈 문자열은 0, 숫자가 아닌 문자열은 예외입니다. */
	private Optional<Double> readNumber(JsonNode node, String field) {
		JsonNode value = node.get(field);
		if (value == null || value.isNull()) {
			return Optional.empty();
		}
		if (value.isNumber()) {
			return Optional.of(value.doubleValue());
		}
		if (value.isTextual()) {
			String text = value.textValue().trim();
			if (text.isEmpty()) {
				return Optional.of(0.0);
			}
			try {
				double parsed = Double.parseDouble(text);
				if (Double.isFinite(parsed)) {
					return Optional.of(parsed);
				}
			} catch (NumberFormatException e) {
				throw new HistoryParseException("숫자가 아닌 값입니다: " + field + "=" + text, e);
			}
		}
		throw new HistoryParseException("숫자가 아닌 값입니다: " + field + "=" + value);
	}

	/**
	 * 시각 값을 정수 초로 바꿉니다. 정수 숫자나 정수 문자열만 받고, 빈 문자열, {@code "null"}, JSON null, 누락은 0입니다.
	 */
	static long coerceTimestamp(JsonNode value) {
		if (value == null || value.isNull() || value.isMissingNode()) {
			return 0L;
		}
		if (value.isIntegralNumber() && value.canConvertToLong()) {
			return value.longValue();
		}
		if (value.isTextual()) {
			String text = value.textValue().trim();
			if (text.isEmpty() || "null".equalsIgnoreCase(text)) {
				return 0L;
			}
			try {
				return Long.parseLong(text);
			} catch (NumberFormatException e) {
				throw new HistoryParseException("정수 시각이 아닙니다: " + text, e);
			}
		}
		throw new HistoryParseException("정수 시각이 아닙니다: " + value);
	}
}
