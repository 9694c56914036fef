package com.study.webflux.vault.domain.history.model;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@code "assetDepth>=1000"} 형태의 압축 필터 문자열을 {@link SeriesFilter}로 변환합니다.
 *
 * <p>
 * 연산자는 처음 나타나는 비교 기호에서 찾고, {@code >}/{@code <} 바로 뒤에 {@code =}가 오면 복합 연산자로 읽습니다. 필드 이름이
 * 식별자가 아니거나, 값 부분에 비교 기호가 더 있거나, 값이 유한한 숫자가 아니면 모호한 입력으로 보고 거부합니다. 알 수 없는 연산자를 등호로
 * 간주하지 않습니다.
 */
public final class SeriesFilterParser {

	private static final Pattern FIELD_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

	private SeriesFilterParser() {
	}

	public static Optional<SeriesFilter> parse(String expression) {
		if (expression == null || expression.isBlank()) {
			return Optional.empty();
		}

		String trimmed = expression.trim();
		int operatorIndex = indexOfOperator(trimmed);
		if (operatorIndex <= 0) {
			return Optional.empty();
		}

		int operatorLength = isCompound(trimmed, operatorIndex) ? 2 : 1;
		String symbol = trimmed.substring(operatorIndex, operatorIndex + operatorLength);
		String field = trimmed.substring(0, operatorIndex).trim();
		String rawValue = trimmed.substring(operatorIndex + operatorLength).trim();

		if (!FIELD_PATTERN.matcher(field).matches()
			|| rawValue.isEmpty()
			|| indexOfOperator(rawValue) >= 0) {
			return Optional.empty();
		}

		Optional<ComparisonOperator> operator = ComparisonOperator.fromSymbol(symbol);
		Optional<Double> value = parseValue(rawValue);
		if (operator.isEmpty() || value.isEmpty()) {
			return Optional.empty();
		}
		return Optional.of(new SeriesFilter(field, operator.get(), value.get()));
	}

	private static int indexOfOperator(String text) {
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '>' || c == '<' || c == '=') {
				return i;
			}
		}
		return -1;
	}

	private static boolean isCompound(String text, int index) {
		char c = text.charAt(index);
		return (c == '>' || c == '<')
			&& index + 1 < text.length()
			&& text.charAt(index + 1) == '=';
	}

	private static Optional<Double> parseValue(String rawValue) {
		try {
			double value = Double.parseDouble(rawValue);
			return Double.isFinite(value) ? Optional.of(value) : Optional.empty();
		} catch (NumberFormatException e) {
			return Optional.empty();
		}
	}
}
