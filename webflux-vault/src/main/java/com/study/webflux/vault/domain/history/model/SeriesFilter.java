package com.study.webflux.vault.domain.history.model;

/** 구간 필드에 대한 숫자 비교 조건입니다. 여러 조건은 AND로 결합됩니다. */
public record SeriesFilter(
	String field,
	ComparisonOperator operator,
	double value
) {
	public SeriesFilter {
		if (field == null || field.isBlank()) {
			throw new IllegalArgumentException("field cannot be null or blank");
		}
		if (operator == null) {
			throw new IllegalArgumentException("operator cannot be null");
		}
		if (!Double.isFinite(value)) {
			throw new IllegalArgumentException("value must be finite");
		}
	}

	public boolean matches(double actual) {
		return operator.test(actual, value);
	}

	public String toExpression() {
		return field + operator.symbol() + value;
	}
}
