package com.study.webflux.vault.domain.history.model;

import java.util.Arrays;
import java.util.Optional;

/** 필터 비교 연산자입니다. 복합 기호가 단일 기호보다 먼저 오도록 선언 순서를 유지합니다. */
public enum ComparisonOperator {

	GREATER_EQ(">="),
	LESS_EQ("<="),
	GREATER(">"),
	LESS("<"),
	EQUAL("=");

	private final String symbol;

	ComparisonOperator(String symbol) {
		this.symbol = symbol;
	}

	public String symbol() {
		return symbol;
	}

	public boolean test(double actual, double expected) {
		return switch (this) {
			case GREATER_EQ -> actual >= expected;
			case LESS_EQ -> actual <= expected;
			case GREATER -> actual > expected;
			case LESS -> actual < expected;
			case EQUAL -> Double.compare(actual, expected) == 0;
		};
	}

	public static Optional<ComparisonOperator> fromSymbol(String symbol) {
		return Arrays.stream(values())
			.filter(operator -> operator.symbol.equals(symbol))
			.findFirst();
	}
}
