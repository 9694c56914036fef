package com.study.webflux.vault.domain.history.model;

public record SeriesField(
	String name,
	Reducer reducer,
	boolean integral
) {
	public SeriesField {
		if (name == null || name.isBlank()) {
			throw new IllegalArgumentException("name cannot be null or blank");
		}
		if (reducer == null) {
			throw new IllegalArgumentException("reducer cannot be null");
		}
	}

	public static SeriesField sum(String name) {
		return new SeriesField(name, Reducer.SUM, false);
	}

	public static SeriesField sumCount(String name) {
		return new SeriesField(name, Reducer.SUM, true);
	}

	public static SeriesField avg(String name) {
		return new SeriesField(name, Reducer.AVG, false);
	}

	public static SeriesField avgCount(String name) {
		return new SeriesField(name, Reducer.AVG, true);
	}
}
