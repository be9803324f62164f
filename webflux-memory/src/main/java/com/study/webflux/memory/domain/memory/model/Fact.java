package com.study.webflux.memory.domain.memory.model;

/**
 * 입력 문장에서 추출한 원자적 사실입니다. 한 번의 remember 호출 동안만 존재합니다.
 */
public record Fact(
	String text
) {
	public Fact {
		if (text == null || text.isBlank()) {
			throw new IllegalArgumentException("fact text cannot be null or blank");
		}
		text = text.strip();
	}

	public static Fact of(String text) {
		return new Fact(text);
	}
}
