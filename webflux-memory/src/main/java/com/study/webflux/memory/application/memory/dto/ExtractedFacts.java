package com.study.webflux.memory.application.memory.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/** 사실 추출 응답 스키마입니다. */
public record ExtractedFacts(
	@JsonPropertyDescription("Short, self-contained factual statements about the user") List<String> facts
) {
}
