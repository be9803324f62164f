package com.study.webflux.memory.application.memory.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/** 통합 결정 응답 스키마입니다. */
public record ConsolidationDecisions(
	List<Decision> actions
) {

	public record Decision(
		@JsonPropertyDescription("One of ADD, UPDATE, DELETE, UNCHANGED") String type,
		@JsonPropertyDescription("Existing memory id, required for UPDATE and DELETE") String id,
		@JsonPropertyDescription("The new fact text") String text,
		@JsonPropertyDescription("Previous memory text replaced by an UPDATE") String oldFact
	) {
	}
}
