package com.study.webflux.memory.infrastructure.vectordb.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QdrantSearchRequest(
	List<Float> vector,
	int limit,
	@JsonProperty("with_payload") boolean withPayload,
	QdrantFilter filter,
	@JsonProperty("score_threshold") Float scoreThreshold
) {
}
