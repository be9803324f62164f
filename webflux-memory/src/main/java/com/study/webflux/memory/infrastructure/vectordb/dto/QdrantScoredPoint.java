package com.study.webflux.memory.infrastructure.vectordb.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QdrantScoredPoint(
	String id,
	double score,
	Map<String, Object> payload
) {
}
