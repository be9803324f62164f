package com.study.webflux.memory.infrastructure.vectordb.dto;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QdrantRecord(
	String id,
	Map<String, Object> payload
) {
}
