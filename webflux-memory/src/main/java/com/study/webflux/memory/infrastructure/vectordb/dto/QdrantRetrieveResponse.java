package com.study.webflux.memory.infrastructure.vectordb.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QdrantRetrieveResponse(
	List<QdrantRecord> result
) {
	public List<QdrantRecord> resultOrEmpty() {
		return result != null ? result : List.of();
	}
}
