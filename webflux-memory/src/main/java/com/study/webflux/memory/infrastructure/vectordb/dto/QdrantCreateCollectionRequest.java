package com.study.webflux.memory.infrastructure.vectordb.dto;

public record QdrantCreateCollectionRequest(
	VectorParams vectors
) {
	public record VectorParams(
		int size,
		String distance
	) {
	}
}
