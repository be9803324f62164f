package com.study.webflux.memory.infrastructure.memory.config;

public record QdrantConfig(
	String url,
	String apiKey,
	String collectionName,
	int vectorDimension,
	boolean autoCreateCollection
) {
}
