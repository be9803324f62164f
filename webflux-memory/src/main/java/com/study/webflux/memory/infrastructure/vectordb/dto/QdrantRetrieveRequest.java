package com.study.webflux.memory.infrastructure.vectordb.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QdrantRetrieveRequest(
	List<String> ids,
	@JsonProperty("with_payload") boolean withPayload,
	@JsonProperty("with_vector") boolean withVector
) {
	public static QdrantRetrieveRequest payloadOnly(String id) {
		return new QdrantRetrieveRequest(List.of(id), true, false);
	}
}
