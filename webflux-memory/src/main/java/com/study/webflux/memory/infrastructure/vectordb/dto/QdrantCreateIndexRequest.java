package com.study.webflux.memory.infrastructure.vectordb.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QdrantCreateIndexRequest(
	@JsonProperty("field_name") String fieldName,
	@JsonProperty("field_schema") String fieldSchema
) {
}
