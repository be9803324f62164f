package com.study.webflux.memory.infrastructure.vectordb.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record QdrantScrollResponse(
	ScrollResult result
) {
	public List<QdrantRecord> pointsOrEmpty() {
		return result != null && result.points() != null ? result.points() : List.of();
	}

	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ScrollResult(
		List<QdrantRecord> points,
		@JsonProperty("next_page_offset") Object nextPageOffset
	) {
	}
}
