package com.study.webflux.memory.infrastructure.vectordb.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QdrantDeleteRequest(
	List<String> points,
	QdrantFilter filter
) {
	public static QdrantDeleteRequest byIds(List<String> ids) {
		return new QdrantDeleteRequest(ids, null);
	}

	public static QdrantDeleteRequest byFilter(QdrantFilter filter) {
		return new QdrantDeleteRequest(null, filter);
	}
}
