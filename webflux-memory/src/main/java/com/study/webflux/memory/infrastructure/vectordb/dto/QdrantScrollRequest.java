package com.study.webflux.memory.infrastructure.vectordb.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record QdrantScrollRequest(
	QdrantFilter filter,
	int limit,
	@JsonProperty("with_payload") boolean withPayload,
	@JsonProperty("with_vector") boolean withVector,
	@JsonProperty("order_by") OrderBy orderBy
) {
	public static QdrantScrollRequest payloadOnly(QdrantFilter filter, int limit, OrderBy orderBy) {
		return new QdrantScrollRequest(filter, limit, true, false, orderBy);
	}

	/**
	 * 정렬 기준 필드에는 range 인덱스가 있어야 합니다.
	 */
	public record OrderBy(
		String key,
		String direction
	) {
		public static OrderBy ascending(String key) {
			return new OrderBy(key, "asc");
		}
	}
}
