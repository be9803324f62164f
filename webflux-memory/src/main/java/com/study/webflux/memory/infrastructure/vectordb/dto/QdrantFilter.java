package com.study.webflux.memory.infrastructure.vectordb.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Qdrant의 must 조건 필터입니다. */
public record QdrantFilter(
	List<FilterCondition> must
) {

	public static QdrantFilter of(FilterCondition... conditions) {
		return new QdrantFilter(List.of(conditions));
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record FilterCondition(
		String key,
		Match match,
		Range range
	) {
		public static FilterCondition matchValue(String key, Object value) {
			return new FilterCondition(key, new Match(value), null);
		}

		public static FilterCondition between(String key, long gte, long lte) {
			return new FilterCondition(key, null, new Range(gte, lte));
		}
	}

	public record Match(
		Object value
	) {
	}

	@JsonInclude(JsonInclude.Include.NON_NULL)
	public record Range(
		Long gte,
		Long lte
	) {
	}
}
