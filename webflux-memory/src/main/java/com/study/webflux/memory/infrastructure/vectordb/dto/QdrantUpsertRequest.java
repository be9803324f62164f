package com.study.webflux.memory.infrastructure.vectordb.dto;

import java.util.List;

public record QdrantUpsertRequest(
	List<QdrantPoint> points
) {
}
