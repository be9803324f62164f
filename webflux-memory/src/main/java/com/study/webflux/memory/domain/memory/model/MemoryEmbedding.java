package com.study.webflux.memory.domain.memory.model;

import java.util.List;

public record MemoryEmbedding(
	String text,
	List<Float> vector
) {
	public MemoryEmbedding {
		if (text == null) {
			throw new IllegalArgumentException("text cannot be null");
		}
		if (vector == null || vector.isEmpty()) {
			throw new IllegalArgumentException("vector cannot be null or empty");
		}
		vector = List.copyOf(vector);
	}

	public static MemoryEmbedding of(String text, List<Float> vector) {
		return new MemoryEmbedding(text, vector);
	}

	public int dimension() {
		return vector.size();
	}
}
