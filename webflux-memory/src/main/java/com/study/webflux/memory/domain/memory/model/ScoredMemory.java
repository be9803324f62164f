package com.study.webflux.memory.domain.memory.model;

public record ScoredMemory(
	Memory memory,
	double score
) {
	public ScoredMemory {
		if (memory == null) {
			throw new IllegalArgumentException("memory cannot be null");
		}
	}

	public static ScoredMemory of(Memory memory, double score) {
		return new ScoredMemory(memory, score);
	}
}
