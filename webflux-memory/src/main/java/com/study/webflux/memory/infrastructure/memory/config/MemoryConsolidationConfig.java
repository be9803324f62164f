package com.study.webflux.memory.infrastructure.memory.config;

public record MemoryConsolidationConfig(
	int candidateTopK,
	float candidateScoreThreshold,
	int embeddingConcurrency,
	int recallTopK,
	float recallScoreThreshold,
	int rangeLimit
) {
	public MemoryConsolidationConfig {
		if (candidateTopK <= 0 || recallTopK <= 0 || rangeLimit <= 0) {
			throw new IllegalArgumentException("topK/limit 설정값은 0 이하일 수 없습니다.");
		}
		if (embeddingConcurrency <= 0) {
			throw new IllegalArgumentException("embeddingConcurrency 설정값은 0 이하일 수 없습니다.");
		}
	}

	public static MemoryConsolidationConfig defaults() {
		return new MemoryConsolidationConfig(5, 0.5f, 4, 10, 0.3f, 50);
	}
}
