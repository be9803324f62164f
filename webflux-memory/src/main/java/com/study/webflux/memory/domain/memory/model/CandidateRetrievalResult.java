package com.study.webflux.memory.domain.memory.model;

import java.util.Map;
import java.util.Optional;

/**
 * 후보 기억 집합과, 검색 중 계산한 사실별 임베딩입니다. 임베딩은 ADD 적용 시 재사용됩니다.
 */
public record CandidateRetrievalResult(
	CandidateMemories candidates,
	Map<String, MemoryEmbedding> embeddingsByFactText
) {
	public CandidateRetrievalResult {
		if (candidates == null) {
			candidates = CandidateMemories.empty();
		}
		embeddingsByFactText = embeddingsByFactText == null ? Map.of()
			: Map.copyOf(embeddingsByFactText);
	}

	public Optional<MemoryEmbedding> embeddingFor(String factText) {
		return Optional.ofNullable(embeddingsByFactText.get(factText));
	}
}
