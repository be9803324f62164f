package com.study.webflux.memory.application.memory.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.memory.domain.memory.exception.MemoryConsolidationException;
import com.study.webflux.memory.domain.memory.exception.RetrievalFailureException;
import com.study.webflux.memory.domain.memory.model.CandidateMemories;
import com.study.webflux.memory.domain.memory.model.CandidateRetrievalResult;
import com.study.webflux.memory.domain.memory.model.Fact;
import com.study.webflux.memory.domain.memory.model.Memory;
import com.study.webflux.memory.domain.memory.model.MemoryEmbedding;
import com.study.webflux.memory.domain.memory.model.ScoredMemory;
import com.study.webflux.memory.domain.memory.model.UserId;
import com.study.webflux.memory.domain.memory.port.EmbeddingPort;
import com.study.webflux.memory.domain.memory.port.VectorMemoryPort;
import com.study.webflux.memory.infrastructure.memory.config.MemoryConsolidationConfig;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 사실마다 따로 임베딩/유사도 검색을 수행해 사용자 범위의 후보 기억을 모읍니다.
 *
 * <p>
 * 사실별 조회는 설정된 동시성 한도 안에서 병렬로 실행되고, 결과는 기억 ID 기준으로 합쳐집니다. 한 사실이라도 조회에 실패하면 전체가
 * 실패합니다.
 */
@Slf4j
@Service
public class CandidateRetrievalService {

	private final EmbeddingPort embeddingPort;
	private final VectorMemoryPort vectorMemoryPort;
	private final int candidateTopK;
	private final float candidateScoreThreshold;
	private final int embeddingConcurrency;

	public CandidateRetrievalService(EmbeddingPort embeddingPort,
		VectorMemoryPort vectorMemoryPort,
		MemoryConsolidationConfig config) {
		this.embeddingPort = embeddingPort;
		this.vectorMemoryPort = vectorMemoryPort;
		this.candidateTopK = config.candidateTopK();
		this.candidateScoreThreshold = config.candidateScoreThreshold();
		this.embeddingConcurrency = config.embeddingConcurrency();
	}

	/**
	 * @param facts
	 *            추출된 사실 (같은 문장은 한 번만 조회)
	 * @param userId
	 *            검색 범위 사용자
	 * @return ID 기준으로 합쳐진 후보 기억과 사실별 임베딩
	 */
	public Mono<CandidateRetrievalResult> findCandidates(List<Fact> facts, UserId userId) {
		return Flux.fromIterable(distinctByText(facts))
			.flatMapSequential(fact -> lookup(fact, userId), embeddingConcurrency)
			.collectList()
			.map(this::merge)
			.doOnNext(result -> log.debug("후보 기억 수집 완료: user={}, facts={}, candidates={}",
				userId.value(),
				result.embeddingsByFactText().size(),
				result.candidates().size()))
			.onErrorMap(error -> !(error instanceof MemoryConsolidationException),
				error -> new RetrievalFailureException(
					"Candidate retrieval failed: " + error.getMessage(), error));
	}

	private Mono<FactLookup> lookup(Fact fact, UserId userId) {
		return embeddingPort.embed(fact.text())
			.switchIfEmpty(Mono.error(
				() -> new IllegalStateException("No embedding produced for fact")))
			.flatMap(embedding -> vectorMemoryPort
				.search(userId, embedding.vector(), candidateScoreThreshold, candidateTopK)
				.map(ScoredMemory::memory)
				.filter(memory -> memory.isOwnedBy(userId))
				.collectList()
				.map(matches -> new FactLookup(fact, embedding, matches)));
	}

	private CandidateRetrievalResult merge(List<FactLookup> lookups) {
		CandidateMemories candidates = CandidateMemories.empty();
		Map<String, MemoryEmbedding> embeddings = new LinkedHashMap<>();
		for (FactLookup lookup : lookups) {
			candidates.register(lookup.fact(), lookup.matches());
			embeddings.put(lookup.fact().text(), lookup.embedding());
		}
		return new CandidateRetrievalResult(candidates, embeddings);
	}

	private List<Fact> distinctByText(List<Fact> facts) {
		Map<String, Fact> distinct = new LinkedHashMap<>();
		facts.forEach(fact -> distinct.putIfAbsent(fact.text(), fact));
		return List.copyOf(distinct.values());
	}

	private record FactLookup(
		Fact fact,
		MemoryEmbedding embedding,
		List<Memory> matches
	) {
	}
}
