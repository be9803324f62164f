package com.study.webflux.memory.application.memory.service;

import java.util.List;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.memory.domain.memory.exception.MemoryConsolidationException;
import com.study.webflux.memory.domain.memory.model.Fact;
import com.study.webflux.memory.domain.memory.model.RememberContext;
import com.study.webflux.memory.infrastructure.monitoring.config.MemoryConsolidationMetricsConfiguration;
import reactor.core.publisher.Mono;

/**
 * 추출 → 후보 검색 → 통합 결정 → 적용 순서로 remember 한 번을 처리합니다.
 *
 * <p>
 * 추출된 사실이 없으면 이후 단계는 실행되지 않습니다. 동일 사용자의 동시 호출 직렬화는 호출자가 책임집니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MemoryConsolidationEngine {

	private final FactExtractionService factExtractionService;
	private final CandidateRetrievalService candidateRetrievalService;
	private final ConsolidationResolverService consolidationResolverService;
	private final ConsolidationApplierService consolidationApplierService;
	private final MemoryConsolidationMetricsConfiguration metrics;

	public Mono<Void> consolidate(String inputText, RememberContext context) {
		return factExtractionService.extract(inputText)
			.doOnNext(facts -> metrics.recordExtractedFacts(facts.size()))
			.flatMap(facts -> {
				if (facts.isEmpty()) {
					log.debug("추출된 사실이 없어 통합을 건너뜁니다: user={}", context.userId().value());
					return Mono.<Void>empty();
				}
				return consolidateFacts(facts, context);
			})
			.doOnSuccess(v -> metrics.recordRememberSuccess())
			.doOnError(MemoryConsolidationException.class, error -> {
				metrics.recordRememberFailure(error.getStage());
				log.error("기억 통합 실패: user={}, stage={}, message={}",
					context.userId().value(), error.getStage(), error.getMessage());
			});
	}

	private Mono<Void> consolidateFacts(List<Fact> facts, RememberContext context) {
		return candidateRetrievalService.findCandidates(facts, context.userId())
			.doOnNext(retrieval -> metrics.recordCandidates(retrieval.candidates().size()))
			.flatMap(retrieval -> consolidationResolverService
				.resolve(retrieval.candidates(), facts)
				.flatMap(actions -> consolidationApplierService.apply(actions, retrieval, context)))
			.doOnNext(applied -> log.info("기억 통합 완료: user={}, facts={}, actions={}",
				context.userId().value(), facts.size(), applied))
			.then();
	}
}
