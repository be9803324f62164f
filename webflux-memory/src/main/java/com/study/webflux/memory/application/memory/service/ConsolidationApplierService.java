package com.study.webflux.memory.application.memory.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.memory.domain.memory.exception.ApplyFailureException;
import com.study.webflux.memory.domain.memory.model.CandidateRetrievalResult;
import com.study.webflux.memory.domain.memory.model.ConsolidationAction;
import com.study.webflux.memory.domain.memory.model.Memory;
import com.study.webflux.memory.domain.memory.model.MemoryEmbedding;
import com.study.webflux.memory.domain.memory.model.RememberContext;
import com.study.webflux.memory.domain.memory.model.UserId;
import com.study.webflux.memory.domain.memory.port.EmbeddingPort;
import com.study.webflux.memory.domain.memory.port.VectorMemoryPort;
import com.study.webflux.memory.infrastructure.monitoring.config.MemoryConsolidationMetricsConfiguration;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 검증된 결정을 순서대로 저장소에 반영합니다.
 *
 * <p>
 * 한 결정이 실패하면 나머지는 실행하지 않고 {@link ApplyFailureException}으로 종료합니다. 이미 반영된 결정은 되돌리지 않습니다.
 */
@Slf4j
@Service
public class ConsolidationApplierService {

	private final VectorMemoryPort vectorMemoryPort;
	private final EmbeddingPort embeddingPort;
	private final Clock clock;
	private final MemoryConsolidationMetricsConfiguration metrics;

	public ConsolidationApplierService(VectorMemoryPort vectorMemoryPort,
		EmbeddingPort embeddingPort,
		Clock clock,
		MemoryConsolidationMetricsConfiguration metrics) {
		this.vectorMemoryPort = vectorMemoryPort;
		this.embeddingPort = embeddingPort;
		this.clock = clock;
		this.metrics = metrics;
	}

	/**
	 * 새 기억의 생성 시각은 요청 시각(없으면 현재 시각)이고, 갱신은 항상 현재 시각으로 기록합니다.
	 *
	 * @return 반영된 결정 수 (UNCHANGED 포함)
	 */
	public Mono<Long> apply(List<ConsolidationAction> actions,
		CandidateRetrievalResult retrieval,
		RememberContext context) {
		Instant createdAt = context.timestamp() != null ? context.timestamp() : clock.instant();
		Set<String> deletedIds = ConcurrentHashMap.newKeySet();
		return Flux.range(0, actions.size())
			.concatMap(index -> {
				ConsolidationAction action = actions.get(index);
				return applyAction(action, retrieval, context.userId(), createdAt, deletedIds)
					.onErrorMap(error -> new ApplyFailureException(action, index, error))
					.thenReturn(action);
			})
			.doOnNext(action -> metrics.recordAction(action.type()))
			.count();
	}

	private Mono<Void> applyAction(ConsolidationAction action,
		CandidateRetrievalResult retrieval,
		UserId userId,
		Instant createdAt,
		Set<String> deletedIds) {
		return switch (action.type()) {
			case ADD -> add(action, retrieval, userId, createdAt);
			case UPDATE -> update(action, retrieval, userId, deletedIds);
			case DELETE -> vectorMemoryPort.deleteById(action.targetId())
				.doOnSuccess(v -> {
					deletedIds.add(action.targetId());
					log.debug("기억 삭제: id={}", action.targetId());
				});
			case UNCHANGED -> Mono.empty();
		};
	}

	private Mono<Void> add(ConsolidationAction action,
		CandidateRetrievalResult retrieval,
		UserId userId,
		Instant createdAt) {
		Memory memory = Memory.create(userId, action.text(), createdAt);
		Mono<MemoryEmbedding> embedding = retrieval.embeddingFor(action.text())
			.map(Mono::just)
			.orElseGet(() -> embed(action.text()));
		return embedding
			.flatMap(vector -> vectorMemoryPort.upsert(memory, vector.vector()))
			.doOnNext(saved -> log.debug("기억 추가: id={}, user={}", saved.id(), userId.value()))
			.then();
	}

	private Mono<Void> update(ConsolidationAction action,
		CandidateRetrievalResult retrieval,
		UserId userId,
		Set<String> deletedIds) {
		if (deletedIds.contains(action.targetId())) {
			return Mono.error(new IllegalStateException(
				"Update target was deleted earlier in the batch: " + action.targetId()));
		}
		Memory existing = retrieval.candidates()
			.find(action.targetId())
			.orElse(null);
		if (existing == null) {
			return Mono.error(new IllegalStateException(
				"Update target is not a candidate memory: " + action.targetId()));
		}
		if (!existing.isOwnedBy(userId)) {
			return Mono.error(new IllegalStateException(
				"Update target belongs to another user: " + action.targetId()));
		}
		Memory updated = existing.withContent(action.text(), clock.instant());
		return embed(action.text())
			.flatMap(vector -> vectorMemoryPort.upsert(updated, vector.vector()))
			.doOnNext(saved -> log.debug("기억 갱신: id={}, before='{}', after='{}'",
				saved.id(), existing.content(), saved.content()))
			.then();
	}

	private Mono<MemoryEmbedding> embed(String text) {
		return embeddingPort.embed(text)
			.switchIfEmpty(Mono.error(
				() -> new IllegalStateException("No embedding produced for memory text")));
	}
}
