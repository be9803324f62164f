package com.study.webflux.memory.application.memory.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.memory.application.memory.support.UserLockRegistry;
import com.study.webflux.memory.domain.memory.exception.MemoryConsolidationException;
import com.study.webflux.memory.domain.memory.exception.RetrievalFailureException;
import com.study.webflux.memory.domain.memory.model.Memory;
import com.study.webflux.memory.domain.memory.model.RememberContext;
import com.study.webflux.memory.domain.memory.model.ScoredMemory;
import com.study.webflux.memory.domain.memory.model.UserId;
import com.study.webflux.memory.domain.memory.port.EmbeddingPort;
import com.study.webflux.memory.domain.memory.port.MemoryUseCase;
import com.study.webflux.memory.domain.memory.port.VectorMemoryPort;
import com.study.webflux.memory.infrastructure.memory.config.MemoryConsolidationConfig;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Slf4j
@Service
public class MemoryService implements MemoryUseCase {

	private final MemoryConsolidationEngine consolidationEngine;
	private final UserLockRegistry userLockRegistry;
	private final EmbeddingPort embeddingPort;
	private final VectorMemoryPort vectorMemoryPort;
	private final MemoryConsolidationConfig config;
	private final Clock clock;

	public MemoryService(MemoryConsolidationEngine consolidationEngine,
		UserLockRegistry userLockRegistry,
		EmbeddingPort embeddingPort,
		VectorMemoryPort vectorMemoryPort,
		MemoryConsolidationConfig config,
		Clock clock) {
		this.consolidationEngine = consolidationEngine;
		this.userLockRegistry = userLockRegistry;
		this.embeddingPort = embeddingPort;
		this.vectorMemoryPort = vectorMemoryPort;
		this.config = config;
		this.clock = clock;
	}

	@Override
	public Mono<Void> remember(String text, RememberContext context) {
		if (context == null) {
			return Mono.error(new IllegalArgumentException("context cannot be null"));
		}
		return userLockRegistry.withLock(context.userId(),
			() -> consolidationEngine.consolidate(text, context));
	}

	@Override
	public Flux<ScoredMemory> recall(String query, UserId userId) {
		if (query == null || query.isBlank()) {
			return Flux.empty();
		}
		return embeddingPort.embed(query)
			.flatMapMany(embedding -> vectorMemoryPort.search(userId,
				embedding.vector(),
				config.recallScoreThreshold(),
				config.recallTopK()))
			.filter(scored -> scored.memory().isOwnedBy(userId))
			.sort(Comparator.comparingDouble(ScoredMemory::score).reversed())
			.onErrorMap(error -> !(error instanceof MemoryConsolidationException),
				error -> new RetrievalFailureException(
					"Memory recall failed: " + error.getMessage(), error));
	}

	@Override
	public Mono<Memory> fetch(String memoryId) {
		return vectorMemoryPort.findById(memoryId);
	}

	@Override
	public Mono<Memory> rename(String memoryId, String newContent) {
		if (newContent == null || newContent.isBlank()) {
			return Mono.error(new IllegalArgumentException("newContent cannot be null or blank"));
		}
		String content = newContent.strip();
		return vectorMemoryPort.findById(memoryId)
			.flatMap(found -> userLockRegistry.withLock(found.userId(),
				() -> vectorMemoryPort.findById(memoryId)
					.flatMap(existing -> embeddingPort.embed(content)
						.flatMap(embedding -> vectorMemoryPort.upsert(
							existing.withContent(content, clock.instant()),
							embedding.vector())))))
			.doOnNext(renamed -> log.debug("기억 내용 변경: id={}", renamed.id()));
	}

	@Override
	public Mono<Void> forget(String memoryId) {
		return vectorMemoryPort.deleteById(memoryId);
	}

	@Override
	public Mono<Void> forgetAll(UserId userId) {
		return userLockRegistry.withLock(userId, () -> vectorMemoryPort.deleteByUser(userId))
			.doOnSuccess(v -> log.info("사용자 기억 전체 삭제: user={}", userId.value()));
	}

	@Override
	public Flux<Memory> listByTimeRange(UserId userId, Instant start, Instant end, int limit) {
		if (start == null || end == null) {
			return Flux.error(new IllegalArgumentException("start and end cannot be null"));
		}
		if (start.isAfter(end)) {
			return Flux.error(new IllegalArgumentException("start must not be after end"));
		}
		if (limit <= 0) {
			return Flux.error(new IllegalArgumentException("limit must be positive"));
		}
		return vectorMemoryPort.findByCreatedAtBetween(userId, start, end, limit);
	}

	@Override
	public Flux<Memory> listByTimeRange(UserId userId, Instant start, Instant end) {
		return listByTimeRange(userId, start, end, config.rangeLimit());
	}
}
