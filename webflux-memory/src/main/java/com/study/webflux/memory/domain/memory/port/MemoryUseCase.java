package com.study.webflux.memory.domain.memory.port;

import java.time.Instant;

import com.study.webflux.memory.domain.memory.model.Memory;
import com.study.webflux.memory.domain.memory.model.RememberContext;
import com.study.webflux.memory.domain.memory.model.ScoredMemory;
import com.study.webflux.memory.domain.memory.model.UserId;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 기억 엔진이 호출자에게 제공하는 진입점입니다.
 */
public interface MemoryUseCase {

	/**
	 * 입력 문장을 사실로 나누고 기존 기억과 통합해 저장합니다.
	 *
	 * <p>
	 * 실패 시 {@link com.study.webflux.memory.domain.memory.exception.MemoryConsolidationException}
	 * 하위 타입 중 하나로 종료됩니다. ApplyFailure의 경우 실패 지점 이전의 결정은 이미 반영되어 있습니다.
	 */
	Mono<Void> remember(String text, RememberContext context);

	/** 질의와 의미적으로 가까운 기억을 점수 내림차순으로 반환합니다. */
	Flux<ScoredMemory> recall(String query, UserId userId);

	/** 없으면 빈 Mono를 반환합니다. */
	Mono<Memory> fetch(String memoryId);

	/** 내용을 바꾸고 임베딩을 다시 계산합니다. 없으면 빈 Mono를 반환합니다. */
	Mono<Memory> rename(String memoryId, String newContent);

	Mono<Void> forget(String memoryId);

	Mono<Void> forgetAll(UserId userId);

	Flux<Memory> listByTimeRange(UserId userId, Instant start, Instant end, int limit);

	Flux<Memory> listByTimeRange(UserId userId, Instant start, Instant end);
}
