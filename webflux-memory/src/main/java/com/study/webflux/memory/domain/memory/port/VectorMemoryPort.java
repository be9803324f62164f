package com.study.webflux.memory.domain.memory.port;

import java.time.Instant;
import java.util.List;

import com.study.webflux.memory.domain.memory.model.Memory;
import com.study.webflux.memory.domain.memory.model.ScoredMemory;
import com.study.webflux.memory.domain.memory.model.UserId;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * 기억 저장소 협력자입니다.
 *
 * <p>
 * 저장소는 사용자 격리를 스스로 보장하지 않습니다. 검색/스캔/필터 삭제는 항상 호출자가 넘긴 사용자 조건으로만 동작합니다.
 */
public interface VectorMemoryPort {

	/** 같은 ID가 있으면 덮어씁니다. */
	Mono<Memory> upsert(Memory memory, List<Float> embedding);

	Mono<Memory> findById(String memoryId);

	Mono<Void> deleteById(String memoryId);

	Mono<Void> deleteByUser(UserId userId);

	/**
	 * 사용자 범위에서 유사도 순으로 최대 topK개를 반환합니다. scoreThreshold 미만은 제외됩니다.
	 */
	Flux<ScoredMemory> search(UserId userId,
		List<Float> queryEmbedding,
		float scoreThreshold,
		int topK);

	/** 생성 시각이 [start, end] 구간에 있는 기억을 최대 limit개 반환합니다. */
	Flux<Memory> findByCreatedAtBetween(UserId userId, Instant start, Instant end, int limit);
}
