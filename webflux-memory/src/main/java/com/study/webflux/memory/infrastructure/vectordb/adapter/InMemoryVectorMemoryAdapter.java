package com.study.webflux.memory.infrastructure.vectordb.adapter;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import com.study.webflux.memory.domain.memory.model.Memory;
import com.study.webflux.memory.domain.memory.model.ScoredMemory;
import com.study.webflux.memory.domain.memory.model.UserId;
import com.study.webflux.memory.domain.memory.port.VectorMemoryPort;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/** 코사인 유사도 기반 인메모리 기억 저장소 어댑터입니다. */
@Component
@ConditionalOnProperty(name = "memory.store.type", havingValue = "in-memory")
public class InMemoryVectorMemoryAdapter implements VectorMemoryPort {

	private final Map<String, StoredPoint> points = new ConcurrentHashMap<>();

	@Override
	public Mono<Memory> upsert(Memory memory, List<Float> embedding) {
		return Mono.fromSupplier(() -> {
			points.put(memory.id(), new StoredPoint(memory, List.copyOf(embedding)));
			return memory;
		});
	}

	@Override
	public Mono<Memory> findById(String memoryId) {
		return Mono.fromSupplier(() -> points.get(memoryId)).map(StoredPoint::memory);
	}

	@Override
	public Mono<Void> deleteById(String memoryId) {
		return Mono.fromRunnable(() -> points.remove(memoryId));
	}

	@Override
	public Mono<Void> deleteByUser(UserId userId) {
		return Mono.fromRunnable(
			() -> points.values().removeIf(point -> point.memory().isOwnedBy(userId)));
	}

	/** 사용자 범위 안에서 코사인 유사도를 계산해 임계값 이상만 점수 내림차순으로 반환합니다. */
	@Override
	public Flux<ScoredMemory> search(UserId userId,
		List<Float> queryEmbedding,
		float scoreThreshold,
		int topK) {
		return Flux.defer(() -> Flux.fromIterable(points.values().stream()
			.filter(point -> point.memory().isOwnedBy(userId))
			.map(point -> ScoredMemory.of(point.memory(),
				cosineSimilarity(queryEmbedding, point.vector())))
			.filter(scored -> scored.score() >= scoreThreshold)
			.sorted(Comparator.comparingDouble(ScoredMemory::score).reversed())
			.limit(topK)
			.toList()));
	}

	@Override
	public Flux<Memory> findByCreatedAtBetween(UserId userId,
		Instant start,
		Instant end,
		int limit) {
		return Flux.defer(() -> Flux.fromIterable(points.values().stream()
			.map(StoredPoint::memory)
			.filter(memory -> memory.isOwnedBy(userId))
			.filter(memory -> !memory.createdAt().isBefore(start)
				&& !memory.createdAt().isAfter(end))
			.sorted(Comparator.comparing(Memory::createdAt))
			.limit(limit)
			.toList()));
	}

	static double cosineSimilarity(List<Float> left, List<Float> right) {
		if (left.size() != right.size()) {
			throw new IllegalArgumentException(
				"vector dimension mismatch: " + left.size() + " != " + right.size());
		}
		double dot = 0.0;
		double leftNorm = 0.0;
		double rightNorm = 0.0;
		for (int i = 0; i < left.size(); i++) {
			double a = left.get(i);
			double b = right.get(i);
			dot += a * b;
			leftNorm += a * a;
			rightNorm += b * b;
		}
		if (leftNorm == 0.0 || rightNorm == 0.0) {
			return 0.0;
		}
		return dot / (Math.sqrt(leftNorm) * Math.sqrt(rightNorm));
	}

	private record StoredPoint(
		Memory memory,
		List<Float> vector
	) {
	}
}
