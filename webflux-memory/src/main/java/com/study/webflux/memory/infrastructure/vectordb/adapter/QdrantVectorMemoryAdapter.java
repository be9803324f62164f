package com.study.webflux.memory.infrastructure.vectordb.adapter;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

import lombok.extern.slf4j.Slf4j;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import com.study.webflux.memory.domain.memory.model.Memory;
import com.study.webflux.memory.domain.memory.model.ScoredMemory;
import com.study.webflux.memory.domain.memory.model.UserId;
import com.study.webflux.memory.domain.memory.port.VectorMemoryPort;
import com.study.webflux.memory.infrastructure.memory.config.MemoryTimeoutConfig;
import com.study.webflux.memory.infrastructure.memory.config.QdrantConfig;
import com.study.webflux.memory.infrastructure.vectordb.dto.QdrantDeleteRequest;
import com.study.webflux.memory.infrastructure.vectordb.dto.QdrantFilter;
import com.study.webflux.memory.infrastructure.vectordb.dto.QdrantPoint;
import com.study.webflux.memory.infrastructure.vectordb.dto.QdrantRetrieveRequest;
import com.study.webflux.memory.infrastructure.vectordb.dto.QdrantRetrieveResponse;
import com.study.webflux.memory.infrastructure.vectordb.dto.QdrantScrollRequest;
import com.study.webflux.memory.infrastructure.vectordb.dto.QdrantScrollResponse;
import com.study.webflux.memory.infrastructure.vectordb.dto.QdrantSearchRequest;
import com.study.webflux.memory.infrastructure.vectordb.dto.QdrantSearchResponse;
import com.study.webflux.memory.infrastructure.vectordb.dto.QdrantUpsertRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Qdrant REST API 기반 기억 저장소 어댑터입니다.
 *
 * <p>
 * 변경 요청은 wait=true로 보내 응답 시점에 반영이 끝나도록 합니다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "memory.store.type", havingValue = "qdrant", matchIfMissing = true)
public class QdrantVectorMemoryAdapter implements VectorMemoryPort {

	private final WebClient webClient;
	private final String collectionName;
	private final MemoryTimeoutConfig timeouts;

	public QdrantVectorMemoryAdapter(WebClient.Builder webClientBuilder,
		QdrantConfig config,
		MemoryTimeoutConfig timeouts) {
		WebClient.Builder builder = webClientBuilder.clone()
			.baseUrl(config.url())
			.defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);

		if (config.apiKey() != null && !config.apiKey().isBlank()) {
			builder.defaultHeader("api-key", config.apiKey());
		}

		this.webClient = builder.build();
		this.collectionName = config.collectionName();
		this.timeouts = timeouts;
	}

	@Override
	public Mono<Memory> upsert(Memory memory, List<Float> embedding) {
		QdrantPoint point = new QdrantPoint(memory.id(), embedding,
			QdrantPayloadMapper.toPayload(memory));
		QdrantUpsertRequest request = new QdrantUpsertRequest(List.of(point));

		return webClient.put()
			.uri("/collections/{collection}/points?wait=true", collectionName)
			.bodyValue(request)
			.retrieve()
			.toBodilessEntity()
			.timeout(timeouts.storage())
			.thenReturn(memory);
	}

	@Override
	public Mono<Memory> findById(String memoryId) {
		if (!isPointId(memoryId)) {
			return Mono.empty();
		}
		return webClient.post()
			.uri("/collections/{collection}/points", collectionName)
			.bodyValue(QdrantRetrieveRequest.payloadOnly(memoryId))
			.retrieve()
			.bodyToMono(QdrantRetrieveResponse.class)
			.timeout(timeouts.storage())
			.flatMap(response -> Mono.justOrEmpty(response.resultOrEmpty().stream().findFirst()))
			.map(point -> QdrantPayloadMapper.toMemory(point.id(), point.payload()));
	}

	@Override
	public Mono<Void> deleteById(String memoryId) {
		if (!isPointId(memoryId)) {
			return Mono.empty();
		}
		return delete(QdrantDeleteRequest.byIds(List.of(memoryId)));
	}

	@Override
	public Mono<Void> deleteByUser(UserId userId) {
		return delete(QdrantDeleteRequest.byFilter(userFilter(userId)));
	}

	@Override
	public Flux<ScoredMemory> search(UserId userId,
		List<Float> queryEmbedding,
		float scoreThreshold,
		int topK) {
		QdrantSearchRequest request = new QdrantSearchRequest(queryEmbedding,
			topK,
			true,
			userFilter(userId),
			scoreThreshold);

		return webClient.post()
			.uri("/collections/{collection}/points/search", collectionName)
			.bodyValue(request)
			.retrieve()
			.bodyToMono(QdrantSearchResponse.class)
			.timeout(timeouts.storage())
			.flatMapMany(response -> Flux.fromIterable(response.resultOrEmpty()))
			.map(point -> ScoredMemory.of(
				QdrantPayloadMapper.toMemory(point.id(), point.payload()), point.score()))
			.filter(scored -> scored.memory().isOwnedBy(userId));
	}

	@Override
	public Flux<Memory> findByCreatedAtBetween(UserId userId,
		Instant start,
		Instant end,
		int limit) {
		QdrantFilter filter = QdrantFilter.of(
			QdrantFilter.FilterCondition.matchValue(QdrantPayloadMapper.USER_ID, userId.value()),
			QdrantFilter.FilterCondition.between(QdrantPayloadMapper.CREATED_AT,
				start.toEpochMilli(),
				end.toEpochMilli()));

		return webClient.post()
			.uri("/collections/{collection}/points/scroll", collectionName)
			.bodyValue(QdrantScrollRequest.payloadOnly(filter, limit,
				QdrantScrollRequest.OrderBy.ascending(QdrantPayloadMapper.CREATED_AT)))
			.retrieve()
			.bodyToMono(QdrantScrollResponse.class)
			.timeout(timeouts.storage())
			.flatMapMany(response -> Flux.fromIterable(response.pointsOrEmpty()))
			.map(point -> QdrantPayloadMapper.toMemory(point.id(), point.payload()))
			.filter(memory -> memory.isOwnedBy(userId))
			.sort(Comparator.comparing(Memory::createdAt));
	}

	private Mono<Void> delete(QdrantDeleteRequest request) {
		return webClient.post()
			.uri("/collections/{collection}/points/delete?wait=true", collectionName)
			.bodyValue(request)
			.retrieve()
			.toBodilessEntity()
			.timeout(timeouts.storage())
			.doOnError(e -> log.warn("Qdrant 삭제 요청 실패: collection={}, error={}",
				collectionName, e.getMessage()))
			.then();
	}

	/**
	 * Qdrant 포인트 ID는 UUID 또는 부호 없는 정수만 허용됩니다. 그 외 ID는 저장될 수 없으므로 요청 없이 없는 것으로 봅니다.
	 */
	static boolean isPointId(String memoryId) {
		if (memoryId == null || memoryId.isBlank()) {
			return false;
		}
		if (memoryId.chars().allMatch(c -> c >= '0' && c <= '9')) {
			return memoryId.length() <= 20;
		}
		try {
			return UUID.fromString(memoryId).toString().equalsIgnoreCase(memoryId);
		} catch (IllegalArgumentException e) {
			return false;
		}
	}

	private QdrantFilter userFilter(UserId userId) {
		return QdrantFilter.of(
			QdrantFilter.FilterCondition.matchValue(QdrantPayloadMapper.USER_ID, userId.value()));
	}
}
