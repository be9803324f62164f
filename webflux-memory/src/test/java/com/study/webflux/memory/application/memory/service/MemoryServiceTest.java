package com.study.webflux.memory.application.memory.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import com.study.webflux.memory.application.memory.support.UserLockRegistry;
import com.study.webflux.memory.domain.memory.exception.RetrievalFailureException;
import com.study.webflux.memory.domain.memory.model.Memory;
import com.study.webflux.memory.domain.memory.model.MemoryEmbedding;
import com.study.webflux.memory.domain.memory.model.RememberContext;
import com.study.webflux.memory.domain.memory.model.ScoredMemory;
import com.study.webflux.memory.domain.memory.model.UserId;
import com.study.webflux.memory.domain.memory.port.EmbeddingPort;
import com.study.webflux.memory.domain.memory.port.VectorMemoryPort;
import com.study.webflux.memory.fixture.MemoryFixture;
import com.study.webflux.memory.fixture.UserIdFixture;
import com.study.webflux.memory.infrastructure.memory.config.MemoryConsolidationConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MemoryServiceTest {

	private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");
	private static final List<Float> QUERY_VECTOR = List.of(0.1f, 0.2f);

	@Mock
	private MemoryConsolidationEngine consolidationEngine;

	@Mock
	private EmbeddingPort embeddingPort;

	@Mock
	private VectorMemoryPort vectorMemoryPort;

	private MemoryService service;

	private final UserId userId = UserIdFixture.create();

	@BeforeEach
	void setUp() {
		service = new MemoryService(consolidationEngine, new UserLockRegistry(), embeddingPort,
			vectorMemoryPort, MemoryConsolidationConfig.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
	}

	@Test
	@DisplayName("remember는 통합 엔진에 입력과 컨텍스트를 그대로 넘긴다")
	void remember_shouldDelegateToEngine() {
		RememberContext context = RememberContext.of(userId);
		when(consolidationEngine.consolidate("I like tea", context)).thenReturn(Mono.empty());

		StepVerifier.create(service.remember("I like tea", context)).verifyComplete();

		verify(consolidationEngine).consolidate("I like tea", context);
	}

	@Test
	@DisplayName("같은 사용자의 remember 호출은 동시에 하나만 진행된다")
	void remember_shouldSerializeCallsForSameUser() {
		AtomicInteger inFlight = new AtomicInteger();
		AtomicInteger maxInFlight = new AtomicInteger();
		when(consolidationEngine.consolidate(anyString(), any(RememberContext.class)))
			.thenAnswer(invocation -> trackedConsolidation(inFlight, maxInFlight));

		StepVerifier.create(Mono.when(
			service.remember("I like tea", RememberContext.of(userId)),
			service.remember("I moved to Seoul", RememberContext.of(userId)),
			service.remember("I work as a UX designer", RememberContext.of(userId))))
			.expectComplete()
			.verify(Duration.ofSeconds(5));

		assertThat(maxInFlight.get()).isEqualTo(1);
		verify(consolidationEngine, times(3)).consolidate(anyString(), any(RememberContext.class));
	}

	@Test
	@DisplayName("서로 다른 사용자의 remember 호출은 동시에 진행된다")
	void remember_shouldRunConcurrentlyForDifferentUsers() {
		AtomicInteger inFlight = new AtomicInteger();
		AtomicInteger maxInFlight = new AtomicInteger();
		when(consolidationEngine.consolidate(anyString(), any(RememberContext.class)))
			.thenAnswer(invocation -> trackedConsolidation(inFlight, maxInFlight));

		StepVerifier.create(Mono.when(
			service.remember("I like tea", RememberContext.of(userId)),
			service.remember("I like coffee", RememberContext.of(UserIdFixture.other()))))
			.expectComplete()
			.verify(Duration.ofSeconds(5));

		assertThat(maxInFlight.get()).isEqualTo(2);
	}

	@Test
	@DisplayName("recall은 설정된 임계값과 개수로 검색하고 점수 내림차순으로 반환한다")
	void recall_shouldSearchWithRecallSettingsAndSortByScore() {
		Memory low = MemoryFixture.createWithId("m-low", "The user likes tea");
		Memory high = MemoryFixture.createWithId("m-high", "The user likes green tea");
		when(embeddingPort.embed("tea")).thenReturn(Mono.just(MemoryEmbedding.of("tea", QUERY_VECTOR)));
		when(vectorMemoryPort.search(userId, QUERY_VECTOR, 0.3f, 10))
			.thenReturn(Flux.just(ScoredMemory.of(low, 0.4), ScoredMemory.of(high, 0.9)));

		StepVerifier.create(service.recall("tea", userId))
			.assertNext(scored -> assertThat(scored.memory().id()).isEqualTo("m-high"))
			.assertNext(scored -> assertThat(scored.memory().id()).isEqualTo("m-low"))
			.verifyComplete();
	}

	@Test
	@DisplayName("recall 중 임베딩 실패는 검색 실패로 변환된다")
	void recall_shouldWrapEmbeddingFailure() {
		when(embeddingPort.embed("tea")).thenReturn(Mono.error(new IllegalStateException("timeout")));

		StepVerifier.create(service.recall("tea", userId))
			.expectError(RetrievalFailureException.class)
			.verify();
	}

	@Test
	@DisplayName("rename은 ID, 소유자, 생성 시각을 유지하고 임베딩을 다시 계산한다")
	void rename_shouldReembedAndKeepIdentity() {
		Memory existing = MemoryFixture.createWithId("m-1", userId, "The user lives in Busan");
		when(vectorMemoryPort.findById("m-1")).thenReturn(Mono.just(existing));
		when(embeddingPort.embed("The user lives in Seoul"))
			.thenReturn(Mono.just(MemoryEmbedding.of("The user lives in Seoul", QUERY_VECTOR)));
		when(vectorMemoryPort.upsert(any(Memory.class), eq(QUERY_VECTOR)))
			.thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

		StepVerifier.create(service.rename("m-1", "  The user lives in Seoul "))
			.assertNext(renamed -> {
				assertThat(renamed.id()).isEqualTo("m-1");
				assertThat(renamed.userId()).isEqualTo(userId);
				assertThat(renamed.content()).isEqualTo("The user lives in Seoul");
				assertThat(renamed.createdAt()).isEqualTo(existing.createdAt());
				assertThat(renamed.updatedAt()).isEqualTo(NOW);
			})
			.verifyComplete();

		ArgumentCaptor<Memory> captor = ArgumentCaptor.forClass(Memory.class);
		verify(vectorMemoryPort).upsert(captor.capture(), eq(QUERY_VECTOR));
		assertThat(captor.getValue().content()).isEqualTo("The user lives in Seoul");
	}

	@Test
	@DisplayName("기존 수정 시각이 현재 시각보다 뒤면 rename이 수정 시각을 되돌리지 않는다")
	void rename_shouldNotMoveUpdatedAtBackwards() {
		Instant later = NOW.plusSeconds(3600);
		Memory existing = new Memory("m-1", userId, "The user lives in Busan",
			MemoryFixture.DEFAULT_CREATED_AT, later);
		when(vectorMemoryPort.findById("m-1")).thenReturn(Mono.just(existing));
		when(embeddingPort.embed("The user lives in Seoul"))
			.thenReturn(Mono.just(MemoryEmbedding.of("The user lives in Seoul", QUERY_VECTOR)));
		when(vectorMemoryPort.upsert(any(Memory.class), eq(QUERY_VECTOR)))
			.thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

		StepVerifier.create(service.rename("m-1", "The user lives in Seoul"))
			.assertNext(renamed -> assertThat(renamed.updatedAt()).isEqualTo(later))
			.verifyComplete();
	}

	@Test
	@DisplayName("없는 기억의 rename은 빈 결과를 반환하고 임베딩하지 않는다")
	void rename_shouldReturnEmptyWhenMissing() {
		when(vectorMemoryPort.findById("missing")).thenReturn(Mono.empty());

		StepVerifier.create(service.rename("missing", "anything")).verifyComplete();

		verify(embeddingPort, never()).embed(anyString());
	}

	@Test
	@DisplayName("빈 내용으로 rename하면 거부한다")
	void rename_shouldRejectBlankContent() {
		StepVerifier.create(service.rename("m-1", " "))
			.expectError(IllegalArgumentException.class)
			.verify();

		verifyNoInteractions(vectorMemoryPort, embeddingPort);
	}

	@Test
	@DisplayName("fetch와 forget은 저장소에 위임한다")
	void fetchAndForget_shouldDelegate() {
		Memory memory = MemoryFixture.create();
		when(vectorMemoryPort.findById("m-1")).thenReturn(Mono.just(memory));
		when(vectorMemoryPort.deleteById("m-1")).thenReturn(Mono.empty());

		StepVerifier.create(service.fetch("m-1")).expectNext(memory).verifyComplete();
		StepVerifier.create(service.forget("m-1")).verifyComplete();

		verify(vectorMemoryPort).deleteById("m-1");
	}

	@Test
	@DisplayName("forgetAll은 해당 사용자의 기억만 삭제한다")
	void forgetAll_shouldDeleteByUser() {
		when(vectorMemoryPort.deleteByUser(userId)).thenReturn(Mono.empty());

		StepVerifier.create(service.forgetAll(userId)).verifyComplete();

		verify(vectorMemoryPort).deleteByUser(userId);
	}

	@Test
	@DisplayName("기간 조회 기본 개수는 50이다")
	void listByTimeRange_shouldUseDefaultLimit() {
		Instant start = NOW.minusSeconds(3600);
		Memory memory = MemoryFixture.createAt("m-1", userId, "The user likes tea", NOW);
		when(vectorMemoryPort.findByCreatedAtBetween(userId, start, NOW, 50))
			.thenReturn(Flux.just(memory));

		StepVerifier.create(service.listByTimeRange(userId, start, NOW))
			.expectNext(memory)
			.verifyComplete();
	}

	@Test
	@DisplayName("시작 시각이 끝 시각보다 늦으면 거부한다")
	void listByTimeRange_shouldRejectInvertedRange() {
		StepVerifier.create(service.listByTimeRange(userId, NOW, NOW.minusSeconds(1), 10))
			.expectError(IllegalArgumentException.class)
			.verify();

		verifyNoInteractions(vectorMemoryPort);
	}

	private Mono<Void> trackedConsolidation(AtomicInteger inFlight, AtomicInteger maxInFlight) {
		return Mono.defer(() -> {
			int current = inFlight.incrementAndGet();
			maxInFlight.accumulateAndGet(current, Math::max);
			return Mono.delay(Duration.ofMillis(100)).doOnTerminate(inFlight::decrementAndGet).then();
		});
	}
}
