package com.study.webflux.memory.application.memory.service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import com.study.webflux.memory.domain.memory.exception.ApplyFailureException;
import com.study.webflux.memory.domain.memory.model.CandidateMemories;
import com.study.webflux.memory.domain.memory.model.CandidateRetrievalResult;
import com.study.webflux.memory.domain.memory.model.ConsolidationAction;
import com.study.webflux.memory.domain.memory.model.Fact;
import com.study.webflux.memory.domain.memory.model.Memory;
import com.study.webflux.memory.domain.memory.model.MemoryEmbedding;
import com.study.webflux.memory.domain.memory.model.RememberContext;
import com.study.webflux.memory.domain.memory.model.UserId;
import com.study.webflux.memory.domain.memory.port.EmbeddingPort;
import com.study.webflux.memory.domain.memory.port.VectorMemoryPort;
import com.study.webflux.memory.fixture.MemoryFixture;
import com.study.webflux.memory.fixture.UserIdFixture;
import com.study.webflux.memory.infrastructure.monitoring.config.MemoryConsolidationMetricsConfiguration;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConsolidationApplierServiceTest {

	private static final Instant CLOCK_NOW = Instant.parse("2024-06-01T00:00:00Z");
	private static final Instant CONTEXT_NOW = Instant.parse("2024-06-15T12:00:00Z");
	private static final List<Float> FACT_VECTOR = List.of(0.6f, 0.8f);
	private static final List<Float> FRESH_VECTOR = List.of(0.8f, 0.6f);

	@Mock
	private VectorMemoryPort vectorMemoryPort;

	@Mock
	private EmbeddingPort embeddingPort;

	private SimpleMeterRegistry meterRegistry;

	private ConsolidationApplierService service;

	private final UserId userId = UserIdFixture.create();

	@BeforeEach
	void setUp() {
		meterRegistry = new SimpleMeterRegistry();
		service = new ConsolidationApplierService(vectorMemoryPort, embeddingPort,
			Clock.fixed(CLOCK_NOW, ZoneOffset.UTC),
			new MemoryConsolidationMetricsConfiguration(meterRegistry));
	}

	@Test
	@DisplayName("ADD는 검색 때 계산한 임베딩을 재사용해 새 기억을 저장한다")
	void apply_addShouldReusePrecomputedEmbedding() {
		String text = "The user likes coffee";
		CandidateRetrievalResult retrieval = new CandidateRetrievalResult(CandidateMemories.empty(),
			Map.of(text, MemoryEmbedding.of(text, FACT_VECTOR)));
		when(vectorMemoryPort.upsert(any(Memory.class), eq(FACT_VECTOR)))
			.thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

		StepVerifier.create(service.apply(List.of(ConsolidationAction.add(text)), retrieval,
			RememberContext.of(userId, CONTEXT_NOW))).expectNext(1L).verifyComplete();

		ArgumentCaptor<Memory> captor = ArgumentCaptor.forClass(Memory.class);
		verify(vectorMemoryPort).upsert(captor.capture(), eq(FACT_VECTOR));
		assertThat(captor.getValue().content()).isEqualTo(text);
		assertThat(captor.getValue().userId()).isEqualTo(userId);
		assertThat(captor.getValue().createdAt()).isEqualTo(CONTEXT_NOW);
		verifyNoInteractions(embeddingPort);
		assertThat(meterRegistry.counter("memory.consolidation.action", "type", "add").count())
			.isEqualTo(1.0);
	}

	@Test
	@DisplayName("미리 계산된 임베딩이 없는 ADD 문장은 새로 임베딩한다")
	void apply_addShouldEmbedWhenTextWasNotRetrieved() {
		String text = "The user owns a cat";
		when(embeddingPort.embed(text)).thenReturn(Mono.just(MemoryEmbedding.of(text, FRESH_VECTOR)));
		when(vectorMemoryPort.upsert(any(Memory.class), eq(FRESH_VECTOR)))
			.thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

		StepVerifier.create(service.apply(List.of(ConsolidationAction.add(text)),
			new CandidateRetrievalResult(CandidateMemories.empty(), Map.of()),
			RememberContext.of(userId))).expectNext(1L).verifyComplete();

		ArgumentCaptor<Memory> captor = ArgumentCaptor.forClass(Memory.class);
		verify(vectorMemoryPort).upsert(captor.capture(), eq(FRESH_VECTOR));
		assertThat(captor.getValue().createdAt()).isEqualTo(CLOCK_NOW);
	}

	@Test
	@DisplayName("UPDATE는 ID와 생성 시각을 유지하고 내용, 임베딩, 수정 시각을 바꾼다")
	void apply_updateShouldKeepIdentityAndReembed() {
		Memory existing = MemoryFixture.createWithId("m-1", userId, "The user works as a UX designer");
		String text = "The user is a senior UX designer";
		CandidateRetrievalResult retrieval = new CandidateRetrievalResult(
			CandidateMemories.empty().register(Fact.of(text), List.of(existing)),
			Map.of(text, MemoryEmbedding.of(text, FACT_VECTOR)));
		when(embeddingPort.embed(text)).thenReturn(Mono.just(MemoryEmbedding.of(text, FRESH_VECTOR)));
		when(vectorMemoryPort.upsert(any(Memory.class), eq(FRESH_VECTOR)))
			.thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

		StepVerifier.create(service.apply(
			List.of(ConsolidationAction.update("m-1", text, existing.content())), retrieval,
			RememberContext.of(userId, CONTEXT_NOW))).expectNext(1L).verifyComplete();

		ArgumentCaptor<Memory> captor = ArgumentCaptor.forClass(Memory.class);
		verify(vectorMemoryPort).upsert(captor.capture(), eq(FRESH_VECTOR));
		Memory updated = captor.getValue();
		assertThat(updated.id()).isEqualTo("m-1");
		assertThat(updated.content()).isEqualTo(text);
		assertThat(updated.createdAt()).isEqualTo(existing.createdAt());
		assertThat(updated.updatedAt()).isEqualTo(CLOCK_NOW);
	}

	@Test
	@DisplayName("요청 시각이 기존 기억보다 과거여도 UPDATE는 수정 시각을 현재 시각으로 올린다")
	void apply_updateShouldBumpModificationTimeEvenWithStaleContextTimestamp() {
		Memory existing = MemoryFixture.createAt("m-1", userId, "The user lives in Busan",
			Instant.parse("2024-05-01T00:00:00Z"));
		String text = "The user lives in Seoul";
		CandidateRetrievalResult retrieval = new CandidateRetrievalResult(
			CandidateMemories.empty().register(Fact.of(text), List.of(existing)), Map.of());
		when(embeddingPort.embed(text)).thenReturn(Mono.just(MemoryEmbedding.of(text, FRESH_VECTOR)));
		when(vectorMemoryPort.upsert(any(Memory.class), eq(FRESH_VECTOR)))
			.thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

		StepVerifier.create(service.apply(
			List.of(ConsolidationAction.update("m-1", text, existing.content())), retrieval,
			RememberContext.of(userId, Instant.parse("2024-01-01T00:00:00Z"))))
			.expectNext(1L)
			.verifyComplete();

		ArgumentCaptor<Memory> captor = ArgumentCaptor.forClass(Memory.class);
		verify(vectorMemoryPort).upsert(captor.capture(), eq(FRESH_VECTOR));
		assertThat(captor.getValue().content()).isEqualTo(text);
		assertThat(captor.getValue().createdAt()).isEqualTo(existing.createdAt());
		assertThat(captor.getValue().updatedAt()).isEqualTo(CLOCK_NOW);
	}

	@Test
	@DisplayName("같은 배치에서 먼저 삭제된 기억은 UPDATE로 되살리지 않고 실패한다")
	void apply_updateShouldFailWhenTargetWasDeletedEarlier() {
		Memory existing = MemoryFixture.createWithId("m-1", userId, "The user lives in Busan");
		String text = "The user moved to Seoul";
		CandidateRetrievalResult retrieval = new CandidateRetrievalResult(
			CandidateMemories.empty().register(Fact.of(text), List.of(existing)), Map.of());
		when(vectorMemoryPort.deleteById("m-1")).thenReturn(Mono.empty());

		StepVerifier.create(service.apply(
			List.of(ConsolidationAction.delete("m-1", text),
				ConsolidationAction.update("m-1", text, existing.content())),
			retrieval,
			RememberContext.of(userId)))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(ApplyFailureException.class);
				ApplyFailureException failure = (ApplyFailureException) error;
				assertThat(failure.getActionIndex()).isEqualTo(1);
				assertThat(failure.getAppliedCount()).isEqualTo(1);
			})
			.verify();

		verify(vectorMemoryPort, never()).upsert(any(), anyList());
		verifyNoInteractions(embeddingPort);
	}

	@Test
	@DisplayName("DELETE는 대상 ID를 삭제하고 UNCHANGED는 저장소를 건드리지 않는다")
	void apply_deleteAndUnchanged() {
		Memory existing = MemoryFixture.createWithId("m-1", userId, "The user lives in Busan");
		CandidateRetrievalResult retrieval = new CandidateRetrievalResult(
			CandidateMemories.empty().register(Fact.of("The user moved to Seoul"), List.of(existing)),
			Map.of());
		when(vectorMemoryPort.deleteById("m-1")).thenReturn(Mono.empty());

		StepVerifier.create(service.apply(
			List.of(ConsolidationAction.delete("m-1", "The user moved to Seoul"),
				ConsolidationAction.unchanged("The user likes tea")),
			retrieval,
			RememberContext.of(userId))).expectNext(2L).verifyComplete();

		verify(vectorMemoryPort).deleteById("m-1");
		verify(vectorMemoryPort, never()).upsert(any(), anyList());
		verifyNoInteractions(embeddingPort);
	}

	@Test
	@DisplayName("중간 결정이 실패하면 이후 결정은 실행하지 않고 실패 위치를 알린다")
	void apply_shouldStopAtFirstFailure() {
		Memory existing = MemoryFixture.createWithId("m-1", userId, "The user lives in Busan");
		CandidateRetrievalResult retrieval = new CandidateRetrievalResult(
			CandidateMemories.empty().register(Fact.of("The user moved to Seoul"), List.of(existing)),
			Map.of("The user likes tea", MemoryEmbedding.of("The user likes tea", FACT_VECTOR)));
		when(vectorMemoryPort.upsert(any(Memory.class), eq(FACT_VECTOR)))
			.thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
		when(vectorMemoryPort.deleteById("m-1"))
			.thenReturn(Mono.error(new IllegalStateException("store unavailable")));

		ConsolidationAction failing = ConsolidationAction.delete("m-1", "The user moved to Seoul");
		StepVerifier.create(service.apply(
			List.of(ConsolidationAction.add("The user likes tea"),
				failing,
				ConsolidationAction.add("The user likes jazz")),
			retrieval,
			RememberContext.of(userId)))
			.expectErrorSatisfies(error -> {
				assertThat(error).isInstanceOf(ApplyFailureException.class);
				ApplyFailureException failure = (ApplyFailureException) error;
				assertThat(failure.getActionIndex()).isEqualTo(1);
				assertThat(failure.getAppliedCount()).isEqualTo(1);
				assertThat(failure.getAction()).isEqualTo(failing);
				assertThat(failure.getCause()).hasMessage("store unavailable");
			})
			.verify();

		verify(embeddingPort, never()).embed(anyString());
		assertThat(meterRegistry.counter("memory.consolidation.action", "type", "add").count())
			.isEqualTo(1.0);
	}

	@Test
	@DisplayName("다른 사용자의 기억을 UPDATE하려 하면 저장 없이 실패한다")
	void apply_shouldRefuseUpdateOfForeignMemory() {
		Memory foreign = MemoryFixture.createWithId("m-9", UserIdFixture.other(), "The user likes tea");
		CandidateRetrievalResult retrieval = new CandidateRetrievalResult(
			CandidateMemories.empty().register(Fact.of("The user likes green tea"), List.of(foreign)),
			Map.of());

		StepVerifier.create(service.apply(
			List.of(ConsolidationAction.update("m-9", "The user likes green tea", foreign.content())),
			retrieval,
			RememberContext.of(userId)))
			.expectError(ApplyFailureException.class)
			.verify();

		verifyNoInteractions(vectorMemoryPort, embeddingPort);
	}

	@Test
	@DisplayName("결정이 없으면 아무것도 하지 않는다")
	void apply_shouldCompleteWithZeroForEmptyActions() {
		StepVerifier.create(service.apply(List.of(),
			new CandidateRetrievalResult(CandidateMemories.empty(), Map.of()),
			RememberContext.of(userId))).expectNext(0L).verifyComplete();

		verifyNoInteractions(vectorMemoryPort, embeddingPort);
	}
}
