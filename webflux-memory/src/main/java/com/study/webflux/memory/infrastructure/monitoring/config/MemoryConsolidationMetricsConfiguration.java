package com.study.webflux.memory.infrastructure.monitoring.config;

import java.util.Locale;

import org.springframework.stereotype.Component;

import com.study.webflux.memory.domain.memory.exception.ConsolidationStage;
import com.study.webflux.memory.domain.memory.model.ConsolidationActionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * 기억 통합 파이프라인 메트릭을 제공합니다.
 *
 * <p>
 * remember 성공/실패율(실패 단계별), 결정 유형 분포, 추출 사실 수와 후보 기억 수 분포를 기록합니다.
 */
@Component
public class MemoryConsolidationMetricsConfiguration {

	private final MeterRegistry meterRegistry;

	private final Counter rememberSuccessCounter;

	private final DistributionSummary extractedFactCount;
	private final DistributionSummary candidateCount;

	public MemoryConsolidationMetricsConfiguration(MeterRegistry meterRegistry) {
		this.meterRegistry = meterRegistry;

		this.rememberSuccessCounter = Counter.builder("memory.remember.success")
			.description("Number of remember calls that completed")
			.register(meterRegistry);

		this.extractedFactCount = DistributionSummary.builder("memory.extracted.facts")
			.description("Number of facts extracted per remember call")
			.register(meterRegistry);

		this.candidateCount = DistributionSummary.builder("memory.retrieval.candidates")
			.description("Number of distinct candidate memories per remember call")
			.register(meterRegistry);
	}

	public void recordRememberSuccess() {
		rememberSuccessCounter.increment();
	}

	/**
	 * remember 실패를 단계 태그와 함께 기록합니다.
	 */
	public void recordRememberFailure(ConsolidationStage stage) {
		Counter.builder("memory.remember.failure")
			.tag("stage", stage.name().toLowerCase(Locale.ROOT))
			.description("Number of remember calls aborted by stage")
			.register(meterRegistry)
			.increment();
	}

	public void recordExtractedFacts(int count) {
		extractedFactCount.record(count);
	}

	public void recordCandidates(int count) {
		candidateCount.record(count);
	}

	public void recordAction(ConsolidationActionType type) {
		Counter.builder("memory.consolidation.action")
			.tag("type", type.name().toLowerCase(Locale.ROOT))
			.description("Number of consolidation actions applied by type")
			.register(meterRegistry)
			.increment();
	}
}
