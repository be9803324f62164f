package com.study.webflux.memory.infrastructure.memory.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.study.webflux.memory.infrastructure.memory.config.properties.MemoryEngineProperties;

/** 기억 통합 엔진 설정을 불변 설정 객체로 노출합니다. */
@Configuration
@EnableConfigurationProperties(MemoryEngineProperties.class)
public class MemoryConfiguration {

	@Bean
	public MemoryConsolidationConfig memoryConsolidationConfig(MemoryEngineProperties properties) {
		var consolidation = properties.getConsolidation();
		var recall = properties.getRecall();
		return new MemoryConsolidationConfig(consolidation.getCandidateTopK(),
			consolidation.getCandidateScoreThreshold(), consolidation.getEmbeddingConcurrency(),
			recall.getTopK(), recall.getScoreThreshold(), recall.getRangeLimit());
	}

	@Bean
	public MemoryTimeoutConfig memoryTimeoutConfig(MemoryEngineProperties properties) {
		var timeouts = properties.getTimeouts();
		return new MemoryTimeoutConfig(timeouts.getEmbedding(), timeouts.getReasoning(),
			timeouts.getStorage());
	}

	@Bean
	public ReasoningConfig reasoningConfig(MemoryEngineProperties properties) {
		var reasoning = properties.getReasoning();
		return new ReasoningConfig(reasoning.getModel(), reasoning.getTemperature());
	}

	@Bean
	public QdrantConfig qdrantConfig(MemoryEngineProperties properties) {
		var qdrant = properties.getQdrant();
		return new QdrantConfig(qdrant.getUrl(), qdrant.getApiKey(), qdrant.getCollectionName(),
			qdrant.getVectorDimension(), qdrant.isAutoCreateCollection());
	}

	/** 생성/수정 시각 기준 시계입니다. */
	@Bean
	public Clock memoryClock() {
		return Clock.systemUTC();
	}
}
