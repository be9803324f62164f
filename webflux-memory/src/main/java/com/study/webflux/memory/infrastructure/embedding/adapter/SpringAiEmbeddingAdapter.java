package com.study.webflux.memory.infrastructure.embedding.adapter;

import java.util.ArrayList;
import java.util.List;

import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Component;

import com.study.webflux.memory.domain.memory.model.MemoryEmbedding;
import com.study.webflux.memory.domain.memory.port.EmbeddingPort;
import com.study.webflux.memory.infrastructure.memory.config.MemoryTimeoutConfig;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/** Spring AI EmbeddingModel 기반 임베딩 어댑터입니다. */
@Component
public class SpringAiEmbeddingAdapter implements EmbeddingPort {

	private final EmbeddingModel embeddingModel;
	private final MemoryTimeoutConfig timeouts;

	public SpringAiEmbeddingAdapter(EmbeddingModel embeddingModel, MemoryTimeoutConfig timeouts) {
		this.embeddingModel = embeddingModel;
		this.timeouts = timeouts;
	}

	@Override
	public Mono<MemoryEmbedding> embed(String text) {
		return Mono.fromCallable(() -> {
			float[] vector = embeddingModel.embed(text);
			if (vector == null || vector.length == 0) {
				throw new IllegalStateException("Embedding model returned an empty vector");
			}
			return MemoryEmbedding.of(text, toList(vector));
		})
			.subscribeOn(Schedulers.boundedElastic())
			.timeout(timeouts.embedding());
	}

	private List<Float> toList(float[] vector) {
		List<Float> values = new ArrayList<>(vector.length);
		for (float value : vector) {
			values.add(value);
		}
		return values;
	}
}
