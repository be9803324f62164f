package com.study.webflux.memory.infrastructure.memory.config.properties;

import java.time.Duration;

import lombok.Getter;
import lombok.Setter;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "memory")
public class MemoryEngineProperties {

	@Valid
	private Consolidation consolidation = new Consolidation();

	@Valid
	private Recall recall = new Recall();

	@Valid
	private Reasoning reasoning = new Reasoning();

	@Valid
	private Timeouts timeouts = new Timeouts();

	@Valid
	private Store store = new Store();

	@Valid
	private Qdrant qdrant = new Qdrant();

	@Getter
	@Setter
	public static class Consolidation {
		@Min(1)
		private int candidateTopK = 5;

		@DecimalMin("0.0")
		@DecimalMax("1.0")
		private float candidateScoreThreshold = 0.5f;

		@Min(1)
		private int embeddingConcurrency = 4;
	}

	@Getter
	@Setter
	public static class Recall {
		@Min(1)
		private int topK = 10;

		@DecimalMin("0.0")
		@DecimalMax("1.0")
		private float scoreThreshold = 0.3f;

		@Min(1)
		private int rangeLimit = 50;
	}

	@Getter
	@Setter
	public static class Reasoning {
		@NotBlank
		private String model = "gpt-4o-mini";

		@DecimalMin("0.0")
		@DecimalMax("2.0")
		private double temperature = 0.0;
	}

	@Getter
	@Setter
	public static class Timeouts {
		@NotNull
		private Duration embedding = Duration.ofSeconds(10);

		@NotNull
		private Duration reasoning = Duration.ofSeconds(60);

		@NotNull
		private Duration storage = Duration.ofSeconds(10);
	}

	@Getter
	@Setter
	public static class Store {
		/** qdrant 또는 in-memory */
		@NotBlank
		private String type = "qdrant";
	}

	@Getter
	@Setter
	public static class Qdrant {
		@NotBlank
		private String url = "http://localhost:6333";

		private String apiKey;

		@NotBlank
		private String collectionName = "agentic_memory";

		@Min(1)
		private int vectorDimension = 1536;

		private boolean autoCreateCollection = true;
	}
}
