package com.study.webflux.memory.infrastructure.memory.config;

public record ReasoningConfig(
	String model,
	double temperature
) {
}
