package com.study.webflux.memory.infrastructure.memory.config;

import java.time.Duration;

public record MemoryTimeoutConfig(
	Duration embedding,
	Duration reasoning,
	Duration storage
) {
	public static MemoryTimeoutConfig defaults() {
		return new MemoryTimeoutConfig(Duration.ofSeconds(10), Duration.ofSeconds(60),
			Duration.ofSeconds(10));
	}
}
