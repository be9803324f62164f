package com.study.webflux.memory.domain.memory.port;

public record ReasoningRequest(
	String systemPrompt,
	String userPrompt
) {
	public ReasoningRequest {
		if (userPrompt == null || userPrompt.isBlank()) {
			throw new IllegalArgumentException("userPrompt cannot be null or blank");
		}
		if (systemPrompt == null) {
			systemPrompt = "";
		}
	}

	public static ReasoningRequest of(String systemPrompt, String userPrompt) {
		return new ReasoningRequest(systemPrompt, userPrompt);
	}
}
