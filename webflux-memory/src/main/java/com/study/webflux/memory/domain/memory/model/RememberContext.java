package com.study.webflux.memory.domain.memory.model;

import java.time.Instant;

public record RememberContext(
	UserId userId,
	Instant timestamp
) {
	public RememberContext {
		if (userId == null) {
			throw new IllegalArgumentException("userId cannot be null");
		}
	}

	public static RememberContext of(UserId userId) {
		return new RememberContext(userId, null);
	}

	public static RememberContext of(UserId userId, Instant timestamp) {
		return new RememberContext(userId, timestamp);
	}
}
