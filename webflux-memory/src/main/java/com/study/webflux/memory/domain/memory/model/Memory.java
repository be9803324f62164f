package com.study.webflux.memory.domain.memory.model;

import java.time.Instant;
import java.util.UUID;

/**
 * 사용자 한 명에게 귀속되는 영속 기억 단위입니다.
 *
 * <p>
 * 식별자는 생성 시 한 번 부여되며 이후 변경되지 않습니다. 수정 시각은 생성 시각보다 앞설 수 없습니다.
 */
public record Memory(
	String id,
	UserId userId,
	String content,
	Instant createdAt,
	Instant updatedAt
) {
	public Memory {
		if (id == null || id.isBlank()) {
			throw new IllegalArgumentException("id cannot be null or blank");
		}
		if (userId == null) {
			throw new IllegalArgumentException("userId cannot be null");
		}
		if (content == null || content.isBlank()) {
			throw new IllegalArgumentException("content cannot be null or blank");
		}
		if (createdAt == null) {
			throw new IllegalArgumentException("createdAt cannot be null");
		}
		if (updatedAt == null || updatedAt.isBefore(createdAt)) {
			updatedAt = createdAt;
		}
	}

	public static Memory create(UserId userId, String content, Instant now) {
		return new Memory(UUID.randomUUID().toString(), userId, content, now, now);
	}

	/**
	 * 내용을 교체한 사본을 만듭니다. 식별자, 소유자, 생성 시각은 유지됩니다.
	 *
	 * <p>
	 * 수정 시각은 기존 수정 시각보다 뒤로 가지 않습니다.
	 */
	public Memory withContent(String newContent, Instant modifiedAt) {
		Instant stamp = modifiedAt != null && modifiedAt.isAfter(updatedAt) ? modifiedAt : updatedAt;
		return new Memory(id, userId, newContent, createdAt, stamp);
	}

	public boolean isOwnedBy(UserId candidate) {
		return userId.equals(candidate);
	}
}
