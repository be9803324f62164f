package com.study.webflux.memory.infrastructure.vectordb.adapter;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import com.study.webflux.memory.domain.memory.model.Memory;
import com.study.webflux.memory.domain.memory.model.UserId;

/** Memory와 Qdrant 페이로드 사이의 변환을 담당합니다. 시각은 epoch millis로 저장합니다. */
final class QdrantPayloadMapper {

	static final String USER_ID = "userId";
	static final String CONTENT = "content";
	static final String CREATED_AT = "createdAt";
	static final String UPDATED_AT = "updatedAt";

	private QdrantPayloadMapper() {
	}

	static Map<String, Object> toPayload(Memory memory) {
		Map<String, Object> payload = new HashMap<>();
		payload.put(USER_ID, memory.userId().value());
		payload.put(CONTENT, memory.content());
		payload.put(CREATED_AT, memory.createdAt().toEpochMilli());
		payload.put(UPDATED_AT, memory.updatedAt().toEpochMilli());
		return payload;
	}

	static Memory toMemory(String id, Map<String, Object> payload) {
		if (payload == null) {
			throw new IllegalStateException("잘못된 페이로드: 포인트 " + id + "의 payload 누락");
		}
		Object userIdObj = payload.get(USER_ID);
		Object contentObj = payload.get(CONTENT);
		if (!(userIdObj instanceof String userId) || !(contentObj instanceof String content)) {
			throw new IllegalStateException(
				"잘못된 페이로드: 포인트 " + id + "의 userId/content 누락 또는 잘못됨");
		}

		Instant createdAt = toInstant(payload.get(CREATED_AT));
		if (createdAt == null) {
			throw new IllegalStateException("잘못된 페이로드: 포인트 " + id + "의 createdAt 누락");
		}
		Instant updatedAt = toInstant(payload.get(UPDATED_AT));

		return new Memory(id, UserId.of(userId), content, createdAt, updatedAt);
	}

	private static Instant toInstant(Object value) {
		if (value instanceof Number number) {
			return Instant.ofEpochMilli(number.longValue());
		}
		return null;
	}
}
