package com.study.webflux.memory.domain.memory.model;

/**
 * 사실 하나에 대해 내려진 통합 결정입니다. UPDATE/DELETE는 대상 기억 ID를 반드시 가집니다.
 */
public record ConsolidationAction(
	ConsolidationActionType type,
	String targetId,
	String text,
	String previousText
) {
	public ConsolidationAction {
		if (type == null) {
			throw new IllegalArgumentException("type cannot be null");
		}
		if (text == null || text.isBlank()) {
			throw new IllegalArgumentException("text cannot be null or blank");
		}
		text = text.strip();
		if (type.requiresTarget() && (targetId == null || targetId.isBlank())) {
			throw new IllegalArgumentException(type + " action requires a target memory id");
		}
		if (!type.requiresTarget()) {
			targetId = null;
		}
	}

	public static ConsolidationAction add(String text) {
		return new ConsolidationAction(ConsolidationActionType.ADD, null, text, null);
	}

	public static ConsolidationAction update(String targetId, String text, String previousText) {
		return new ConsolidationAction(ConsolidationActionType.UPDATE, targetId, text,
			previousText);
	}

	public static ConsolidationAction delete(String targetId, String text) {
		return new ConsolidationAction(ConsolidationActionType.DELETE, targetId, text, null);
	}

	public static ConsolidationAction unchanged(String text) {
		return new ConsolidationAction(ConsolidationActionType.UNCHANGED, null, text, null);
	}
}
