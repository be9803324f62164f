package com.study.webflux.memory.domain.memory.model;

/** 사실 하나에 대한 통합 결정 유형입니다. */
public enum ConsolidationActionType {
	/** 새 기억을 생성합니다. */
	ADD,

	/** 기존 기억의 내용을 사실 문장으로 교체합니다. */
	UPDATE,

	/** 기존 기억을 영구 삭제합니다. */
	DELETE,

	/** 이미 저장된 정보이므로 변경하지 않습니다. */
	UNCHANGED;

	public boolean requiresTarget() {
		return this == UPDATE || this == DELETE;
	}
}
