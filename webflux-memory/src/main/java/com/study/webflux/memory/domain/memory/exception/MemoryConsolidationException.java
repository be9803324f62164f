package com.study.webflux.memory.domain.memory.exception;

/**
 * remember 호출을 중단시키는 실패의 공통 상위 타입입니다.
 *
 * <p>
 * 네 가지 실패 모두 호출 전체에 치명적이며, 호출자는 {@link #getStage()}로 어느 단계에서 중단됐는지 알 수 있습니다.
 */
public abstract class MemoryConsolidationException extends RuntimeException {

	private final ConsolidationStage stage;

	protected MemoryConsolidationException(ConsolidationStage stage, String message,
		Throwable cause) {
		super(message, cause);
		this.stage = stage;
	}

	public ConsolidationStage getStage() {
		return stage;
	}
}
