package com.study.webflux.memory.domain.memory.exception;

/**
 * 통합 결정이 후보 ID/사실 커버리지 규칙을 위반했거나, 통합 단계의 추론 호출 자체가 실패했습니다.
 */
public class ConsolidationValidationException extends MemoryConsolidationException {

	public ConsolidationValidationException(String message) {
		this(message, null);
	}

	public ConsolidationValidationException(String message, Throwable cause) {
		super(ConsolidationStage.RESOLUTION, message, cause);
	}
}
