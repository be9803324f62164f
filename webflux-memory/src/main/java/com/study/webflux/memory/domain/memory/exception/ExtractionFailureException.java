package com.study.webflux.memory.domain.memory.exception;

/** 사실 추출 중 추론 서비스 호출이 실패했거나 응답이 스키마를 따르지 않았습니다. */
public class ExtractionFailureException extends MemoryConsolidationException {

	public ExtractionFailureException(String message) {
		this(message, null);
	}

	public ExtractionFailureException(String message, Throwable cause) {
		super(ConsolidationStage.EXTRACTION, message, cause);
	}
}
