package com.study.webflux.memory.domain.memory.exception;

/** 후보 기억 수집 중 임베딩 또는 유사도 검색이 실패했습니다. */
public class RetrievalFailureException extends MemoryConsolidationException {

	public RetrievalFailureException(String message, Throwable cause) {
		super(ConsolidationStage.RETRIEVAL, message, cause);
	}
}
