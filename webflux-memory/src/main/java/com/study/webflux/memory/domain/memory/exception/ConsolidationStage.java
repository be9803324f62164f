package com.study.webflux.memory.domain.memory.exception;

/** remember 파이프라인의 단계입니다. */
public enum ConsolidationStage {
	EXTRACTION,
	RETRIEVAL,
	RESOLUTION,
	APPLY
}
