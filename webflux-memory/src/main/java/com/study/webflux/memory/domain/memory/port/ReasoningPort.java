package com.study.webflux.memory.domain.memory.port;

import reactor.core.publisher.Mono;

/**
 * 프롬프트와 출력 스키마를 받아 스키마에 맞는 구조화 응답을 돌려주는 추론 서비스 포트입니다.
 *
 * <p>
 * 응답이 스키마 검증을 통과하지 못하면 대체 값을 만들지 않고 에러로 종료해야 합니다.
 */
public interface ReasoningPort {

	/**
	 * @param request
	 *            시스템/사용자 프롬프트
	 * @param outputType
	 *            응답이 따라야 하는 구조 (JSON 스키마의 원천)
	 * @return outputType으로 변환된 응답
	 */
	<T> Mono<T> complete(ReasoningRequest request, Class<T> outputType);
}
