package com.study.webflux.memory.domain.memory.port;

import com.study.webflux.memory.domain.memory.model.MemoryEmbedding;
import reactor.core.publisher.Mono;

/**
 * 텍스트를 고정 차원의 코사인 비교 가능 벡터로 변환합니다. 실패 시 부분 벡터 없이 에러로 끝납니다.
 */
public interface EmbeddingPort {

	Mono<MemoryEmbedding> embed(String text);
}
