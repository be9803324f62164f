package com.study.webflux.memory.application.memory.service;

import java.util.List;
import java.util.Map;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.study.webflux.memory.application.memory.dto.ExtractedFacts;
import com.study.webflux.memory.domain.memory.exception.ExtractionFailureException;
import com.study.webflux.memory.domain.memory.exception.MemoryConsolidationException;
import com.study.webflux.memory.domain.memory.model.Fact;
import com.study.webflux.memory.domain.memory.port.ReasoningPort;
import com.study.webflux.memory.domain.memory.port.ReasoningRequest;
import com.study.webflux.memory.infrastructure.common.template.FileBasedPromptTemplate;
import reactor.core.publisher.Mono;

/**
 * 입력 문장 하나를 원자적 사실 목록으로 나눕니다.
 *
 * <p>
 * 같은 호출 안의 중복 사실은 그대로 두고, 중복 제거는 통합 단계에 맡깁니다. 응답 항목 중 하나라도 비어 있으면 응답 전체를 스키마 위반으로
 * 처리합니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FactExtractionService {

	static final String SYSTEM_TEMPLATE = "fact-extraction-system";
	static final String USER_TEMPLATE = "fact-extraction";

	private final ReasoningPort reasoningPort;
	private final FileBasedPromptTemplate promptTemplate;

	public Mono<List<Fact>> extract(String inputText) {
		if (inputText == null || inputText.isBlank()) {
			return Mono.just(List.of());
		}
		return Mono.fromCallable(() -> buildRequest(inputText))
			.flatMap(request -> reasoningPort.complete(request, ExtractedFacts.class))
			.switchIfEmpty(Mono.error(
				() -> new ExtractionFailureException("Reasoning service returned no answer")))
			.map(this::toFacts)
			.doOnNext(facts -> log.debug("사실 추출 완료: count={}, facts={}", facts.size(), facts))
			.onErrorMap(error -> !(error instanceof MemoryConsolidationException),
				error -> new ExtractionFailureException(
					"Fact extraction failed: " + error.getMessage(), error));
	}

	private ReasoningRequest buildRequest(String inputText) {
		return ReasoningRequest.of(promptTemplate.load(SYSTEM_TEMPLATE),
			promptTemplate.render(USER_TEMPLATE, Map.of("input", inputText)));
	}

	private List<Fact> toFacts(ExtractedFacts extracted) {
		if (extracted.facts() == null) {
			throw new ExtractionFailureException("Extraction response is missing the facts list");
		}
		for (int i = 0; i < extracted.facts().size(); i++) {
			String text = extracted.facts().get(i);
			if (text == null || text.isBlank()) {
				throw new ExtractionFailureException(
					"Extraction response contains an empty fact at index " + i);
			}
		}
		return extracted.facts().stream().map(Fact::of).toList();
	}
}
