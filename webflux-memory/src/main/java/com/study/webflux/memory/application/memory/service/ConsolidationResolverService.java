package com.study.webflux.memory.application.memory.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.study.webflux.memory.application.memory.dto.ConsolidationDecisions;
import com.study.webflux.memory.application.memory.dto.ConsolidationDecisions.Decision;
import com.study.webflux.memory.domain.memory.exception.ConsolidationValidationException;
import com.study.webflux.memory.domain.memory.exception.MemoryConsolidationException;
import com.study.webflux.memory.domain.memory.model.CandidateMemories;
import com.study.webflux.memory.domain.memory.model.ConsolidationAction;
import com.study.webflux.memory.domain.memory.model.ConsolidationActionType;
import com.study.webflux.memory.domain.memory.model.Fact;
import com.study.webflux.memory.domain.memory.port.ReasoningPort;
import com.study.webflux.memory.domain.memory.port.ReasoningRequest;
import com.study.webflux.memory.infrastructure.common.template.FileBasedPromptTemplate;
import reactor.core.publisher.Mono;

/**
 * 후보 기억과 새 사실을 추론 서비스에 넘겨 사실별 통합 결정을 받고, 결정 목록을 검증합니다.
 *
 * <p>
 * 검증 규칙:
 * <ul>
 * <li>UPDATE/DELETE의 대상 ID는 이번 호출에서 검색된 후보여야 합니다.</li>
 * <li>모든 사실은 최소 한 개 결정의 text로 등장해야 합니다.</li>
 * <li>후보가 없던 사실은 UPDATE/DELETE의 text가 될 수 없습니다.</li>
 * </ul>
 * 결정 순서는 응답 순서를 그대로 따릅니다.
 */
@Slf4j
@Service
public class ConsolidationResolverService {

	static final String SYSTEM_TEMPLATE = "memory-consolidation-system";
	static final String USER_TEMPLATE = "memory-consolidation";

	private final ReasoningPort reasoningPort;
	private final FileBasedPromptTemplate promptTemplate;
	private final ObjectMapper objectMapper;

	public ConsolidationResolverService(ReasoningPort reasoningPort,
		FileBasedPromptTemplate promptTemplate,
		ObjectMapper objectMapper) {
		this.reasoningPort = reasoningPort;
		this.promptTemplate = promptTemplate;
		this.objectMapper = objectMapper;
	}

	public Mono<List<ConsolidationAction>> resolve(CandidateMemories candidates, List<Fact> facts) {
		return Mono.fromCallable(() -> buildRequest(candidates, facts))
			.flatMap(request -> reasoningPort.complete(request, ConsolidationDecisions.class))
			.switchIfEmpty(Mono.error(() -> new ConsolidationValidationException(
				"Reasoning service returned no consolidation decisions")))
			.map(decisions -> validate(decisions, candidates, facts))
			.doOnNext(actions -> log.debug("통합 결정 수신: actions={}", actions))
			.onErrorMap(error -> !(error instanceof MemoryConsolidationException),
				error -> new ConsolidationValidationException(
					"Consolidation reasoning failed: " + error.getMessage(), error));
	}

	private ReasoningRequest buildRequest(CandidateMemories candidates, List<Fact> facts)
		throws JsonProcessingException {
		List<Map<String, String>> memories = candidates.all()
			.stream()
			.map(memory -> Map.of("id", memory.id(), "text", memory.content()))
			.toList();
		List<String> factTexts = facts.stream().map(Fact::text).toList();

		String userPrompt = promptTemplate.render(USER_TEMPLATE,
			Map.of("memories", objectMapper.writeValueAsString(memories),
				"facts", objectMapper.writeValueAsString(factTexts)));
		return ReasoningRequest.of(promptTemplate.load(SYSTEM_TEMPLATE), userPrompt);
	}

	List<ConsolidationAction> validate(ConsolidationDecisions decisions,
		CandidateMemories candidates,
		List<Fact> facts) {
		if (decisions.actions() == null) {
			throw new ConsolidationValidationException(
				"Consolidation response is missing the actions list");
		}

		List<ConsolidationAction> actions = new ArrayList<>(decisions.actions().size());
		for (int i = 0; i < decisions.actions().size(); i++) {
			actions.add(toAction(decisions.actions().get(i), i, candidates));
		}

		Set<String> factTexts = new LinkedHashSet<>();
		facts.forEach(fact -> factTexts.add(fact.text()));

		for (ConsolidationAction action : actions) {
			if (action.type().requiresTarget()
				&& factTexts.contains(action.text())
				&& !candidates.hasCandidatesFor(action.text())) {
				throw new ConsolidationValidationException("Fact '" + action.text()
					+ "' had no candidate memories but was resolved as " + action.type());
			}
		}

		Set<String> covered = new LinkedHashSet<>();
		actions.forEach(action -> covered.add(action.text()));
		for (String factText : factTexts) {
			if (!covered.contains(factText)) {
				throw new ConsolidationValidationException(
					"No consolidation decision covers fact '" + factText + "'");
			}
		}
		return List.copyOf(actions);
	}

	private ConsolidationAction toAction(Decision decision, int index, CandidateMemories candidates) {
		if (decision == null) {
			throw new ConsolidationValidationException("Decision at index " + index + " is null");
		}
		ConsolidationActionType type = parseType(decision.type(), index);
		if (type.requiresTarget() && !candidates.contains(decision.id())) {
			throw new ConsolidationValidationException(type + " decision at index " + index
				+ " references unknown memory id '" + decision.id() + "'");
		}
		try {
			return new ConsolidationAction(type, decision.id(), decision.text(), decision.oldFact());
		} catch (IllegalArgumentException e) {
			throw new ConsolidationValidationException(
				"Decision at index " + index + " is malformed: " + e.getMessage(), e);
		}
	}

	private ConsolidationActionType parseType(String rawType, int index) {
		if (rawType == null || rawType.isBlank()) {
			throw new ConsolidationValidationException(
				"Decision at index " + index + " has no type");
		}
		try {
			return ConsolidationActionType.valueOf(rawType.strip().toUpperCase(Locale.ROOT));
		} catch (IllegalArgumentException e) {
			throw new ConsolidationValidationException(
				"Decision at index " + index + " has unknown type '" + rawType + "'", e);
		}
	}
}
