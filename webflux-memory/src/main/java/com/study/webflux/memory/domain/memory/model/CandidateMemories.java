package com.study.webflux.memory.domain.memory.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 사실별 유사도 검색 결과를 ID 기준으로 합친 후보 기억 집합입니다.
 *
 * <p>
 * 같은 기억이 여러 사실에 걸려도 한 번만 보관되며, 사실마다 어떤 후보가 검색됐는지도 함께 기록합니다.
 */
public final class CandidateMemories {

	private final Map<String, Memory> memoriesById = new LinkedHashMap<>();
	private final Map<String, Set<String>> candidateIdsByFact = new LinkedHashMap<>();

	public static CandidateMemories empty() {
		return new CandidateMemories();
	}

	/**
	 * 사실 하나의 검색 결과를 등록합니다. 이미 등록된 ID는 처음 본 기억을 유지합니다.
	 */
	public CandidateMemories register(Fact fact, Collection<Memory> matches) {
		Set<String> ids = candidateIdsByFact.computeIfAbsent(fact.text(),
			key -> new LinkedHashSet<>());
		for (Memory memory : matches) {
			memoriesById.putIfAbsent(memory.id(), memory);
			ids.add(memory.id());
		}
		return this;
	}

	public boolean contains(String memoryId) {
		return memoryId != null && memoriesById.containsKey(memoryId);
	}

	public Optional<Memory> find(String memoryId) {
		return Optional.ofNullable(memoryId).map(memoriesById::get);
	}

	public boolean hasCandidatesFor(String factText) {
		Set<String> ids = candidateIdsByFact.get(factText);
		return ids != null && !ids.isEmpty();
	}

	public List<Memory> all() {
		return Collections.unmodifiableList(new ArrayList<>(memoriesById.values()));
	}

	public int size() {
		return memoriesById.size();
	}

	public boolean isEmpty() {
		return memoriesById.isEmpty();
	}
}
