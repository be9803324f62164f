package com.study.webflux.memory.domain.memory.exception;

import com.study.webflux.memory.domain.memory.model.ConsolidationAction;

/**
 * 결정 적용 중 저장소 변경이 실패했습니다.
 *
 * <p>
 * {@link #getActionIndex()} 이전의 결정들은 이미 저장소에 반영된 상태이며 되돌려지지 않습니다.
 */
public class ApplyFailureException extends MemoryConsolidationException {

	private final transient ConsolidationAction action;
	private final int actionIndex;

	public ApplyFailureException(ConsolidationAction action, int actionIndex, Throwable cause) {
		super(ConsolidationStage.APPLY,
			"Failed to apply " + action.type() + " action at index " + actionIndex
				+ (action.targetId() != null ? " (target=" + action.targetId() + ")" : ""),
			cause);
		this.action = action;
		this.actionIndex = actionIndex;
	}

	public ConsolidationAction getAction() {
		return action;
	}

	public int getActionIndex() {
		return actionIndex;
	}

	/** 실패 이전에 적용이 끝난 결정 수입니다. */
	public int getAppliedCount() {
		return actionIndex;
	}
}
