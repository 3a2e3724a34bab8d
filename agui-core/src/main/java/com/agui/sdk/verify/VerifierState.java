/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.verify;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import com.agui.sdk.session.RunStatus;

/**
 * What the verifier knows about the stream so far. Immutable.
 *
 * @param runStatus status of the current run
 * @param runSeen whether any run event has been accepted yet
 * @param openTextIds text messages started and not yet ended
 * @param openToolIds tool calls started and not yet ended
 * @param activeSteps steps started and not yet finished
 * @param thinkingActive whether a thinking block is open
 * @param thinkingMessageActive whether a thinking text message is open
 */
public record VerifierState(RunStatus runStatus, boolean runSeen, Set<String> openTextIds, Set<String> openToolIds,
		Set<String> activeSteps, boolean thinkingActive, boolean thinkingMessageActive) {

	private static final VerifierState INITIAL = new VerifierState(RunStatus.IDLE, false, Set.of(), Set.of(),
			Set.of(), false, false);

	public VerifierState {
		openTextIds = copyOf(openTextIds);
		openToolIds = copyOf(openToolIds);
		activeSteps = copyOf(activeSteps);
	}

	public static VerifierState initial() {
		return INITIAL;
	}

	VerifierState withRunStatus(RunStatus status) {
		return new VerifierState(status, true, this.openTextIds, this.openToolIds, this.activeSteps,
				this.thinkingActive, this.thinkingMessageActive);
	}

	VerifierState withOpenTextIds(Set<String> ids) {
		return new VerifierState(this.runStatus, this.runSeen, ids, this.openToolIds, this.activeSteps,
				this.thinkingActive, this.thinkingMessageActive);
	}

	VerifierState withOpenToolIds(Set<String> ids) {
		return new VerifierState(this.runStatus, this.runSeen, this.openTextIds, ids, this.activeSteps,
				this.thinkingActive, this.thinkingMessageActive);
	}

	VerifierState withActiveSteps(Set<String> steps) {
		return new VerifierState(this.runStatus, this.runSeen, this.openTextIds, this.openToolIds, steps,
				this.thinkingActive, this.thinkingMessageActive);
	}

	VerifierState withThinking(boolean active, boolean messageActive) {
		return new VerifierState(this.runStatus, this.runSeen, this.openTextIds, this.openToolIds, this.activeSteps,
				active, messageActive);
	}

	static Set<String> adding(Set<String> set, String value) {
		Set<String> copy = new LinkedHashSet<>(set);
		copy.add(value);
		return copy;
	}

	static Set<String> removing(Set<String> set, String value) {
		Set<String> copy = new LinkedHashSet<>(set);
		copy.remove(value);
		return copy;
	}

	private static Set<String> copyOf(Set<String> set) {
		return Collections.unmodifiableSet(new LinkedHashSet<>(set));
	}

}
