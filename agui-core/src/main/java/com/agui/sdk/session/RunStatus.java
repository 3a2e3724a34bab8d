/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.session;

/**
 * Lifecycle status of an agent run.
 */
public enum RunStatus {

	IDLE, RUNNING, FINISHED, ERRORED;

	/**
	 * Whether the run has ended, successfully or not.
	 */
	public boolean isTerminal() {
		return this == FINISHED || this == ERRORED;
	}

}
