/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.session;

/**
 * A named step of the current run.
 */
public record Step(String name, Status status) {

	public enum Status {

		STARTED, FINISHED

	}

	public static Step started(String name) {
		return new Step(name, Status.STARTED);
	}

	public Step finish() {
		return new Step(this.name, Status.FINISHED);
	}

	public boolean isFinished() {
		return this.status == Status.FINISHED;
	}

}
