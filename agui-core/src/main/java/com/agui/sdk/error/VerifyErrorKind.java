/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.error;

/**
 * Protocol violations detected by the event verifier.
 */
public enum VerifyErrorKind {

	FIRST_EVENT_MUST_BE_RUN_STARTED("First event must be RUN_STARTED"),

	RUN_ALREADY_STARTED("Run already started"),

	RUN_ALREADY_FINISHED("Run already finished"),

	RUN_ALREADY_ERRORED("Run already errored"),

	RUN_NOT_FINISHED("Run not finished"),

	TEXT_ALREADY_STARTED("Text message already started"),

	TEXT_NOT_STARTED("Text message not started"),

	TEXT_NOT_ENDED("Text message not ended"),

	TOOL_ALREADY_STARTED("Tool call already started"),

	TOOL_NOT_STARTED("Tool call not started"),

	TOOL_NOT_ENDED("Tool call not ended"),

	STEP_NOT_STARTED("Step not started"),

	STEP_NOT_FINISHED("Step not finished"),

	THINKING_ALREADY_STARTED("Thinking already started"),

	THINKING_NOT_STARTED("Thinking not started"),

	THINKING_MESSAGE_ALREADY_STARTED("Thinking message already started"),

	THINKING_MESSAGE_NOT_STARTED("Thinking message not started");

	private final String description;

	VerifyErrorKind(String description) {
		this.description = description;
	}

	public String getDescription() {
		return this.description;
	}

	/**
	 * Whether this violation can only be detected once the stream has ended.
	 */
	public boolean isEndOfStream() {
		return this == RUN_NOT_FINISHED || this == TEXT_NOT_ENDED || this == TOOL_NOT_ENDED
				|| this == STEP_NOT_FINISHED;
	}

}
