/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.session;

/**
 * Whether the agent is currently thinking, and the thinking text received in this run.
 */
public record ThinkingState(boolean active, String content) {

	private static final ThinkingState IDLE = new ThinkingState(false, "");

	public static ThinkingState idle() {
		return IDLE;
	}

	public ThinkingState withActive(boolean active) {
		return new ThinkingState(active, this.content);
	}

	public ThinkingState append(String delta) {
		return new ThinkingState(this.active, this.content + delta);
	}

}
