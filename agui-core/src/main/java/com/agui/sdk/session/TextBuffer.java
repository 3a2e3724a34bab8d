/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.session;

import java.util.ArrayList;
import java.util.List;

import com.agui.sdk.spec.AgUiSchema;

/**
 * A text message being streamed. Tool calls whose parent is this message are collected
 * here until the message ends.
 */
public record TextBuffer(String role, String content, List<AgUiSchema.ToolCall> toolCalls) {

	public TextBuffer {
		if (role == null) {
			role = AgUiSchema.ROLE_ASSISTANT;
		}
		toolCalls = List.copyOf(toolCalls);
	}

	public static TextBuffer open(String role) {
		return new TextBuffer(role, "", List.of());
	}

	public TextBuffer append(String delta) {
		return new TextBuffer(this.role, this.content + delta, this.toolCalls);
	}

	public TextBuffer withToolCall(AgUiSchema.ToolCall toolCall) {
		List<AgUiSchema.ToolCall> calls = new ArrayList<>(this.toolCalls);
		calls.add(toolCall);
		return new TextBuffer(this.role, this.content, calls);
	}

	/**
	 * Builds the message this buffer finalizes into, typed after its role.
	 */
	AgUiSchema.Message toMessage(String messageId) {
		switch (this.role) {
			case AgUiSchema.ROLE_USER:
				return new AgUiSchema.UserMessage(messageId, this.content);
			case AgUiSchema.ROLE_SYSTEM:
				return new AgUiSchema.SystemMessage(messageId, this.content);
			case AgUiSchema.ROLE_DEVELOPER:
				return new AgUiSchema.DeveloperMessage(messageId, this.content);
			default:
				return new AgUiSchema.AssistantMessage(messageId, this.content,
						this.toolCalls.isEmpty() ? null : this.toolCalls);
		}
	}

}
