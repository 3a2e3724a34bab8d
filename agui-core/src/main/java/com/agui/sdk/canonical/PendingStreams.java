/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.canonical;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Streams opened by chunk events that have not been closed yet.
 *
 * <p>
 * Immutable: every transition returns a new instance. Open streams are kept in
 * registration order so that synthesized END events are emitted deterministically.
 *
 * @param textStreams open text message ids mapped to their role
 * @param toolStreams open tool call ids mapped to their name and parent message
 * @param currentTextId the text message chunks currently append to, or {@code null}
 * @param currentToolId the tool call chunks currently append to, or {@code null}
 */
public record PendingStreams(Map<String, String> textStreams, Map<String, PendingToolCall> toolStreams,
		String currentTextId, String currentToolId) {

	private static final PendingStreams EMPTY = new PendingStreams(Map.of(), Map.of(), null, null);

	public PendingStreams {
		textStreams = Collections.unmodifiableMap(new LinkedHashMap<>(textStreams));
		toolStreams = Collections.unmodifiableMap(new LinkedHashMap<>(toolStreams));
	}

	/**
	 * A tool call opened by a chunk.
	 */
	public record PendingToolCall(String toolCallName, String parentMessageId) {
	}

	public static PendingStreams empty() {
		return EMPTY;
	}

	public boolean isEmpty() {
		return this.textStreams.isEmpty() && this.toolStreams.isEmpty();
	}

	public boolean isTextOpen(String messageId) {
		return this.textStreams.containsKey(messageId);
	}

	public boolean isToolOpen(String toolCallId) {
		return this.toolStreams.containsKey(toolCallId);
	}

	PendingStreams openText(String messageId, String role) {
		Map<String, String> texts = new LinkedHashMap<>(this.textStreams);
		texts.put(messageId, role);
		return new PendingStreams(texts, this.toolStreams, messageId, this.currentToolId);
	}

	PendingStreams focusText(String messageId) {
		return new PendingStreams(this.textStreams, this.toolStreams, messageId, this.currentToolId);
	}

	PendingStreams closeText(String messageId) {
		Map<String, String> texts = new LinkedHashMap<>(this.textStreams);
		texts.remove(messageId);
		String current = messageId.equals(this.currentTextId) ? null : this.currentTextId;
		return new PendingStreams(texts, this.toolStreams, current, this.currentToolId);
	}

	PendingStreams openTool(String toolCallId, PendingToolCall toolCall) {
		Map<String, PendingToolCall> tools = new LinkedHashMap<>(this.toolStreams);
		tools.put(toolCallId, toolCall);
		return new PendingStreams(this.textStreams, tools, this.currentTextId, toolCallId);
	}

	PendingStreams focusTool(String toolCallId) {
		return new PendingStreams(this.textStreams, this.toolStreams, this.currentTextId, toolCallId);
	}

	PendingStreams closeTool(String toolCallId) {
		Map<String, PendingToolCall> tools = new LinkedHashMap<>(this.toolStreams);
		tools.remove(toolCallId);
		String current = toolCallId.equals(this.currentToolId) ? null : this.currentToolId;
		return new PendingStreams(this.textStreams, tools, this.currentTextId, current);
	}

}
