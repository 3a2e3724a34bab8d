/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.canonical;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import com.agui.sdk.spec.AgUiSchema;
import com.agui.sdk.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

/**
 * Rewrites an event stream into canonical form, where every text message and tool call
 * is an explicit START / CONTENT (or ARGS) / END triad.
 *
 * <p>
 * {@code TEXT_MESSAGE_CHUNK} and {@code TOOL_CALL_CHUNK} are expanded: the first chunk of
 * an id opens the stream, later chunks add content, and the stream is closed as soon as
 * a chunk for another stream or any other non-passthrough event arrives. Streams still
 * open when the input ends are closed by {@link #finish(PendingStreams)}.
 *
 * <p>
 * The step function {@link #expand(PendingStreams, AgUiSchema.Event)} is pure. Input that
 * contains no chunk events is returned unchanged, which makes canonicalization
 * idempotent.
 */
public final class EventCanonicalizer {

	private static final Logger logger = LoggerFactory.getLogger(EventCanonicalizer.class);

	private EventCanonicalizer() {
	}

	/**
	 * Canonicalizes one event.
	 * @param pending the streams left open by previous events
	 * @param event the next input event
	 * @return the new pending streams and the canonical events to emit
	 */
	public static Expansion expand(PendingStreams pending, AgUiSchema.Event event) {
		Assert.notNull(pending, "Pending streams must not be null");
		Assert.notNull(event, "Event must not be null");
		return switch (event.eventType()) {
			case TEXT_MESSAGE_CHUNK -> expandTextChunk(pending, (AgUiSchema.TextMessageChunk) event);
			case TOOL_CALL_CHUNK -> expandToolChunk(pending, (AgUiSchema.ToolCallChunk) event);
			case RAW, ACTIVITY_SNAPSHOT, ACTIVITY_DELTA -> new Expansion(pending, List.of(event));
			case RUN_STARTED, RUN_FINISHED, RUN_ERROR, STEP_STARTED, STEP_FINISHED, TEXT_MESSAGE_START,
					TEXT_MESSAGE_CONTENT, TEXT_MESSAGE_END, TOOL_CALL_START, TOOL_CALL_ARGS, TOOL_CALL_END,
					TOOL_CALL_RESULT, STATE_SNAPSHOT, STATE_DELTA, MESSAGES_SNAPSHOT, THINKING_START, THINKING_END,
					THINKING_TEXT_MESSAGE_START, THINKING_TEXT_MESSAGE_CONTENT, THINKING_TEXT_MESSAGE_END, CUSTOM ->
				closeAllThen(pending, event);
		};
	}

	/**
	 * Closes every stream still open at end of input.
	 * @param pending the streams left open
	 * @return END events for open text messages, then for open tool calls
	 */
	public static List<AgUiSchema.Event> finish(PendingStreams pending) {
		Assert.notNull(pending, "Pending streams must not be null");
		List<AgUiSchema.Event> events = new ArrayList<>();
		for (String messageId : pending.textStreams().keySet()) {
			logger.debug("Closing text message {}", messageId);
			events.add(new AgUiSchema.TextMessageEnd(messageId));
		}
		for (String toolCallId : pending.toolStreams().keySet()) {
			logger.debug("Closing tool call {}", toolCallId);
			events.add(new AgUiSchema.ToolCallEnd(toolCallId));
		}
		return events;
	}

	/**
	 * Canonicalizes a complete event sequence.
	 */
	public static List<AgUiSchema.Event> canonicalize(List<AgUiSchema.Event> events) {
		Assert.notNull(events, "Events must not be null");
		PendingStreams pending = PendingStreams.empty();
		List<AgUiSchema.Event> result = new ArrayList<>();
		for (AgUiSchema.Event event : events) {
			Expansion expansion = expand(pending, event);
			pending = expansion.pending();
			result.addAll(expansion.events());
		}
		result.addAll(finish(pending));
		return result;
	}

	/**
	 * Canonicalizes an event stream. Each subscription keeps its own pending streams,
	 * which are closed when the source completes. A subscriber that cancels early
	 * receives no synthesized END events.
	 */
	public static Flux<AgUiSchema.Event> canonicalize(Flux<AgUiSchema.Event> events) {
		Assert.notNull(events, "Events must not be null");
		return Flux.defer(() -> {
			AtomicReference<PendingStreams> pending = new AtomicReference<>(PendingStreams.empty());
			return events.concatMapIterable(event -> {
				Expansion expansion = expand(pending.get(), event);
				pending.set(expansion.pending());
				return expansion.events();
			}).concatWith(Flux.defer(() -> Flux.fromIterable(finish(pending.get()))));
		});
	}

	private static Expansion expandTextChunk(PendingStreams pending, AgUiSchema.TextMessageChunk chunk) {
		String messageId = chunk.messageId() != null ? chunk.messageId() : pending.currentTextId();
		if (messageId == null) {
			logger.warn("Dropping TEXT_MESSAGE_CHUNK without messageId: no text message is open");
			return new Expansion(pending, List.of());
		}

		List<AgUiSchema.Event> events = new ArrayList<>();
		PendingStreams next = closeCurrentTool(pending, events);
		if (next.currentTextId() != null && !next.currentTextId().equals(messageId)) {
			next = closeText(next, next.currentTextId(), events);
		}

		if (next.isTextOpen(messageId)) {
			next = next.focusText(messageId);
		}
		else {
			String role = chunk.role() != null ? chunk.role() : AgUiSchema.ROLE_ASSISTANT;
			events.add(new AgUiSchema.TextMessageStart(messageId, role, chunk.timestamp(), chunk.rawEvent()));
			next = next.openText(messageId, role);
		}

		if (chunk.delta() != null && !chunk.delta().isEmpty()) {
			events.add(new AgUiSchema.TextMessageContent(messageId, chunk.delta(), chunk.timestamp(),
					chunk.rawEvent()));
		}
		return new Expansion(next, events);
	}

	private static Expansion expandToolChunk(PendingStreams pending, AgUiSchema.ToolCallChunk chunk) {
		String toolCallId = chunk.toolCallId() != null ? chunk.toolCallId() : pending.currentToolId();
		if (toolCallId == null) {
			logger.warn("Dropping TOOL_CALL_CHUNK without toolCallId: no tool call is open");
			return new Expansion(pending, List.of());
		}
		boolean opening = !pending.isToolOpen(toolCallId);
		if (opening && chunk.toolCallName() == null) {
			logger.warn("Dropping first TOOL_CALL_CHUNK of tool call {}: toolCallName is required", toolCallId);
			return new Expansion(pending, List.of());
		}

		List<AgUiSchema.Event> events = new ArrayList<>();
		PendingStreams next = pending;
		if (next.currentTextId() != null) {
			next = closeText(next, next.currentTextId(), events);
		}
		if (next.currentToolId() != null && !next.currentToolId().equals(toolCallId)) {
			next = closeTool(next, next.currentToolId(), events);
		}

		if (opening) {
			events.add(new AgUiSchema.ToolCallStart(toolCallId, chunk.toolCallName(), chunk.parentMessageId(),
					chunk.timestamp(), chunk.rawEvent()));
			next = next.openTool(toolCallId,
					new PendingStreams.PendingToolCall(chunk.toolCallName(), chunk.parentMessageId()));
		}
		else {
			next = next.focusTool(toolCallId);
		}

		if (chunk.delta() != null && !chunk.delta().isEmpty()) {
			events.add(new AgUiSchema.ToolCallArgs(toolCallId, chunk.delta(), chunk.timestamp(), chunk.rawEvent()));
		}
		return new Expansion(next, events);
	}

	private static Expansion closeAllThen(PendingStreams pending, AgUiSchema.Event event) {
		if (pending.isEmpty()) {
			return new Expansion(pending, List.of(event));
		}
		List<AgUiSchema.Event> events = new ArrayList<>(finish(pending));
		events.add(event);
		return new Expansion(PendingStreams.empty(), events);
	}

	private static PendingStreams closeCurrentTool(PendingStreams pending, List<AgUiSchema.Event> events) {
		if (pending.currentToolId() == null) {
			return pending;
		}
		return closeTool(pending, pending.currentToolId(), events);
	}

	private static PendingStreams closeText(PendingStreams pending, String messageId, List<AgUiSchema.Event> events) {
		logger.debug("Closing text message {}", messageId);
		events.add(new AgUiSchema.TextMessageEnd(messageId));
		return pending.closeText(messageId);
	}

	private static PendingStreams closeTool(PendingStreams pending, String toolCallId, List<AgUiSchema.Event> events) {
		logger.debug("Closing tool call {}", toolCallId);
		events.add(new AgUiSchema.ToolCallEnd(toolCallId));
		return pending.closeTool(toolCallId);
	}

}
