/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.canonical;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import java.util.function.Function;

import com.agui.sdk.spec.AgUiSchema;
import com.agui.sdk.spec.EventType;
import com.agui.sdk.util.Assert;

/**
 * Compacts a recorded canonical event log for persistence and replay.
 *
 * <p>
 * Within each text message, all {@code TEXT_MESSAGE_CONTENT} deltas are merged into one
 * event carrying the timestamp and raw event of the first delta. Tool call
 * {@code TOOL_CALL_ARGS} deltas are merged the same way. Events that arrived while a
 * stream was open are moved after the END of the last open stream. Streams without an
 * END are still flushed, without one. State deltas are not folded into snapshots.
 */
public final class EventCompactor {

	private static final StreamFamily TEXT = new StreamFamily(EventType.TEXT_MESSAGE_START,
			EventType.TEXT_MESSAGE_CONTENT, EventType.TEXT_MESSAGE_END, EventCompactor::messageId,
			(first, delta) -> {
				AgUiSchema.TextMessageContent content = (AgUiSchema.TextMessageContent) first;
				return new AgUiSchema.TextMessageContent(content.messageId(), delta, content.timestamp(),
						content.rawEvent());
			});

	private static final StreamFamily TOOL = new StreamFamily(EventType.TOOL_CALL_START, EventType.TOOL_CALL_ARGS,
			EventType.TOOL_CALL_END, EventCompactor::toolCallId, (first, delta) -> {
				AgUiSchema.ToolCallArgs args = (AgUiSchema.ToolCallArgs) first;
				return new AgUiSchema.ToolCallArgs(args.toolCallId(), delta, args.timestamp(), args.rawEvent());
			});

	private EventCompactor() {
	}

	/**
	 * Compacts text messages first, then tool calls.
	 * @param events a canonical event log
	 * @return the compacted log
	 */
	public static List<AgUiSchema.Event> compact(List<AgUiSchema.Event> events) {
		Assert.notNull(events, "Events must not be null");
		return compact(compact(events, TEXT), TOOL);
	}

	private static List<AgUiSchema.Event> compact(List<AgUiSchema.Event> events, StreamFamily family) {
		List<AgUiSchema.Event> result = new ArrayList<>();
		Map<String, OpenStream> open = new LinkedHashMap<>();
		List<AgUiSchema.Event> interleaved = new ArrayList<>();

		for (AgUiSchema.Event event : events) {
			EventType type = event.eventType();
			if (type == family.start()) {
				open.put(family.id().apply(event), new OpenStream(event));
			}
			else if (type == family.delta() || type == family.end()) {
				OpenStream stream = open.get(family.id().apply(event));
				if (stream == null) {
					result.add(event);
				}
				else if (type == family.delta()) {
					stream.deltas.add(event);
				}
				else {
					open.remove(family.id().apply(event));
					result.addAll(stream.flush(family));
					result.add(event);
					if (open.isEmpty()) {
						result.addAll(interleaved);
						interleaved.clear();
					}
				}
			}
			else if (!open.isEmpty()) {
				interleaved.add(event);
			}
			else {
				result.add(event);
			}
		}

		for (OpenStream stream : open.values()) {
			result.addAll(stream.flush(family));
		}
		result.addAll(interleaved);
		return result;
	}

	private static String messageId(AgUiSchema.Event event) {
		return switch (event.eventType()) {
			case TEXT_MESSAGE_START -> ((AgUiSchema.TextMessageStart) event).messageId();
			case TEXT_MESSAGE_CONTENT -> ((AgUiSchema.TextMessageContent) event).messageId();
			case TEXT_MESSAGE_END -> ((AgUiSchema.TextMessageEnd) event).messageId();
			default -> throw new IllegalArgumentException("Not a text message event: " + event.eventType());
		};
	}

	private static String toolCallId(AgUiSchema.Event event) {
		return switch (event.eventType()) {
			case TOOL_CALL_START -> ((AgUiSchema.ToolCallStart) event).toolCallId();
			case TOOL_CALL_ARGS -> ((AgUiSchema.ToolCallArgs) event).toolCallId();
			case TOOL_CALL_END -> ((AgUiSchema.ToolCallEnd) event).toolCallId();
			default -> throw new IllegalArgumentException("Not a tool call event: " + event.eventType());
		};
	}

	private static String deltaOf(AgUiSchema.Event event) {
		if (event instanceof AgUiSchema.TextMessageContent) {
			return ((AgUiSchema.TextMessageContent) event).delta();
		}
		return ((AgUiSchema.ToolCallArgs) event).delta();
	}

	private record StreamFamily(EventType start, EventType delta, EventType end,
			Function<AgUiSchema.Event, String> id,
			BiFunction<AgUiSchema.Event, String, AgUiSchema.Event> merge) {
	}

	private static final class OpenStream {

		private final AgUiSchema.Event start;

		private final List<AgUiSchema.Event> deltas = new ArrayList<>();

		OpenStream(AgUiSchema.Event start) {
			this.start = start;
		}

		List<AgUiSchema.Event> flush(StreamFamily family) {
			List<AgUiSchema.Event> flushed = new ArrayList<>();
			flushed.add(this.start);
			if (!this.deltas.isEmpty()) {
				StringBuilder merged = new StringBuilder();
				for (AgUiSchema.Event delta : this.deltas) {
					merged.append(deltaOf(delta));
				}
				flushed.add(family.merge().apply(this.deltas.get(0), merged.toString()));
			}
			return flushed;
		}

	}

}
