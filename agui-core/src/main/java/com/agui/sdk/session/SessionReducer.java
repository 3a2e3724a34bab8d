/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.session;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.agui.sdk.patch.JsonPatch;
import com.agui.sdk.spec.AgUiSchema;
import com.agui.sdk.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

/**
 * Applies events to a {@link Session}.
 *
 * <p>
 * {@link #apply(Session, AgUiSchema.Event)} is pure and total: it never throws for a
 * well-typed event and returns the session unchanged when an event refers to a message
 * or tool call it does not know. State deltas are applied with
 * {@link JsonPatch#apply(Object, List)}, skipping operations that do not resolve.
 */
public final class SessionReducer {

	private static final Logger logger = LoggerFactory.getLogger(SessionReducer.class);

	private SessionReducer() {
	}

	public static Session apply(Session session, AgUiSchema.Event event) {
		Assert.notNull(session, "Session must not be null");
		Assert.notNull(event, "Event must not be null");
		return switch (event.eventType()) {
			case RUN_STARTED -> runStarted(session, (AgUiSchema.RunStarted) event);
			case RUN_FINISHED -> runFinished(session);
			case RUN_ERROR -> runError(session, (AgUiSchema.RunError) event);
			case STEP_STARTED -> stepStarted(session, ((AgUiSchema.StepStarted) event).stepName());
			case STEP_FINISHED -> stepFinished(session, ((AgUiSchema.StepFinished) event).stepName());

			case TEXT_MESSAGE_START -> {
				AgUiSchema.TextMessageStart start = (AgUiSchema.TextMessageStart) event;
				yield withTextBuffer(session, start.messageId(), TextBuffer.open(start.role()));
			}
			case TEXT_MESSAGE_CONTENT -> {
				AgUiSchema.TextMessageContent content = (AgUiSchema.TextMessageContent) event;
				TextBuffer buffer = session.textBuffers().get(content.messageId());
				if (buffer == null) {
					buffer = TextBuffer.open(AgUiSchema.ROLE_ASSISTANT);
				}
				yield withTextBuffer(session, content.messageId(), buffer.append(nullToEmpty(content.delta())));
			}
			case TEXT_MESSAGE_END -> textMessageEnd(session, ((AgUiSchema.TextMessageEnd) event).messageId());
			case TEXT_MESSAGE_CHUNK -> textMessageChunk(session, (AgUiSchema.TextMessageChunk) event);

			case TOOL_CALL_START -> {
				AgUiSchema.ToolCallStart start = (AgUiSchema.ToolCallStart) event;
				yield withToolBuffer(session, start.toolCallId(),
						ToolBuffer.open(start.toolCallName(), start.parentMessageId()));
			}
			case TOOL_CALL_ARGS -> {
				AgUiSchema.ToolCallArgs args = (AgUiSchema.ToolCallArgs) event;
				ToolBuffer buffer = session.toolBuffers().get(args.toolCallId());
				yield buffer == null ? session
						: withToolBuffer(session, args.toolCallId(), buffer.append(nullToEmpty(args.delta())));
			}
			case TOOL_CALL_END -> toolCallEnd(session, ((AgUiSchema.ToolCallEnd) event).toolCallId());
			case TOOL_CALL_RESULT -> {
				AgUiSchema.ToolCallResult result = (AgUiSchema.ToolCallResult) event;
				yield session.mutate()
					.addMessage(new AgUiSchema.ToolMessage(result.messageId(), result.content(), result.toolCallId()))
					.build();
			}
			case TOOL_CALL_CHUNK -> toolCallChunk(session, (AgUiSchema.ToolCallChunk) event);

			case STATE_SNAPSHOT -> session.mutate().state(((AgUiSchema.StateSnapshot) event).snapshot()).build();
			case STATE_DELTA -> session.mutate()
				.state(JsonPatch.apply(session.state(), ((AgUiSchema.StateDelta) event).delta()))
				.build();
			case MESSAGES_SNAPSHOT -> {
				List<AgUiSchema.Message> messages = ((AgUiSchema.MessagesSnapshot) event).messages();
				yield session.mutate()
					.messages(messages == null ? List.of() : messages.stream().filter(Objects::nonNull).toList())
					.build();
			}
			case ACTIVITY_SNAPSHOT -> activitySnapshot(session, (AgUiSchema.ActivitySnapshot) event);
			case ACTIVITY_DELTA -> activityDelta(session, (AgUiSchema.ActivityDelta) event);

			case THINKING_START -> session.mutate().thinking(session.thinking().withActive(true)).build();
			case THINKING_END -> session.mutate().thinking(session.thinking().withActive(false)).build();
			case THINKING_TEXT_MESSAGE_CONTENT -> session.mutate()
				.thinking(session.thinking()
					.append(nullToEmpty(((AgUiSchema.ThinkingTextMessageContent) event).delta())))
				.build();
			case THINKING_TEXT_MESSAGE_START, THINKING_TEXT_MESSAGE_END, RAW, CUSTOM -> session;
		};
	}

	/**
	 * Applies events in order.
	 */
	public static Session applyAll(Session session, Iterable<AgUiSchema.Event> events) {
		Assert.notNull(events, "Events must not be null");
		Session current = session;
		for (AgUiSchema.Event event : events) {
			current = apply(current, event);
		}
		return current;
	}

	/**
	 * Folds an event stream into successive sessions, one per event.
	 * @param events the event stream
	 * @param initial the session before the first event
	 * @return the session after each event, in order
	 */
	public static Flux<Session> reduce(Flux<AgUiSchema.Event> events, Session initial) {
		Assert.notNull(events, "Events must not be null");
		Assert.notNull(initial, "Initial session must not be null");
		return events.scan(initial, SessionReducer::apply).skip(1);
	}

	private static Session runStarted(Session session, AgUiSchema.RunStarted event) {
		return session.mutate()
			.threadId(event.threadId())
			.runId(event.runId())
			.status(RunStatus.RUNNING)
			.errorMessage(null)
			.steps(List.of())
			.textBuffers(Map.of())
			.toolBuffers(Map.of())
			.thinking(ThinkingState.idle())
			.build();
	}

	private static Session runFinished(Session session) {
		Session.Builder builder = session.mutate();
		for (Map.Entry<String, TextBuffer> entry : session.textBuffers().entrySet()) {
			logger.debug("Flushing text message {} still open at RUN_FINISHED", entry.getKey());
			builder.addMessage(entry.getValue().toMessage(entry.getKey()));
		}
		return builder.textBuffers(Map.of()).toolBuffers(Map.of()).status(RunStatus.FINISHED).build();
	}

	/**
	 * Fails the run. Messages and tool calls still streaming are discarded, not flushed.
	 */
	private static Session runError(Session session, AgUiSchema.RunError event) {
		if (session.isStreaming()) {
			logger.debug("Discarding {} text and {} tool buffers at RUN_ERROR", session.textBuffers().size(),
					session.toolBuffers().size());
		}
		return session.mutate()
			.status(RunStatus.ERRORED)
			.errorMessage(event.message())
			.textBuffers(Map.of())
			.toolBuffers(Map.of())
			.thinking(session.thinking().withActive(false))
			.build();
	}

	private static Session stepStarted(Session session, String stepName) {
		List<Step> steps = new ArrayList<>(session.steps());
		steps.add(Step.started(stepName));
		return session.mutate().steps(steps).build();
	}

	private static Session stepFinished(Session session, String stepName) {
		List<Step> steps = new ArrayList<>(session.steps().size());
		for (Step step : session.steps()) {
			steps.add(step.name().equals(stepName) ? step.finish() : step);
		}
		return session.mutate().steps(steps).build();
	}

	private static Session textMessageEnd(Session session, String messageId) {
		TextBuffer buffer = session.textBuffers().get(messageId);
		if (buffer == null) {
			return session;
		}
		Map<String, TextBuffer> buffers = new LinkedHashMap<>(session.textBuffers());
		buffers.remove(messageId);
		return session.mutate().addMessage(buffer.toMessage(messageId)).textBuffers(buffers).build();
	}

	private static Session textMessageChunk(Session session, AgUiSchema.TextMessageChunk chunk) {
		if (chunk.messageId() == null) {
			return session;
		}
		TextBuffer buffer = session.textBuffers().get(chunk.messageId());
		if (buffer == null) {
			buffer = TextBuffer.open(chunk.role());
		}
		if (chunk.delta() != null) {
			buffer = buffer.append(chunk.delta());
		}
		return withTextBuffer(session, chunk.messageId(), buffer);
	}

	/**
	 * Finalizes a tool call and attaches it to its parent message: the streaming text
	 * message with that id, else the assistant message with that id. With no parent to
	 * attach to, the call is recorded on a new assistant message.
	 */
	private static Session toolCallEnd(Session session, String toolCallId) {
		ToolBuffer buffer = session.toolBuffers().get(toolCallId);
		if (buffer == null) {
			return session;
		}
		AgUiSchema.ToolCall toolCall = new AgUiSchema.ToolCall(toolCallId, buffer.name(), buffer.args());
		Map<String, ToolBuffer> toolBuffers = new LinkedHashMap<>(session.toolBuffers());
		toolBuffers.remove(toolCallId);
		Session.Builder builder = session.mutate().toolBuffers(toolBuffers);

		String parentId = buffer.parentMessageId();
		TextBuffer parentBuffer = parentId != null ? session.textBuffers().get(parentId) : null;
		if (parentBuffer != null) {
			Map<String, TextBuffer> textBuffers = new LinkedHashMap<>(session.textBuffers());
			textBuffers.put(parentId, parentBuffer.withToolCall(toolCall));
			return builder.textBuffers(textBuffers).build();
		}

		if (parentId != null) {
			List<AgUiSchema.Message> messages = new ArrayList<>(session.messages());
			for (int i = 0; i < messages.size(); i++) {
				AgUiSchema.Message message = messages.get(i);
				if (parentId.equals(message.id()) && message instanceof AgUiSchema.AssistantMessage) {
					messages.set(i, ((AgUiSchema.AssistantMessage) message).withToolCall(toolCall));
					return builder.messages(messages).build();
				}
			}
		}

		String messageId = parentId != null ? parentId : toolCallId;
		return builder.addMessage(new AgUiSchema.AssistantMessage(messageId, null, List.of(toolCall))).build();
	}

	private static Session toolCallChunk(Session session, AgUiSchema.ToolCallChunk chunk) {
		if (chunk.toolCallId() == null) {
			return session;
		}
		ToolBuffer buffer = session.toolBuffers().get(chunk.toolCallId());
		if (buffer == null) {
			if (chunk.toolCallName() == null) {
				return session;
			}
			buffer = ToolBuffer.open(chunk.toolCallName(), chunk.parentMessageId());
		}
		if (chunk.delta() != null) {
			buffer = buffer.append(chunk.delta());
		}
		return withToolBuffer(session, chunk.toolCallId(), buffer);
	}

	private static Session activitySnapshot(Session session, AgUiSchema.ActivitySnapshot event) {
		AgUiSchema.ActivityMessage activity = new AgUiSchema.ActivityMessage(event.messageId(),
				event.activityType(), event.content());
		List<AgUiSchema.Message> messages = new ArrayList<>(session.messages());
		for (int i = 0; i < messages.size(); i++) {
			if (Objects.equals(event.messageId(), messages.get(i).id())) {
				if (!event.replaceExisting()) {
					return session;
				}
				messages.set(i, activity);
				return session.mutate().messages(messages).build();
			}
		}
		messages.add(activity);
		return session.mutate().messages(messages).build();
	}

	private static Session activityDelta(Session session, AgUiSchema.ActivityDelta event) {
		List<AgUiSchema.Message> messages = new ArrayList<>(session.messages());
		for (int i = 0; i < messages.size(); i++) {
			AgUiSchema.Message message = messages.get(i);
			if (Objects.equals(event.messageId(), message.id()) && message instanceof AgUiSchema.ActivityMessage) {
				AgUiSchema.ActivityMessage activity = (AgUiSchema.ActivityMessage) message;
				messages.set(i, new AgUiSchema.ActivityMessage(activity.id(), activity.activityType(),
						JsonPatch.apply(activity.content(), event.patch())));
				return session.mutate().messages(messages).build();
			}
		}
		return session;
	}

	private static Session withTextBuffer(Session session, String messageId, TextBuffer buffer) {
		Map<String, TextBuffer> buffers = new LinkedHashMap<>(session.textBuffers());
		buffers.put(messageId, buffer);
		return session.mutate().textBuffers(buffers).build();
	}

	private static Session withToolBuffer(Session session, String toolCallId, ToolBuffer buffer) {
		Map<String, ToolBuffer> buffers = new LinkedHashMap<>(session.toolBuffers());
		buffers.put(toolCallId, buffer);
		return session.mutate().toolBuffers(buffers).build();
	}

	private static String nullToEmpty(String value) {
		return value != null ? value : "";
	}

}
