/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.middleware;

import java.util.List;

import com.agui.sdk.spec.AgUiSchema;
import com.agui.sdk.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import reactor.core.publisher.Flux;

/**
 * Logs the lifecycle of agent runs and, optionally, every event.
 *
 * <p>
 * Run start, completion and failure are logged at INFO and ERROR with the elapsed time;
 * individual events are logged at the configured level (DEBUG by default).
 */
public final class LoggingMiddleware implements AgUiMiddleware {

	private static final Logger logger = LoggerFactory.getLogger(LoggingMiddleware.class);

	private final Level eventLevel;

	private final boolean logEvents;

	private LoggingMiddleware(Builder builder) {
		this.eventLevel = builder.eventLevel;
		this.logEvents = builder.logEvents;
	}

	/**
	 * Creates a middleware with the default settings.
	 */
	public static LoggingMiddleware create() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Flux<AgUiSchema.Event> call(AgUiSchema.RunAgentInput input, AgentRunner next) {
		return Flux.defer(() -> {
			long start = System.nanoTime();
			logger.info("Starting agent run {} (thread {})", input.runId(), input.threadId());
			return next.run(input).doOnNext(event -> {
				if (this.logEvents) {
					logger.atLevel(this.eventLevel).log("Run {} event: {}", input.runId(), describe(event));
				}
				if (event instanceof AgUiSchema.RunFinished) {
					logger.info("Agent run {} finished in {}ms", input.runId(), elapsedMillis(start));
				}
				else if (event instanceof AgUiSchema.RunError) {
					logger.error("Agent run {} failed after {}ms: {}", input.runId(), elapsedMillis(start),
							((AgUiSchema.RunError) event).message());
				}
			}).doOnError(ex -> logger.error("Agent run {} terminated after {}ms", input.runId(),
					elapsedMillis(start), ex));
		});
	}

	/**
	 * Short human-readable description of an event, naming the ids it concerns.
	 */
	static String describe(AgUiSchema.Event event) {
		String type = event.eventType().wireName();
		return switch (event.eventType()) {
			case RUN_ERROR -> type + ": " + ((AgUiSchema.RunError) event).message();
			case STEP_STARTED -> type + " (" + ((AgUiSchema.StepStarted) event).stepName() + ")";
			case STEP_FINISHED -> type + " (" + ((AgUiSchema.StepFinished) event).stepName() + ")";
			case TEXT_MESSAGE_START -> type + " (" + ((AgUiSchema.TextMessageStart) event).messageId() + ")";
			case TEXT_MESSAGE_CONTENT -> type + " (" + ((AgUiSchema.TextMessageContent) event).messageId() + ")";
			case TEXT_MESSAGE_END -> type + " (" + ((AgUiSchema.TextMessageEnd) event).messageId() + ")";
			case TEXT_MESSAGE_CHUNK -> type + " (" + ((AgUiSchema.TextMessageChunk) event).messageId() + ")";
			case TOOL_CALL_START -> {
				AgUiSchema.ToolCallStart start = (AgUiSchema.ToolCallStart) event;
				yield type + " (" + start.toolCallId() + ": " + start.toolCallName() + ")";
			}
			case TOOL_CALL_ARGS -> type + " (" + ((AgUiSchema.ToolCallArgs) event).toolCallId() + ")";
			case TOOL_CALL_END -> type + " (" + ((AgUiSchema.ToolCallEnd) event).toolCallId() + ")";
			case TOOL_CALL_RESULT -> type + " (" + ((AgUiSchema.ToolCallResult) event).toolCallId() + ")";
			case TOOL_CALL_CHUNK -> type + " (" + ((AgUiSchema.ToolCallChunk) event).toolCallId() + ")";
			case STATE_DELTA -> type + " (" + sizeOf(((AgUiSchema.StateDelta) event).delta()) + " ops)";
			case MESSAGES_SNAPSHOT -> type + " (" + sizeOf(((AgUiSchema.MessagesSnapshot) event).messages())
					+ " msgs)";
			case ACTIVITY_SNAPSHOT -> {
				AgUiSchema.ActivitySnapshot snapshot = (AgUiSchema.ActivitySnapshot) event;
				yield type + " (" + snapshot.messageId() + ": " + snapshot.activityType() + ")";
			}
			case ACTIVITY_DELTA -> type + " (" + ((AgUiSchema.ActivityDelta) event).messageId() + ")";
			case CUSTOM -> type + " (" + ((AgUiSchema.Custom) event).name() + ")";
			case RUN_STARTED, RUN_FINISHED, STATE_SNAPSHOT, THINKING_START, THINKING_END,
					THINKING_TEXT_MESSAGE_START, THINKING_TEXT_MESSAGE_CONTENT, THINKING_TEXT_MESSAGE_END, RAW ->
				type;
		};
	}

	private static int sizeOf(List<?> list) {
		return list != null ? list.size() : 0;
	}

	private static long elapsedMillis(long startNanos) {
		return (System.nanoTime() - startNanos) / 1_000_000;
	}

	public static final class Builder {

		private Level eventLevel = Level.DEBUG;

		private boolean logEvents = true;

		private Builder() {
		}

		/**
		 * Sets the level individual events are logged at. Defaults to DEBUG.
		 */
		public Builder eventLevel(Level eventLevel) {
			Assert.notNull(eventLevel, "Event level must not be null");
			this.eventLevel = eventLevel;
			return this;
		}

		/**
		 * Whether to log individual events at all. Defaults to {@code true}.
		 */
		public Builder logEvents(boolean logEvents) {
			this.logEvents = logEvents;
			return this;
		}

		public LoggingMiddleware build() {
			return new LoggingMiddleware(this);
		}

	}

}
