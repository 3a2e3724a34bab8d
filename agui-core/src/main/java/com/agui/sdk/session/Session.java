/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.agui.sdk.spec.AgUiSchema;
import com.agui.sdk.util.Assert;

/**
 * Client-side view of a conversation thread, built by applying events with
 * {@link SessionReducer}.
 *
 * <p>
 * Immutable. {@link #mutate()} returns a builder seeded with this session for deriving
 * an updated copy. Buffers hold text messages and tool calls that are still streaming;
 * they are keyed by message id and tool call id and keep insertion order.
 *
 * @param threadId the conversation thread, once known
 * @param runId the current or last run
 * @param status lifecycle status of the current run
 * @param errorMessage the error message when {@code status} is {@link RunStatus#ERRORED}
 * @param messages the finalized conversation
 * @param state the shared state, an arbitrary JSON tree
 * @param steps steps of the current run, in start order
 * @param textBuffers text messages being streamed
 * @param toolBuffers tool calls being streamed
 * @param thinking thinking status of the current run
 */
public record Session(String threadId, String runId, RunStatus status, String errorMessage,
		List<AgUiSchema.Message> messages, Object state, List<Step> steps, Map<String, TextBuffer> textBuffers,
		Map<String, ToolBuffer> toolBuffers, ThinkingState thinking) {

	public Session {
		Assert.notNull(status, "Status must not be null");
		Assert.notNull(thinking, "Thinking state must not be null");
		messages = List.copyOf(messages);
		steps = List.copyOf(steps);
		textBuffers = Collections.unmodifiableMap(new LinkedHashMap<>(textBuffers));
		toolBuffers = Collections.unmodifiableMap(new LinkedHashMap<>(toolBuffers));
	}

	/**
	 * Creates an empty idle session with an empty object as state.
	 */
	public static Session create() {
		return create(null);
	}

	public static Session create(String threadId) {
		return new Session(threadId, null, RunStatus.IDLE, null, List.of(), Map.of(), List.of(), Map.of(), Map.of(),
				ThinkingState.idle());
	}

	/**
	 * Creates an idle session seeded with the thread, messages and state of a run input.
	 */
	public static Session fromInput(AgUiSchema.RunAgentInput input) {
		Assert.notNull(input, "Run input must not be null");
		return create(input.threadId()).mutate()
			.messages(input.messages() != null ? input.messages() : List.of())
			.state(input.state() != null ? input.state() : Map.of())
			.build();
	}

	public Builder mutate() {
		return new Builder(this);
	}

	// ---------------------------
	// Queries
	// ---------------------------

	public boolean isRunning() {
		return this.status == RunStatus.RUNNING;
	}

	public boolean isFinished() {
		return this.status == RunStatus.FINISHED;
	}

	public boolean isErrored() {
		return this.status == RunStatus.ERRORED;
	}

	/**
	 * Whether any text message or tool call is still streaming.
	 */
	public boolean isStreaming() {
		return !this.textBuffers.isEmpty() || !this.toolBuffers.isEmpty();
	}

	/**
	 * Returns the text received so far for a streaming message.
	 */
	public Optional<String> streamingText(String messageId) {
		return Optional.ofNullable(this.textBuffers.get(messageId)).map(TextBuffer::content);
	}

	/**
	 * Returns the arguments received so far for a streaming tool call.
	 */
	public Optional<String> streamingToolArgs(String toolCallId) {
		return Optional.ofNullable(this.toolBuffers.get(toolCallId)).map(ToolBuffer::args);
	}

	public Optional<AgUiSchema.Message> findMessage(String messageId) {
		return this.messages.stream().filter(message -> messageId.equals(message.id())).findFirst();
	}

	public List<AgUiSchema.Message> messagesByRole(String role) {
		return this.messages.stream().filter(message -> role.equals(message.role())).toList();
	}

	public Optional<AgUiSchema.Message> lastMessage() {
		return this.messages.isEmpty() ? Optional.empty()
				: Optional.of(this.messages.get(this.messages.size() - 1));
	}

	/**
	 * Returns the most recently started step with the given name.
	 */
	public Optional<Step> findStep(String name) {
		for (int i = this.steps.size() - 1; i >= 0; i--) {
			if (this.steps.get(i).name().equals(name)) {
				return Optional.of(this.steps.get(i));
			}
		}
		return Optional.empty();
	}

	/**
	 * Builder for deriving a modified copy of a session.
	 */
	public static final class Builder {

		private String threadId;

		private String runId;

		private RunStatus status;

		private String errorMessage;

		private List<AgUiSchema.Message> messages;

		private Object state;

		private List<Step> steps;

		private Map<String, TextBuffer> textBuffers;

		private Map<String, ToolBuffer> toolBuffers;

		private ThinkingState thinking;

		private Builder(Session session) {
			this.threadId = session.threadId;
			this.runId = session.runId;
			this.status = session.status;
			this.errorMessage = session.errorMessage;
			this.messages = session.messages;
			this.state = session.state;
			this.steps = session.steps;
			this.textBuffers = session.textBuffers;
			this.toolBuffers = session.toolBuffers;
			this.thinking = session.thinking;
		}

		public Builder threadId(String threadId) {
			this.threadId = threadId;
			return this;
		}

		public Builder runId(String runId) {
			this.runId = runId;
			return this;
		}

		public Builder status(RunStatus status) {
			this.status = status;
			return this;
		}

		public Builder errorMessage(String errorMessage) {
			this.errorMessage = errorMessage;
			return this;
		}

		public Builder messages(List<AgUiSchema.Message> messages) {
			Assert.notNull(messages, "Messages must not be null");
			this.messages = messages;
			return this;
		}

		public Builder addMessage(AgUiSchema.Message message) {
			List<AgUiSchema.Message> updated = new ArrayList<>(this.messages);
			updated.add(message);
			this.messages = updated;
			return this;
		}

		public Builder state(Object state) {
			this.state = state;
			return this;
		}

		public Builder steps(List<Step> steps) {
			Assert.notNull(steps, "Steps must not be null");
			this.steps = steps;
			return this;
		}

		public Builder textBuffers(Map<String, TextBuffer> textBuffers) {
			Assert.notNull(textBuffers, "Text buffers must not be null");
			this.textBuffers = textBuffers;
			return this;
		}

		public Builder toolBuffers(Map<String, ToolBuffer> toolBuffers) {
			Assert.notNull(toolBuffers, "Tool buffers must not be null");
			this.toolBuffers = toolBuffers;
			return this;
		}

		public Builder thinking(ThinkingState thinking) {
			this.thinking = thinking;
			return this;
		}

		public Session build() {
			return new Session(this.threadId, this.runId, this.status, this.errorMessage, this.messages, this.state,
					this.steps, this.textBuffers, this.toolBuffers, this.thinking);
		}

	}

}
