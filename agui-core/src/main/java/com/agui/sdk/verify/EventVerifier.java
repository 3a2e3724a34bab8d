/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.verify;

import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import com.agui.sdk.error.AgUiVerificationException;
import com.agui.sdk.error.VerifyErrorKind;
import com.agui.sdk.session.RunStatus;
import com.agui.sdk.spec.AgUiSchema;
import com.agui.sdk.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Checks that an event stream follows the AG-UI protocol.
 *
 * <p>
 * The verifier is a state machine over {@link VerifierState}. Run-level rules come
 * first: a stream must open with {@code RUN_STARTED} (or fail immediately with
 * {@code RUN_ERROR}), a finished or errored run only accepts the start of a new run, and
 * a run cannot be started twice. Within a running run, text messages and tool calls must
 * be started before they receive content and ended exactly once, steps must be started
 * before they finish, and thinking blocks must not nest. Distinct message and tool call
 * ids may be open concurrently. A run that errors discards whatever it left open.
 *
 * <p>
 * Chunk events, tool call results, state, activity, raw and custom events are accepted
 * without changing the state. A stream is expected to be canonicalized before it is
 * verified.
 */
public final class EventVerifier {

	private static final Logger logger = LoggerFactory.getLogger(EventVerifier.class);

	private EventVerifier() {
	}

	/**
	 * Checks one event against the state accumulated so far.
	 * @param state the current verifier state
	 * @param event the next event
	 * @return the state after the event
	 * @throws AgUiVerificationException if the event violates the protocol
	 */
	public static VerifierState verifyEvent(VerifierState state, AgUiSchema.Event event) {
		Assert.notNull(state, "Verifier state must not be null");
		Assert.notNull(event, "Event must not be null");

		switch (state.runStatus()) {
			case ERRORED:
				if (event instanceof AgUiSchema.RunStarted) {
					return VerifierState.initial().withRunStatus(RunStatus.RUNNING);
				}
				throw violation(VerifyErrorKind.RUN_ALREADY_ERRORED, null, event);
			case FINISHED:
				if (event instanceof AgUiSchema.RunStarted) {
					return VerifierState.initial().withRunStatus(RunStatus.RUNNING);
				}
				if (event instanceof AgUiSchema.RunError) {
					return VerifierState.initial().withRunStatus(RunStatus.ERRORED);
				}
				throw violation(VerifyErrorKind.RUN_ALREADY_FINISHED, null, event);
			case IDLE:
				if (event instanceof AgUiSchema.RunStarted) {
					return state.withRunStatus(RunStatus.RUNNING);
				}
				if (event instanceof AgUiSchema.RunError) {
					return state.withRunStatus(RunStatus.ERRORED);
				}
				throw violation(VerifyErrorKind.FIRST_EVENT_MUST_BE_RUN_STARTED, null, event);
			case RUNNING:
				break;
		}

		return switch (event.eventType()) {
			case RUN_STARTED -> throw violation(VerifyErrorKind.RUN_ALREADY_STARTED, null, event);
			case RUN_FINISHED -> state.withRunStatus(RunStatus.FINISHED);
			case RUN_ERROR -> VerifierState.initial().withRunStatus(RunStatus.ERRORED);

			case TEXT_MESSAGE_START -> openText(state, ((AgUiSchema.TextMessageStart) event).messageId(), event);
			case TEXT_MESSAGE_CONTENT -> requireText(state, ((AgUiSchema.TextMessageContent) event).messageId(),
					event);
			case TEXT_MESSAGE_END -> {
				String messageId = ((AgUiSchema.TextMessageEnd) event).messageId();
				requireText(state, messageId, event);
				yield state.withOpenTextIds(VerifierState.removing(state.openTextIds(), messageId));
			}

			case TOOL_CALL_START -> openTool(state, ((AgUiSchema.ToolCallStart) event).toolCallId(), event);
			case TOOL_CALL_ARGS -> requireTool(state, ((AgUiSchema.ToolCallArgs) event).toolCallId(), event);
			case TOOL_CALL_END -> {
				String toolCallId = ((AgUiSchema.ToolCallEnd) event).toolCallId();
				requireTool(state, toolCallId, event);
				yield state.withOpenToolIds(VerifierState.removing(state.openToolIds(), toolCallId));
			}

			case STEP_STARTED -> state
				.withActiveSteps(VerifierState.adding(state.activeSteps(), ((AgUiSchema.StepStarted) event).stepName()));
			case STEP_FINISHED -> {
				String stepName = ((AgUiSchema.StepFinished) event).stepName();
				if (!state.activeSteps().contains(stepName)) {
					throw violation(VerifyErrorKind.STEP_NOT_STARTED, stepName, event);
				}
				yield state.withActiveSteps(VerifierState.removing(state.activeSteps(), stepName));
			}

			case THINKING_START -> {
				if (state.thinkingActive()) {
					throw violation(VerifyErrorKind.THINKING_ALREADY_STARTED, null, event);
				}
				yield state.withThinking(true, state.thinkingMessageActive());
			}
			case THINKING_END -> {
				if (!state.thinkingActive()) {
					throw violation(VerifyErrorKind.THINKING_NOT_STARTED, null, event);
				}
				yield state.withThinking(false, state.thinkingMessageActive());
			}
			case THINKING_TEXT_MESSAGE_START -> {
				if (state.thinkingMessageActive()) {
					throw violation(VerifyErrorKind.THINKING_MESSAGE_ALREADY_STARTED, null, event);
				}
				yield state.withThinking(state.thinkingActive(), true);
			}
			case THINKING_TEXT_MESSAGE_CONTENT -> {
				if (!state.thinkingMessageActive()) {
					throw violation(VerifyErrorKind.THINKING_MESSAGE_NOT_STARTED, null, event);
				}
				yield state;
			}
			case THINKING_TEXT_MESSAGE_END -> {
				if (!state.thinkingMessageActive()) {
					throw violation(VerifyErrorKind.THINKING_MESSAGE_NOT_STARTED, null, event);
				}
				yield state.withThinking(state.thinkingActive(), false);
			}

			case TEXT_MESSAGE_CHUNK, TOOL_CALL_CHUNK, TOOL_CALL_RESULT, STATE_SNAPSHOT, STATE_DELTA,
					MESSAGES_SNAPSHOT, ACTIVITY_SNAPSHOT, ACTIVITY_DELTA, RAW, CUSTOM ->
				state;
		};
	}

	/**
	 * Checks that nothing is left open once the stream has ended. A stream that never
	 * started a run ends cleanly, as does one whose last run errored.
	 * @param state the state after the last event
	 * @throws AgUiVerificationException for a run still running, then for the first
	 * text message, tool call or step left open, in that order
	 */
	public static void finish(VerifierState state) {
		Assert.notNull(state, "Verifier state must not be null");
		if (state.runStatus() == RunStatus.RUNNING) {
			throw violation(VerifyErrorKind.RUN_NOT_FINISHED, null, null);
		}
		if (!state.openTextIds().isEmpty()) {
			throw violation(VerifyErrorKind.TEXT_NOT_ENDED, first(state.openTextIds()), null);
		}
		if (!state.openToolIds().isEmpty()) {
			throw violation(VerifyErrorKind.TOOL_NOT_ENDED, first(state.openToolIds()), null);
		}
		if (!state.activeSteps().isEmpty()) {
			throw violation(VerifyErrorKind.STEP_NOT_FINISHED, first(state.activeSteps()), null);
		}
	}

	/**
	 * Verifies a complete event sequence, including the end-of-stream checks.
	 * @param events the events, in order
	 * @return the first violation found, or a valid result
	 */
	public static VerificationResult verify(Iterable<AgUiSchema.Event> events) {
		Assert.notNull(events, "Events must not be null");
		VerifierState state = VerifierState.initial();
		for (AgUiSchema.Event event : events) {
			try {
				state = verifyEvent(state, event);
			}
			catch (AgUiVerificationException ex) {
				return VerificationResult.invalid(new VerificationError(ex.getKind(), ex.getSubject(), event, state));
			}
		}
		try {
			finish(state);
		}
		catch (AgUiVerificationException ex) {
			return VerificationResult.invalid(new VerificationError(ex.getKind(), ex.getSubject(), null, state));
		}
		return VerificationResult.valid();
	}

	/**
	 * Verifies an event stream as it flows. Each subscription verifies independently.
	 * @param events the event stream
	 * @param mode {@link VerificationMode#STRICT} terminates the stream on the first
	 * violation, {@link VerificationMode#LENIENT} logs it and forwards the event,
	 * {@link VerificationMode#DISABLED} returns the stream unchanged
	 * @return the verified stream
	 */
	public static Flux<AgUiSchema.Event> verify(Flux<AgUiSchema.Event> events, VerificationMode mode) {
		Assert.notNull(events, "Events must not be null");
		Assert.notNull(mode, "Verification mode must not be null");
		if (mode == VerificationMode.DISABLED) {
			return events;
		}
		return Flux.defer(() -> {
			AtomicReference<VerifierState> state = new AtomicReference<>(VerifierState.initial());
			Flux<AgUiSchema.Event> checked = events.<AgUiSchema.Event>handle((event, sink) -> {
				try {
					state.set(verifyEvent(state.get(), event));
					sink.next(event);
				}
				catch (AgUiVerificationException ex) {
					if (mode == VerificationMode.STRICT) {
						sink.error(ex);
					}
					else {
						logger.warn("Protocol violation: {} (event={})", ex.getMessage(), event);
						sink.next(event);
					}
				}
			});
			return checked.concatWith(Mono.defer(() -> {
				try {
					finish(state.get());
				}
				catch (AgUiVerificationException ex) {
					if (mode == VerificationMode.STRICT) {
						return Mono.error(ex);
					}
					logger.warn("Protocol violation at end of stream: {}", ex.getMessage());
				}
				return Mono.empty();
			}));
		});
	}

	private static VerifierState openText(VerifierState state, String messageId, AgUiSchema.Event event) {
		if (state.openTextIds().contains(messageId)) {
			throw violation(VerifyErrorKind.TEXT_ALREADY_STARTED, messageId, event);
		}
		return state.withOpenTextIds(VerifierState.adding(state.openTextIds(), messageId));
	}

	private static VerifierState requireText(VerifierState state, String messageId, AgUiSchema.Event event) {
		if (!state.openTextIds().contains(messageId)) {
			throw violation(VerifyErrorKind.TEXT_NOT_STARTED, messageId, event);
		}
		return state;
	}

	private static VerifierState openTool(VerifierState state, String toolCallId, AgUiSchema.Event event) {
		if (state.openToolIds().contains(toolCallId)) {
			throw violation(VerifyErrorKind.TOOL_ALREADY_STARTED, toolCallId, event);
		}
		return state.withOpenToolIds(VerifierState.adding(state.openToolIds(), toolCallId));
	}

	private static VerifierState requireTool(VerifierState state, String toolCallId, AgUiSchema.Event event) {
		if (!state.openToolIds().contains(toolCallId)) {
			throw violation(VerifyErrorKind.TOOL_NOT_STARTED, toolCallId, event);
		}
		return state;
	}

	private static String first(Set<String> values) {
		return values.iterator().next();
	}

	private static AgUiVerificationException violation(VerifyErrorKind kind, String subject,
			AgUiSchema.Event event) {
		return new AgUiVerificationException(kind, subject, event);
	}

}
