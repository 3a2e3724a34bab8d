/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.subscriber;

import java.util.List;
import java.util.function.BiFunction;

import com.agui.sdk.session.Session;
import com.agui.sdk.spec.AgUiSchema;
import com.agui.sdk.util.Assert;

/**
 * Observes events before they reach the session reducer, and may replace the session's
 * messages or state or stop an event from propagating.
 *
 * <p>
 * {@link #onEvent(AgUiSchema.Event, Session)} sees every event. The remaining callbacks
 * are optional hooks with more context: the run lifecycle hooks and the streaming
 * hooks are called after {@code onEvent} and before the reducer, while
 * {@link #onStateChanged(Object, Session)} and {@link #onMessagesChanged(List, Session)}
 * are called after the reducer when the event changed state or messages. Results of
 * all hooks are applied to the session; only the pre-reducer hooks can stop
 * propagation.
 */
@FunctionalInterface
public interface AgUiSubscriber {

	/**
	 * Called for every event.
	 * @param event the event about to be applied
	 * @param session the session before the event
	 * @return what to do with the event
	 */
	SubscriberResult onEvent(AgUiSchema.Event event, Session session);

	default SubscriberResult onRunStarted(AgUiSchema.RunStarted event, Session session) {
		return SubscriberResult.proceed();
	}

	default SubscriberResult onRunFinished(AgUiSchema.RunFinished event, Session session) {
		return SubscriberResult.proceed();
	}

	default SubscriberResult onRunError(AgUiSchema.RunError event, Session session) {
		return SubscriberResult.proceed();
	}

	/**
	 * Called for each text delta.
	 * @param event the content event
	 * @param buffer the message text including this delta
	 * @param session the session before the event
	 */
	default SubscriberResult onTextMessageContent(AgUiSchema.TextMessageContent event, String buffer,
			Session session) {
		return SubscriberResult.proceed();
	}

	/**
	 * Called for each tool argument delta.
	 * @param event the args event
	 * @param buffer the arguments including this delta
	 * @param session the session before the event
	 */
	default SubscriberResult onToolCallArgs(AgUiSchema.ToolCallArgs event, String buffer, Session session) {
		return SubscriberResult.proceed();
	}

	/**
	 * Called after a state snapshot or delta changed the state.
	 */
	default SubscriberResult onStateChanged(Object state, Session session) {
		return SubscriberResult.proceed();
	}

	/**
	 * Called after an event changed the messages.
	 */
	default SubscriberResult onMessagesChanged(List<AgUiSchema.Message> messages, Session session) {
		return SubscriberResult.proceed();
	}

	/**
	 * Creates a subscriber that handles one event class and lets every other event
	 * through unchanged.
	 * @param eventClass the event record class to handle
	 * @param handler the handler for matching events
	 */
	static <E extends AgUiSchema.Event> AgUiSubscriber on(Class<E> eventClass,
			BiFunction<E, Session, SubscriberResult> handler) {
		Assert.notNull(eventClass, "Event class must not be null");
		Assert.notNull(handler, "Handler must not be null");
		return (event, session) -> eventClass.isInstance(event) ? handler.apply(eventClass.cast(event), session)
				: SubscriberResult.proceed();
	}

}
