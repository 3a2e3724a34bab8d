/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.subscriber;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import com.agui.sdk.session.Session;
import com.agui.sdk.spec.AgUiSchema;
import com.agui.sdk.spec.EventType;
import com.agui.sdk.util.Assert;

/**
 * An ordered list of subscribers. Subscribers are called in registration order and each
 * sees the mutations of the ones before it. A subscriber that stops propagation ends the
 * chain for that event.
 */
public final class SubscriberChain {

	private static final SubscriberChain EMPTY = new SubscriberChain(List.of());

	private final List<AgUiSubscriber> subscribers;

	private SubscriberChain(List<AgUiSubscriber> subscribers) {
		this.subscribers = List.copyOf(subscribers);
	}

	public static SubscriberChain empty() {
		return EMPTY;
	}

	public static SubscriberChain of(AgUiSubscriber... subscribers) {
		Assert.notNull(subscribers, "Subscribers must not be null");
		return of(Arrays.asList(subscribers));
	}

	public static SubscriberChain of(List<AgUiSubscriber> subscribers) {
		Assert.notNull(subscribers, "Subscribers must not be null");
		subscribers.forEach(subscriber -> Assert.notNull(subscriber, "Subscriber must not be null"));
		return new SubscriberChain(subscribers);
	}

	/**
	 * Returns a chain with {@code subscriber} appended.
	 */
	public SubscriberChain with(AgUiSubscriber subscriber) {
		Assert.notNull(subscriber, "Subscriber must not be null");
		List<AgUiSubscriber> extended = new ArrayList<>(this.subscribers);
		extended.add(subscriber);
		return new SubscriberChain(extended);
	}

	public List<AgUiSubscriber> subscribers() {
		return this.subscribers;
	}

	public boolean isEmpty() {
		return this.subscribers.isEmpty();
	}

	/**
	 * Runs the pre-reducer phase for one event: {@code onEvent} on each subscriber, then
	 * the specialized hooks, unless a subscriber stopped propagation.
	 * @param event the event about to be applied
	 * @param session the session before the event
	 * @return the mutated session and whether propagation was stopped
	 */
	public Dispatch dispatch(AgUiSchema.Event event, Session session) {
		Session current = session;
		for (AgUiSubscriber subscriber : this.subscribers) {
			SubscriberResult result = orProceed(subscriber.onEvent(event, current));
			current = result.applyTo(current);
			if (result.stopPropagation()) {
				return new Dispatch(current, true);
			}
		}
		for (AgUiSubscriber subscriber : this.subscribers) {
			SubscriberResult result = orProceed(specialized(subscriber, event, current));
			current = result.applyTo(current);
			if (result.stopPropagation()) {
				return new Dispatch(current, true);
			}
		}
		return new Dispatch(current, false);
	}

	/**
	 * Runs the post-reducer hooks for one event.
	 * @param event the event that was applied
	 * @param before the session the reducer was given
	 * @param after the session the reducer returned
	 * @return {@code after}, with any hook mutations applied
	 */
	public Session afterApply(AgUiSchema.Event event, Session before, Session after) {
		EventType type = event.eventType();
		boolean stateEvent = type == EventType.STATE_SNAPSHOT || type == EventType.STATE_DELTA;
		Session current = after;
		if (stateEvent && !Objects.equals(before.state(), after.state())) {
			for (AgUiSubscriber subscriber : this.subscribers) {
				current = orProceed(subscriber.onStateChanged(current.state(), current)).applyTo(current);
			}
		}
		else if (!before.messages().equals(after.messages())) {
			for (AgUiSubscriber subscriber : this.subscribers) {
				current = orProceed(subscriber.onMessagesChanged(current.messages(), current)).applyTo(current);
			}
		}
		return current;
	}

	private static SubscriberResult specialized(AgUiSubscriber subscriber, AgUiSchema.Event event,
			Session session) {
		return switch (event.eventType()) {
			case RUN_STARTED -> subscriber.onRunStarted((AgUiSchema.RunStarted) event, session);
			case RUN_FINISHED -> subscriber.onRunFinished((AgUiSchema.RunFinished) event, session);
			case RUN_ERROR -> subscriber.onRunError((AgUiSchema.RunError) event, session);
			case TEXT_MESSAGE_CONTENT -> {
				AgUiSchema.TextMessageContent content = (AgUiSchema.TextMessageContent) event;
				String buffer = session.streamingText(content.messageId()).orElse("") + nullToEmpty(content.delta());
				yield subscriber.onTextMessageContent(content, buffer, session);
			}
			case TOOL_CALL_ARGS -> {
				AgUiSchema.ToolCallArgs args = (AgUiSchema.ToolCallArgs) event;
				String buffer = session.streamingToolArgs(args.toolCallId()).orElse("") + nullToEmpty(args.delta());
				yield subscriber.onToolCallArgs(args, buffer, session);
			}
			default -> SubscriberResult.proceed();
		};
	}

	private static SubscriberResult orProceed(SubscriberResult result) {
		return result != null ? result : SubscriberResult.proceed();
	}

	private static String nullToEmpty(String value) {
		return value != null ? value : "";
	}

	/**
	 * Outcome of the pre-reducer phase.
	 */
	public record Dispatch(Session session, boolean stopPropagation) {
	}

}
