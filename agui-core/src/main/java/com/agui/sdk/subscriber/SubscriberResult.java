/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.subscriber;

import java.util.List;

import com.agui.sdk.session.Session;
import com.agui.sdk.spec.AgUiSchema;

/**
 * What a subscriber wants done with the event it was shown.
 *
 * <p>
 * A {@code null} {@code messages} or {@code state} leaves that part of the session
 * alone. When {@code stopPropagation} is set, later subscribers do not see the event and
 * it is not emitted downstream; the reducer still applies it.
 *
 * @param messages replacement messages, or {@code null}
 * @param state replacement state, or {@code null}
 * @param stopPropagation whether to stop the event here
 */
public record SubscriberResult(List<AgUiSchema.Message> messages, Object state, boolean stopPropagation) {

	private static final SubscriberResult PROCEED = new SubscriberResult(null, null, false);

	/**
	 * Continue without changes.
	 */
	public static SubscriberResult proceed() {
		return PROCEED;
	}

	public static SubscriberResult replaceMessages(List<AgUiSchema.Message> messages) {
		return new SubscriberResult(messages, null, false);
	}

	public static SubscriberResult replaceState(Object state) {
		return new SubscriberResult(null, state, false);
	}

	public static SubscriberResult stop() {
		return new SubscriberResult(null, null, true);
	}

	public SubscriberResult withMessages(List<AgUiSchema.Message> messages) {
		return new SubscriberResult(messages, this.state, this.stopPropagation);
	}

	public SubscriberResult withState(Object state) {
		return new SubscriberResult(this.messages, state, this.stopPropagation);
	}

	public SubscriberResult withStopPropagation() {
		return new SubscriberResult(this.messages, this.state, true);
	}

	public boolean isMutation() {
		return this.messages != null || this.state != null;
	}

	/**
	 * Applies the requested replacements to a session.
	 */
	public Session applyTo(Session session) {
		if (!isMutation()) {
			return session;
		}
		Session.Builder builder = session.mutate();
		if (this.messages != null) {
			builder.messages(this.messages);
		}
		if (this.state != null) {
			builder.state(this.state);
		}
		return builder.build();
	}

}
