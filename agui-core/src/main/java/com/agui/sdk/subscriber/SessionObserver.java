/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.subscriber;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.agui.sdk.session.Session;
import com.agui.sdk.session.SessionReducer;
import com.agui.sdk.spec.AgUiSchema;
import com.agui.sdk.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

/**
 * Owns a session and keeps it current as events flow through a {@link SubscriberChain}
 * and the {@link SessionReducer}.
 *
 * <p>
 * For each event the chain runs first, its mutations are applied, the reducer applies
 * the event, and the post-update hooks run. The event is then emitted unless a
 * subscriber stopped its propagation.
 *
 * <p>
 * An observer is the single writer of its session and must be fed from one stream at a
 * time. {@link #session()} may be read from any thread.
 */
public final class SessionObserver {

	private static final Logger logger = LoggerFactory.getLogger(SessionObserver.class);

	private final SubscriberChain chain;

	private volatile Session session;

	public SessionObserver(Session initial) {
		this(SubscriberChain.empty(), initial);
	}

	public SessionObserver(SubscriberChain chain, Session initial) {
		Assert.notNull(chain, "Subscriber chain must not be null");
		Assert.notNull(initial, "Initial session must not be null");
		this.chain = chain;
		this.session = initial;
	}

	/**
	 * Returns the session after the last processed event.
	 */
	public Session session() {
		return this.session;
	}

	/**
	 * Processes one event.
	 * @param event the next event
	 * @return the event, or empty if a subscriber stopped its propagation
	 */
	public Optional<AgUiSchema.Event> onEvent(AgUiSchema.Event event) {
		Assert.notNull(event, "Event must not be null");
		SubscriberChain.Dispatch dispatch = this.chain.dispatch(event, this.session);
		Session before = dispatch.session();
		Session after = SessionReducer.apply(before, event);
		this.session = this.chain.afterApply(event, before, after);
		if (dispatch.stopPropagation()) {
			logger.debug("Propagation of {} stopped by subscriber", event.eventType().wireName());
			return Optional.empty();
		}
		return Optional.of(event);
	}

	/**
	 * Processes a stream of events, emitting those that were not stopped.
	 */
	public Flux<AgUiSchema.Event> observe(Flux<AgUiSchema.Event> events) {
		Assert.notNull(events, "Events must not be null");
		return events.<AgUiSchema.Event>handle((event, sink) -> onEvent(event).ifPresent(sink::next));
	}

	/**
	 * Processes a sequence of events.
	 * @return the events that were not stopped, in order
	 */
	public List<AgUiSchema.Event> observeAll(Iterable<AgUiSchema.Event> events) {
		Assert.notNull(events, "Events must not be null");
		List<AgUiSchema.Event> emitted = new ArrayList<>();
		for (AgUiSchema.Event event : events) {
			onEvent(event).ifPresent(emitted::add);
		}
		return emitted;
	}

}
