/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import com.agui.sdk.canonical.EventCanonicalizer;
import com.agui.sdk.middleware.AgUiMiddleware;
import com.agui.sdk.middleware.AgentRunner;
import com.agui.sdk.middleware.MiddlewareChain;
import com.agui.sdk.session.Session;
import com.agui.sdk.spec.AgUiEventCodec;
import com.agui.sdk.spec.AgUiSchema;
import com.agui.sdk.spec.DecodeFailurePolicy;
import com.agui.sdk.subscriber.AgUiSubscriber;
import com.agui.sdk.subscriber.SessionObserver;
import com.agui.sdk.subscriber.SubscriberChain;
import com.agui.sdk.util.Assert;
import com.agui.sdk.verify.EventVerifier;
import com.agui.sdk.verify.VerificationMode;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

/**
 * Entry point that wires the protocol stages together: decoding, canonicalization,
 * verification and session reduction with subscribers.
 *
 * <pre>{@code
 * AgUiPipeline pipeline = AgUiPipeline.builder()
 * 	.verification(VerificationMode.LENIENT)
 * 	.subscriber(mySubscriber)
 * 	.build();
 *
 * pipeline.process(events).blockLast();
 * Session session = pipeline.session();
 * }</pre>
 *
 * <p>
 * Each subscription to a processed stream starts from the configured initial session;
 * {@link #session()} reports the session of the most recent one.
 */
public final class AgUiPipeline {

	private static final Logger logger = LoggerFactory.getLogger(AgUiPipeline.class);

	private final boolean canonicalize;

	private final VerificationMode verification;

	private final DecodeFailurePolicy decodeFailurePolicy;

	private final AgUiEventCodec codec;

	private final Session initialSession;

	private final SubscriberChain subscribers;

	private final List<AgUiMiddleware> middlewares;

	private final AtomicReference<SessionObserver> current = new AtomicReference<>();

	private AgUiPipeline(Builder builder) {
		this.canonicalize = builder.canonicalize;
		this.verification = builder.verification;
		this.decodeFailurePolicy = builder.decodeFailurePolicy;
		this.codec = builder.codec != null ? builder.codec : new AgUiEventCodec();
		this.initialSession = builder.initialSession;
		this.subscribers = SubscriberChain.of(builder.subscribers);
		this.middlewares = List.copyOf(builder.middlewares);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Processes a stream of decoded events.
	 * @return the events that reached the session, after canonicalization and
	 * verification and minus those stopped by a subscriber
	 */
	public Flux<AgUiSchema.Event> process(Flux<AgUiSchema.Event> events) {
		Assert.notNull(events, "Events must not be null");
		return process(events, this.initialSession != null ? this.initialSession : Session.create());
	}

	/**
	 * Decodes wire frames with the configured codec and failure policy, then processes
	 * them like {@link #process(Flux)}.
	 */
	public Flux<AgUiSchema.Event> processWire(Flux<? extends Map<String, ?>> frames) {
		Assert.notNull(frames, "Frames must not be null");
		return process(this.codec.decode(frames, this.decodeFailurePolicy));
	}

	/**
	 * Runs an agent through the configured middlewares and processes its events. Without
	 * a configured initial session, the session is seeded from {@code input}.
	 */
	public Flux<AgUiSchema.Event> run(AgentRunner agent, AgUiSchema.RunAgentInput input) {
		Assert.notNull(agent, "Agent must not be null");
		Assert.notNull(input, "Input must not be null");
		AgentRunner runner = MiddlewareChain.chain(this.middlewares, agent);
		Session seed = this.initialSession != null ? this.initialSession : Session.fromInput(input);
		logger.debug("Running agent for thread {} run {} through {} middlewares", input.threadId(), input.runId(),
				this.middlewares.size());
		return process(Flux.defer(() -> runner.run(input)), seed);
	}

	/**
	 * Returns the session of the most recent subscription, or the initial session when
	 * nothing has been processed yet.
	 */
	public Session session() {
		SessionObserver observer = this.current.get();
		if (observer != null) {
			return observer.session();
		}
		return this.initialSession != null ? this.initialSession : Session.create();
	}

	private Flux<AgUiSchema.Event> process(Flux<AgUiSchema.Event> events, Session seed) {
		return Flux.defer(() -> {
			Flux<AgUiSchema.Event> stream = this.canonicalize ? EventCanonicalizer.canonicalize(events) : events;
			stream = EventVerifier.verify(stream, this.verification);
			SessionObserver observer = new SessionObserver(this.subscribers, seed);
			this.current.set(observer);
			return observer.observe(stream);
		});
	}

	public static final class Builder {

		private boolean canonicalize = true;

		private VerificationMode verification = VerificationMode.STRICT;

		private DecodeFailurePolicy decodeFailurePolicy = DecodeFailurePolicy.ABORT;

		private AgUiEventCodec codec;

		private Session initialSession;

		private final List<AgUiSubscriber> subscribers = new ArrayList<>();

		private final List<AgUiMiddleware> middlewares = new ArrayList<>();

		private Builder() {
		}

		/**
		 * Whether chunk events are expanded before verification. Defaults to
		 * {@code true}.
		 */
		public Builder canonicalize(boolean canonicalize) {
			this.canonicalize = canonicalize;
			return this;
		}

		/**
		 * Defaults to {@link VerificationMode#STRICT}.
		 */
		public Builder verification(VerificationMode verification) {
			Assert.notNull(verification, "Verification mode must not be null");
			this.verification = verification;
			return this;
		}

		/**
		 * How {@link #processWire(Flux)} treats frames that fail to decode. Defaults to
		 * {@link DecodeFailurePolicy#ABORT}.
		 */
		public Builder decodeFailurePolicy(DecodeFailurePolicy decodeFailurePolicy) {
			Assert.notNull(decodeFailurePolicy, "Decode failure policy must not be null");
			this.decodeFailurePolicy = decodeFailurePolicy;
			return this;
		}

		public Builder codec(AgUiEventCodec codec) {
			Assert.notNull(codec, "Codec must not be null");
			this.codec = codec;
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "JsonMapper must not be null");
			this.codec = new AgUiEventCodec(jsonMapper);
			return this;
		}

		public Builder initialSession(Session initialSession) {
			Assert.notNull(initialSession, "Initial session must not be null");
			this.initialSession = initialSession;
			return this;
		}

		/**
		 * Adds a subscriber. Subscribers run in registration order.
		 */
		public Builder subscriber(AgUiSubscriber subscriber) {
			Assert.notNull(subscriber, "Subscriber must not be null");
			this.subscribers.add(subscriber);
			return this;
		}

		/**
		 * Adds a middleware. The first one added is outermost.
		 */
		public Builder middleware(AgUiMiddleware middleware) {
			Assert.notNull(middleware, "Middleware must not be null");
			this.middlewares.add(middleware);
			return this;
		}

		public AgUiPipeline build() {
			return new AgUiPipeline(this);
		}

	}

}
