/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.middleware;

import java.util.List;

import com.agui.sdk.spec.AgUiSchema;
import com.agui.sdk.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Composes middlewares around an {@link AgentRunner}.
 *
 * <p>
 * Middlewares wrap in registration order: the first one is outermost, sees the input
 * first and the events last.
 *
 * <pre>{@code
 * AgentRunner runner = MiddlewareChain.chain(List.of(auth, logging), agent);
 * Flux<AgUiSchema.Event> events = runner.run(input);
 * }</pre>
 */
public final class MiddlewareChain {

	private static final Logger logger = LoggerFactory.getLogger(MiddlewareChain.class);

	private MiddlewareChain() {
	}

	/**
	 * Wraps {@code runner} with the given middlewares, first-registered outermost.
	 * @param middlewares the middlewares, possibly empty
	 * @param runner the innermost runner
	 * @return a runner that goes through every middleware
	 */
	public static AgentRunner chain(List<AgUiMiddleware> middlewares, AgentRunner runner) {
		Assert.notNull(middlewares, "Middlewares must not be null");
		Assert.notNull(runner, "Runner must not be null");
		AgentRunner next = runner;
		for (int i = middlewares.size() - 1; i >= 0; i--) {
			next = apply(middlewares.get(i), next);
		}
		return next;
	}

	/**
	 * Wraps {@code runner} with a single middleware.
	 */
	public static AgentRunner apply(AgUiMiddleware middleware, AgentRunner runner) {
		Assert.notNull(middleware, "Middleware must not be null");
		Assert.notNull(runner, "Runner must not be null");
		return input -> middleware.call(input, runner);
	}

	/**
	 * Turns a failure of {@code runner}, whether thrown or signalled, into a trailing
	 * {@code RUN_ERROR} event so that the stream always completes normally.
	 */
	public static AgentRunner withErrorHandling(AgentRunner runner) {
		Assert.notNull(runner, "Runner must not be null");
		return input -> Flux.defer(() -> runner.run(input)).onErrorResume(ex -> {
			logger.warn("Agent run {} failed, emitting RUN_ERROR", input.runId(), ex);
			return Mono.just(runError(ex));
		});
	}

	private static AgUiSchema.Event runError(Throwable ex) {
		String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getName();
		return new AgUiSchema.RunError(message, null, System.currentTimeMillis(), null);
	}

}
