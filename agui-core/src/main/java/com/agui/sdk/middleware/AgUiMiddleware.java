/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.middleware;

import com.agui.sdk.spec.AgUiSchema;
import reactor.core.publisher.Flux;

/**
 * Intercepts an agent run. A middleware may rewrite the input before calling
 * {@code next}, and may transform, filter or extend the event stream {@code next}
 * returns.
 *
 * @see MiddlewareChain
 */
@FunctionalInterface
public interface AgUiMiddleware {

	/**
	 * @param input the run input
	 * @param next the rest of the chain, ending with the agent itself
	 * @return the events of the run
	 */
	Flux<AgUiSchema.Event> call(AgUiSchema.RunAgentInput input, AgentRunner next);

}
