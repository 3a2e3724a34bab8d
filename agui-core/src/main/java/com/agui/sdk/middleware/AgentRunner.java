/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.middleware;

import com.agui.sdk.spec.AgUiSchema;
import reactor.core.publisher.Flux;

/**
 * Runs an agent for one input and streams the events it produces.
 */
@FunctionalInterface
public interface AgentRunner {

	Flux<AgUiSchema.Event> run(AgUiSchema.RunAgentInput input);

}
