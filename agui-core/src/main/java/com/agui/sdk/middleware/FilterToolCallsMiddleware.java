/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.middleware;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import com.agui.sdk.spec.AgUiSchema;
import com.agui.sdk.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;

/**
 * Removes tool calls from the event stream by tool name.
 *
 * <p>
 * Either an allow-list or a deny-list is configured. A blocked tool call loses its
 * START, ARGS and END events, any chunk carrying its id and its result. All other events
 * pass through.
 */
public final class FilterToolCallsMiddleware implements AgUiMiddleware {

	private static final Logger logger = LoggerFactory.getLogger(FilterToolCallsMiddleware.class);

	private final Set<String> allowedToolCalls;

	private final Set<String> disallowedToolCalls;

	private FilterToolCallsMiddleware(Builder builder) {
		this.allowedToolCalls = builder.allowedToolCalls == null ? null : Set.copyOf(builder.allowedToolCalls);
		this.disallowedToolCalls = builder.disallowedToolCalls == null ? null
				: Set.copyOf(builder.disallowedToolCalls);
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public Flux<AgUiSchema.Event> call(AgUiSchema.RunAgentInput input, AgentRunner next) {
		return Flux.defer(() -> {
			Set<String> blockedIds = new HashSet<>();
			return next.run(input).filter(event -> passes(event, blockedIds));
		});
	}

	private boolean passes(AgUiSchema.Event event, Set<String> blockedIds) {
		return switch (event.eventType()) {
			case TOOL_CALL_START -> {
				AgUiSchema.ToolCallStart start = (AgUiSchema.ToolCallStart) event;
				yield admit(start.toolCallId(), start.toolCallName(), blockedIds);
			}
			case TOOL_CALL_CHUNK -> {
				AgUiSchema.ToolCallChunk chunk = (AgUiSchema.ToolCallChunk) event;
				if (chunk.toolCallName() != null) {
					yield admit(chunk.toolCallId(), chunk.toolCallName(), blockedIds);
				}
				yield !blockedIds.contains(chunk.toolCallId());
			}
			case TOOL_CALL_ARGS -> !blockedIds.contains(((AgUiSchema.ToolCallArgs) event).toolCallId());
			case TOOL_CALL_END -> !blockedIds.contains(((AgUiSchema.ToolCallEnd) event).toolCallId());
			case TOOL_CALL_RESULT -> !blockedIds.remove(((AgUiSchema.ToolCallResult) event).toolCallId());
			default -> true;
		};
	}

	private boolean admit(String toolCallId, String toolCallName, Set<String> blockedIds) {
		if (isAllowed(toolCallName)) {
			return true;
		}
		logger.debug("Filtering out tool call {} ({})", toolCallId, toolCallName);
		blockedIds.add(toolCallId);
		return false;
	}

	private boolean isAllowed(String toolCallName) {
		if (this.allowedToolCalls != null) {
			return this.allowedToolCalls.contains(toolCallName);
		}
		return !this.disallowedToolCalls.contains(toolCallName);
	}

	public static final class Builder {

		private Set<String> allowedToolCalls;

		private Set<String> disallowedToolCalls;

		private Builder() {
		}

		/**
		 * Only let tool calls with these names through.
		 */
		public Builder allowedToolCalls(String... names) {
			Assert.notNull(names, "Tool names must not be null");
			this.allowedToolCalls = new LinkedHashSet<>(Arrays.asList(names));
			return this;
		}

		/**
		 * Drop tool calls with these names.
		 */
		public Builder disallowedToolCalls(String... names) {
			Assert.notNull(names, "Tool names must not be null");
			this.disallowedToolCalls = new LinkedHashSet<>(Arrays.asList(names));
			return this;
		}

		public FilterToolCallsMiddleware build() {
			if ((this.allowedToolCalls == null) == (this.disallowedToolCalls == null)) {
				throw new IllegalArgumentException(
						"Exactly one of allowed or disallowed tool calls must be configured");
			}
			return new FilterToolCallsMiddleware(this);
		}

	}

}
