/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.canonical;

import java.util.List;

import com.agui.sdk.spec.AgUiSchema;

/**
 * Result of canonicalizing one input event: the updated pending streams and the
 * canonical events to emit, in order.
 */
public record Expansion(PendingStreams pending, List<AgUiSchema.Event> events) {

	public Expansion {
		events = List.copyOf(events);
	}

}
