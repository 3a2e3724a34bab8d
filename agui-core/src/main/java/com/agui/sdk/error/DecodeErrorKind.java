/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.error;

/**
 * Reasons a wire payload can fail to decode into an event.
 */
public enum DecodeErrorKind {

	/** The {@code type} discriminator names no known event. */
	UNKNOWN_EVENT_TYPE("Unknown event type"),

	/** The {@code type} discriminator is absent or not a string. */
	MISSING_TYPE("Missing event type"),

	/** A required field is absent, null, or of the wrong shape. */
	INVALID_FIELD("Invalid field"),

	/** The payload is not readable JSON at all. */
	MALFORMED_JSON("Malformed JSON");

	private final String description;

	DecodeErrorKind(String description) {
		this.description = description;
	}

	public String getDescription() {
		return this.description;
	}

}
