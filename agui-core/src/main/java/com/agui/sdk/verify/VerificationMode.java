/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.verify;

/**
 * How a verifying stream reacts to a protocol violation.
 */
public enum VerificationMode {

	/** Terminate the stream with an {@code AgUiVerificationException}. */
	STRICT,

	/** Log the violation at WARN and keep forwarding events. */
	LENIENT,

	/** Do not verify. */
	DISABLED

}
