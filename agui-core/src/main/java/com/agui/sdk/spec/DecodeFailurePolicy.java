/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.spec;

/**
 * What a decoding stream does with a frame that cannot be decoded.
 */
public enum DecodeFailurePolicy {

	/** Terminate the stream with the decode error. */
	ABORT,

	/** Log the error at WARN and continue with the next frame. */
	SKIP

}
