/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.error;

/**
 * Base class for all exceptions raised by the AG-UI SDK.
 *
 * <p>
 * Unchecked, so that reactive pipelines can signal it through {@code onError} without
 * wrapping. Catch this type to handle every SDK failure uniformly, or one of the
 * subclasses for a specific stage:
 * <ul>
 * <li>{@link AgUiDecodeException} - a wire payload could not be turned into an event</li>
 * <li>{@link AgUiVerificationException} - an event stream broke the protocol rules</li>
 * <li>{@link AgUiPatchException} - a strict JSON Patch could not be applied</li>
 * </ul>
 */
public class AgUiException extends RuntimeException {

	public AgUiException(String message) {
		super(message);
	}

	public AgUiException(String message, Throwable cause) {
		super(message, cause);
	}

}
