/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.util;

/**
 * Argument assertions used by builders and public entry points. Failures are reported as
 * {@link IllegalArgumentException} carrying the supplied message.
 */
public final class Assert {

	private Assert() {
	}

	/**
	 * Assert that an object is not {@code null}.
	 * @param object the object to check
	 * @param message the exception message to use if the assertion fails
	 * @throws IllegalArgumentException if the object is {@code null}
	 */
	public static void notNull(Object object, String message) {
		if (object == null) {
			throw new IllegalArgumentException(message);
		}
	}

}
