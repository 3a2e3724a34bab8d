/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.verify;

import java.util.Optional;

/**
 * Outcome of verifying a complete event sequence.
 */
public record VerificationResult(VerificationError error) {

	private static final VerificationResult VALID = new VerificationResult(null);

	public static VerificationResult valid() {
		return VALID;
	}

	public static VerificationResult invalid(VerificationError error) {
		return new VerificationResult(error);
	}

	public boolean isValid() {
		return this.error == null;
	}

	public Optional<VerificationError> getError() {
		return Optional.ofNullable(this.error);
	}

	/**
	 * Throws the violation as an exception, if there was one.
	 */
	public void throwIfInvalid() {
		if (this.error != null) {
			throw this.error.toException();
		}
	}

}
