/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.verify;

import com.agui.sdk.error.AgUiVerificationException;
import com.agui.sdk.error.VerifyErrorKind;
import com.agui.sdk.spec.AgUiSchema;

/**
 * A protocol violation with its context.
 *
 * @param kind the violated rule
 * @param subject the message id, tool call id or step name concerned, if any
 * @param event the offending event, or {@code null} for end-of-stream violations
 * @param state the verifier state the event was checked against
 */
public record VerificationError(VerifyErrorKind kind, String subject, AgUiSchema.Event event, VerifierState state) {

	public AgUiVerificationException toException() {
		return new AgUiVerificationException(this.kind, this.subject, this.event);
	}

}
