/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.error;

import com.agui.sdk.spec.AgUiSchema;

/**
 * Raised when an event stream violates the AG-UI protocol rules.
 *
 * <p>
 * The offending event is {@code null} for violations detected at end of stream, such as
 * a run that never finished.
 */
public class AgUiVerificationException extends AgUiException {

	private final VerifyErrorKind kind;

	private final String subject;

	private final AgUiSchema.Event event;

	public AgUiVerificationException(VerifyErrorKind kind, String subject, AgUiSchema.Event event) {
		super(formatMessage(kind, subject, event));
		this.kind = kind;
		this.subject = subject;
		this.event = event;
	}

	private static String formatMessage(VerifyErrorKind kind, String subject, AgUiSchema.Event event) {
		StringBuilder sb = new StringBuilder(kind.getDescription());
		if (subject != null) {
			sb.append(": ").append(subject);
		}
		if (event != null) {
			sb.append(" (at ").append(event.eventType().wireName()).append(')');
		}
		return sb.toString();
	}

	public VerifyErrorKind getKind() {
		return this.kind;
	}

	/**
	 * Returns the message id, tool call id or step name the violation concerns, or
	 * {@code null} for run-level violations.
	 */
	public String getSubject() {
		return this.subject;
	}

	public AgUiSchema.Event getEvent() {
		return this.event;
	}

}
