/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.error;

/**
 * Raised when a wire payload cannot be decoded into a typed event.
 *
 * <p>
 * Besides the {@link DecodeErrorKind}, the exception records the wire {@code type} that
 * was being decoded (when it was readable) and the offending field (when one can be
 * named), so adapters can report precise errors back to the producer.
 */
public class AgUiDecodeException extends AgUiException {

	private final DecodeErrorKind kind;

	private final String eventType;

	private final String field;

	public AgUiDecodeException(DecodeErrorKind kind, String message) {
		this(kind, null, null, message, null);
	}

	public AgUiDecodeException(DecodeErrorKind kind, String eventType, String field, String message) {
		this(kind, eventType, field, message, null);
	}

	public AgUiDecodeException(DecodeErrorKind kind, String eventType, String field, String message,
			Throwable cause) {
		super(formatMessage(kind, eventType, field, message), cause);
		this.kind = kind;
		this.eventType = eventType;
		this.field = field;
	}

	private static String formatMessage(DecodeErrorKind kind, String eventType, String field, String message) {
		StringBuilder sb = new StringBuilder(kind.getDescription());
		if (eventType != null) {
			sb.append(" [type=").append(eventType);
			if (field != null) {
				sb.append(", field=").append(field);
			}
			sb.append(']');
		}
		if (message != null) {
			sb.append(": ").append(message);
		}
		return sb.toString();
	}

	public DecodeErrorKind getKind() {
		return this.kind;
	}

	/**
	 * Returns the wire type being decoded, or {@code null} if it could not be read.
	 */
	public String getEventType() {
		return this.eventType;
	}

	/**
	 * Returns the name of the offending field, or {@code null} if not attributable to one.
	 */
	public String getField() {
		return this.field;
	}

	public boolean isUnknownEventType() {
		return this.kind == DecodeErrorKind.UNKNOWN_EVENT_TYPE;
	}

	public boolean isMissingType() {
		return this.kind == DecodeErrorKind.MISSING_TYPE;
	}

	public boolean isInvalidField() {
		return this.kind == DecodeErrorKind.INVALID_FIELD;
	}

}
