/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.error;

import com.agui.sdk.spec.AgUiSchema;

/**
 * Raised by strict JSON Patch application when an operation cannot be applied.
 */
public class AgUiPatchException extends AgUiException {

	private final AgUiSchema.JsonPatchOperation operation;

	public AgUiPatchException(String message, AgUiSchema.JsonPatchOperation operation) {
		super(message + ": " + operation);
		this.operation = operation;
	}

	public AgUiSchema.JsonPatchOperation getOperation() {
		return this.operation;
	}

}
