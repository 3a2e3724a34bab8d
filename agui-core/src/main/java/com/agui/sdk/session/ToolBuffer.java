/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agui.sdk.session;

/**
 * A tool call whose arguments are being streamed.
 */
public record ToolBuffer(String name, String args, String parentMessageId) {

	public static ToolBuffer open(String name, String parentMessageId) {
		return new ToolBuffer(name, "", parentMessageId);
	}

	public ToolBuffer append(String delta) {
		return new ToolBuffer(this.name, this.args + delta, this.parentMessageId);
	}

}
