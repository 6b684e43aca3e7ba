/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.pool;

/**
 * The pool configuration document is missing, unreadable or malformed.
 */
public class McpConfigException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public McpConfigException(String message) {
		super(message);
	}

	public McpConfigException(String message, Throwable cause) {
		super(message, cause);
	}

}
