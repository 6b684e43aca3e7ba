/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.spec;

/**
 * Signals that a message could not be exchanged with a server process: the process could
 * not be spawned, or its input stream is closed.
 */
public class McpTransportException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public McpTransportException(String message) {
		super(message);
	}

	public McpTransportException(String message, Throwable cause) {
		super(message, cause);
	}

	public McpTransportException(Throwable cause) {
		super(cause);
	}

}
