/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.client;

import io.mcppool.util.Assert;

/**
 * Why a session or pool operation failed.
 *
 * @param kind the failure category
 * @param message a human-readable description
 * @param errorCode the JSON-RPC error code, present for {@link Kind#PROTOCOL_ERROR} only
 * @param cause the underlying exception, if any
 */
public record McpFailure(Kind kind, String message, Integer errorCode, Throwable cause) {

	public McpFailure {
		Assert.notNull(kind, "Failure kind must not be null");
		Assert.notNull(message, "Failure message must not be null");
	}

	public enum Kind {

		/** The process could not be created. */
		SPAWN_ERROR,

		/** Writing to the process input failed. */
		BROKEN_PIPE,

		/** The server answered with a JSON-RPC error. */
		PROTOCOL_ERROR,

		/** No response arrived within the operation's window. */
		TIMEOUT,

		/** The process had exited before or during the request. */
		PROCESS_DIED,

		/** The session has not completed the handshake. */
		NOT_INITIALIZED,

		/** The session was closed. */
		SESSION_CLOSED,

		/** No server with the given name is configured or running. */
		UNKNOWN_SERVER,

		/** The response could not be mapped to the expected result. */
		INVALID_RESPONSE,

		/** The caller's arguments are invalid or cannot be encoded. */
		INVALID_REQUEST

	}

	public static McpFailure of(Kind kind, String message) {
		return new McpFailure(kind, message, null, null);
	}

	public static McpFailure of(Kind kind, String message, Throwable cause) {
		return new McpFailure(kind, message, null, cause);
	}

	/**
	 * Returns a copy of this failure with the message prefixed, keeping kind, code and
	 * cause.
	 * @param prefix the text to put in front of the message
	 * @return the prefixed failure
	 */
	public McpFailure withPrefix(String prefix) {
		return new McpFailure(this.kind, prefix + ": " + this.message, this.errorCode, this.cause);
	}

}
