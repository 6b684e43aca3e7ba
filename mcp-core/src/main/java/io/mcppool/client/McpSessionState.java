/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.client;

/**
 * Lifecycle of an {@link McpStdioSession}.
 *
 * <pre>
 * CREATED -&gt; STARTED -&gt; INITIALIZED &lt;-&gt; DISCONNECTED
 * any state -&gt; CLOSED
 * </pre>
 */
public enum McpSessionState {

	/** Constructed, no process yet. */
	CREATED,

	/** Process spawned and reader running, handshake not done. */
	STARTED,

	/** Handshake succeeded, requests may be sent. */
	INITIALIZED,

	/** The process died or a start or handshake failed; only a reconnect leaves it. */
	DISCONNECTED,

	/** Terminal. */
	CLOSED

}
