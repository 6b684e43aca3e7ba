/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.pool;

import java.util.Map;

/**
 * Persists whether the user switched a server on or off, independent of the
 * {@code disabled} flag of its configuration entry.
 */
public interface ServerStateStore {

	/**
	 * Whether the named server should be started.
	 * @param serverName the server name
	 * @return the recorded state, or the store's default for unknown names
	 */
	boolean isEnabled(String serverName);

	/**
	 * Records the state of the named server.
	 * @param serverName the server name
	 * @param enabled whether the server should be started
	 */
	void setEnabled(String serverName, boolean enabled);

	/**
	 * Returns every recorded state.
	 * @return server name to enabled flag
	 */
	Map<String, Boolean> snapshot();

}
