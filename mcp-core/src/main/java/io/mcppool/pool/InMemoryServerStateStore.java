/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.pool;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ServerStateStore} kept in memory only.
 */
public class InMemoryServerStateStore implements ServerStateStore {

	private final Map<String, Boolean> states = new ConcurrentHashMap<>();

	private final boolean defaultEnabled;

	public InMemoryServerStateStore() {
		this(true);
	}

	public InMemoryServerStateStore(boolean defaultEnabled) {
		this.defaultEnabled = defaultEnabled;
	}

	@Override
	public boolean isEnabled(String serverName) {
		return this.states.getOrDefault(serverName, this.defaultEnabled);
	}

	@Override
	public void setEnabled(String serverName, boolean enabled) {
		this.states.put(serverName, enabled);
	}

	@Override
	public Map<String, Boolean> snapshot() {
		return Map.copyOf(this.states);
	}

}
