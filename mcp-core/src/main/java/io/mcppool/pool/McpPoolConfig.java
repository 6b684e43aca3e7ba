/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.pool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The servers known to a pool, in configuration order. Immutable.
 */
public final class McpPoolConfig {

	private static final McpPoolConfig EMPTY = new McpPoolConfig(List.of());

	private final Map<String, ServerConfig> servers;

	public McpPoolConfig(List<ServerConfig> servers) {
		Map<String, ServerConfig> byName = new LinkedHashMap<>();
		for (ServerConfig server : servers) {
			if (byName.putIfAbsent(server.name(), server) != null) {
				throw new IllegalArgumentException("Duplicate server name: " + server.name());
			}
		}
		this.servers = Collections.unmodifiableMap(byName);
	}

	public static McpPoolConfig empty() {
		return EMPTY;
	}

	public Map<String, ServerConfig> servers() {
		return this.servers;
	}

	public Optional<ServerConfig> server(String name) {
		return Optional.ofNullable(this.servers.get(name));
	}

	public List<String> serverNames() {
		return new ArrayList<>(this.servers.keySet());
	}

	@Override
	public String toString() {
		return "McpPoolConfig" + this.servers.keySet();
	}

}
