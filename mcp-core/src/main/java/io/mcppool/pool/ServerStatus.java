/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.pool;

import java.util.List;
import java.util.Map;

import io.mcppool.spec.McpSchema.Tool;

/**
 * Snapshot of one configured server, as reported by {@link McpServerPool#status()}.
 *
 * @param name the server name
 * @param command the configured command
 * @param args the configured arguments
 * @param env the configured environment overrides
 * @param runState whether the server process is running
 * @param tools the tools observed when the snapshot was taken
 * @param availability how the server answered the tool query
 * @param note a human-readable summary
 */
public record ServerStatus(String name, String command, List<String> args, Map<String, String> env,
		RunState runState, List<Tool> tools, Availability availability, String note) {

	public ServerStatus {
		tools = tools != null ? List.copyOf(tools) : List.of();
	}

	public boolean isRunning() {
		return this.runState == RunState.RUNNING;
	}

	public enum RunState {

		RUNNING, STOPPED

	}

	public enum Availability {

		/** Running and provides tools normally. */
		TOOLS_PROVIDED,

		/** Running but provides no tools. */
		NO_TOOLS,

		/** Querying the tools failed, or the server failed to start. */
		ERROR,

		/** Not running. */
		NOT_RUNNING

	}

}
