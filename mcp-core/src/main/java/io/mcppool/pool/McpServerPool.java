/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.pool;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import io.mcppool.client.McpResult;
import io.mcppool.spec.McpSchema.CallToolResult;
import io.mcppool.spec.McpSchema.Tool;

/**
 * A named registry of MCP servers: the only entry points the rest of an application
 * uses to reach them.
 */
public interface McpServerPool extends AutoCloseable {

	/**
	 * Loads the configuration file and starts every server that is neither disabled in
	 * the configuration nor switched off in the state store.
	 * @param configPath the configuration file
	 * @return {@code true} if the configuration loaded and every eligible server started
	 */
	boolean startAll(Path configPath);

	/**
	 * Uses the given configuration and starts every eligible server.
	 * @param config the configuration
	 * @return {@code true} if every eligible server started
	 */
	boolean startAll(McpPoolConfig config);

	/**
	 * Lists the tools of every running server. Servers that fail to answer or provide no
	 * tools are left out.
	 * @return server name to tools, in configuration order
	 */
	Map<String, List<Tool>> getAllTools();

	/**
	 * Calls a tool on the named server. A server found dead is reconnected once and the
	 * call retried once.
	 * @param serverName the server name
	 * @param toolName the tool name
	 * @param arguments the tool arguments, may be {@code null}
	 * @return the tool result, or a failure whose message starts with
	 * {@code "Tool execution failed"}
	 */
	McpResult<CallToolResult> callTool(String serverName, String toolName, Map<String, Object> arguments);

	/**
	 * Stops every running server without touching the state store.
	 */
	void stopAll();

	/**
	 * Starts the named server and records it as enabled. Starting a running server
	 * succeeds without restarting it.
	 * @param serverName the server name
	 * @return whether the server is running
	 */
	boolean startServer(String serverName);

	/**
	 * Stops the named server and records it as disabled. Stopping a server that is not
	 * running succeeds.
	 * @param serverName the server name
	 * @return {@code true}
	 */
	boolean stopServer(String serverName);

	/**
	 * Stops then starts the named server.
	 * @param serverName the server name
	 * @return whether the server is running afterwards
	 */
	boolean restartServer(String serverName);

	/**
	 * Reports every configured server, querying the tools of the running ones.
	 * @return server name to status, in configuration order
	 */
	Map<String, ServerStatus> status();

	/**
	 * Same as {@link #stopAll()}.
	 */
	@Override
	default void close() {
		stopAll();
	}

}
