/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.pool;

import io.mcppool.client.McpSessionOptions;
import io.mcppool.client.McpStdioSession;
import io.mcppool.json.McpJsonMapper;

/**
 * Creates the session of a configured server. The pool starts and initializes it.
 */
@FunctionalInterface
public interface McpSessionFactory {

	McpStdioSession create(ServerConfig config, McpSessionOptions options);

	/**
	 * Factory creating stdio sessions for the configured command.
	 * @param jsonMapper the mapper the sessions use
	 * @return the default factory
	 */
	static McpSessionFactory stdio(McpJsonMapper jsonMapper) {
		return (config, options) -> McpStdioSession.builder(config.name(), config.toServerParameters())
			.options(options)
			.jsonMapper(jsonMapper)
			.build();
	}

}
