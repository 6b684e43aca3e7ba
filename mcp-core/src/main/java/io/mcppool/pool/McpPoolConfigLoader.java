/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.pool;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.mcppool.json.McpJsonMapper;
import io.mcppool.json.TypeRef;
import io.mcppool.util.Assert;
import io.mcppool.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the pool configuration document.
 *
 * <pre>{@code
 * {
 *   "servers": {
 *     "filesystem": {
 *       "command": "npx",
 *       "args": ["-y", "@modelcontextprotocol/server-filesystem", "/tmp"],
 *       "env": {"DEBUG": "1"},
 *       "disabled": false
 *     }
 *   }
 * }
 * }</pre>
 *
 * The {@code mcpServers} key of common MCP client configuration files is accepted in
 * place of {@code servers}. Entries without a command are skipped with a warning and
 * unknown keys are ignored.
 */
public class McpPoolConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(McpPoolConfigLoader.class);

	private static final TypeRef<LinkedHashMap<String, Object>> DOCUMENT_TYPE = new TypeRef<>() {
	};

	private final McpJsonMapper jsonMapper;

	public McpPoolConfigLoader(McpJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "JsonMapper must not be null");
		this.jsonMapper = jsonMapper;
	}

	/**
	 * Loads the configuration from a file.
	 * @param path the configuration file
	 * @return the configuration
	 * @throws McpConfigException if the file cannot be read or is malformed
	 */
	public McpPoolConfig load(Path path) {
		Assert.notNull(path, "Config path must not be null");
		if (!Files.isRegularFile(path)) {
			throw new McpConfigException("MCP configuration file not found: " + path);
		}
		String content;
		try {
			content = Files.readString(path, StandardCharsets.UTF_8);
		}
		catch (IOException e) {
			throw new McpConfigException("Failed to read MCP configuration " + path, e);
		}
		McpPoolConfig config = parse(content);
		logger.info("Loaded {} MCP server(s) from {}", config.servers().size(), path);
		return config;
	}

	/**
	 * Parses a configuration document.
	 * @param json the document
	 * @return the configuration
	 * @throws McpConfigException if the document is malformed
	 */
	public McpPoolConfig parse(String json) {
		Map<String, Object> document;
		try {
			document = this.jsonMapper.readValue(json, DOCUMENT_TYPE);
		}
		catch (IOException e) {
			throw new McpConfigException("MCP configuration is not valid JSON: " + e.getMessage(), e);
		}
		if (document == null) {
			throw new McpConfigException("MCP configuration must be a JSON object");
		}

		Object servers = document.containsKey("servers") ? document.get("servers") : document.get("mcpServers");
		if (servers == null) {
			return McpPoolConfig.empty();
		}
		if (!(servers instanceof Map<?, ?> serverMap)) {
			throw new McpConfigException("'servers' must be a JSON object");
		}

		List<ServerConfig> entries = new ArrayList<>();
		for (Map.Entry<?, ?> entry : serverMap.entrySet()) {
			String name = String.valueOf(entry.getKey());
			if (!(entry.getValue() instanceof Map<?, ?> server)) {
				throw new McpConfigException("Server '" + name + "' must be a JSON object");
			}
			Object command = server.get("command");
			if (!(command instanceof String commandText) || !Utils.hasText(commandText)) {
				logger.warn("Skipping MCP server '{}': no command configured", name);
				continue;
			}
			entries.add(new ServerConfig(name, commandText, stringList(name, server.get("args")),
					stringMap(name, server.get("env")), Boolean.TRUE.equals(server.get("disabled"))));
		}
		return new McpPoolConfig(entries);
	}

	private static List<String> stringList(String server, Object value) {
		if (value == null) {
			return List.of();
		}
		if (!(value instanceof List<?> list)) {
			throw new McpConfigException("'args' of server '" + server + "' must be a JSON array");
		}
		List<String> args = new ArrayList<>();
		for (Object arg : list) {
			if (arg == null) {
				throw new McpConfigException("'args' of server '" + server + "' must not contain null");
			}
			args.add(String.valueOf(arg));
		}
		return args;
	}

	private static Map<String, String> stringMap(String server, Object value) {
		if (value == null) {
			return Map.of();
		}
		if (!(value instanceof Map<?, ?> map)) {
			throw new McpConfigException("'env' of server '" + server + "' must be a JSON object");
		}
		Map<String, String> env = new LinkedHashMap<>();
		for (Map.Entry<?, ?> entry : map.entrySet()) {
			if (entry.getValue() == null) {
				throw new McpConfigException(
						"'env." + entry.getKey() + "' of server '" + server + "' must not be null");
			}
			env.put(String.valueOf(entry.getKey()), String.valueOf(entry.getValue()));
		}
		return env;
	}

}
