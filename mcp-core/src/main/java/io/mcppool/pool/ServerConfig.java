/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.pool;

import java.util.List;
import java.util.Map;

import io.mcppool.client.transport.ServerParameters;
import io.mcppool.util.Assert;

/**
 * One entry of the pool configuration.
 *
 * @param name the unique server name
 * @param command the program to run
 * @param args the program arguments
 * @param env environment overrides
 * @param disabled whether the entry is switched off in the configuration
 */
public record ServerConfig(String name, String command, List<String> args, Map<String, String> env,
		boolean disabled) {

	public ServerConfig {
		Assert.hasText(name, "Server name must not be empty");
		Assert.hasText(command, "Command of server '" + name + "' must not be empty");
		args = args != null ? List.copyOf(args) : List.of();
		env = env != null ? Map.copyOf(env) : Map.of();
	}

	public ServerConfig(String name, String command, List<String> args) {
		this(name, command, args, Map.of(), false);
	}

	public ServerParameters toServerParameters() {
		return ServerParameters.builder(this.command).args(this.args).env(this.env).build();
	}

}
