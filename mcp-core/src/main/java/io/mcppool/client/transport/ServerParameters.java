/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.client.transport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.mcppool.util.Assert;

/**
 * Command, arguments and environment overrides used to spawn a server process.
 */
public final class ServerParameters {

	private final String command;

	private final List<String> args;

	private final Map<String, String> env;

	private ServerParameters(String command, List<String> args, Map<String, String> env) {
		Assert.hasText(command, "The command can not be empty");
		this.command = command;
		this.args = Collections.unmodifiableList(new ArrayList<>(args));
		this.env = Collections.unmodifiableMap(new HashMap<>(env));
	}

	public String getCommand() {
		return this.command;
	}

	public List<String> getArgs() {
		return this.args;
	}

	/**
	 * Returns the overrides merged over the inherited environment.
	 * @return the environment overrides
	 */
	public Map<String, String> getEnv() {
		return this.env;
	}

	@Override
	public String toString() {
		return "ServerParameters[command=" + this.command + ", args=" + this.args + ", env=" + this.env.keySet()
				+ "]";
	}

	public static Builder builder(String command) {
		return new Builder(command);
	}

	public static class Builder {

		private final String command;

		private final List<String> args = new ArrayList<>();

		private final Map<String, String> env = new HashMap<>();

		public Builder(String command) {
			Assert.hasText(command, "The command can not be empty");
			this.command = command;
		}

		public Builder args(String... args) {
			Assert.notNull(args, "The args can not be null");
			return args(Arrays.asList(args));
		}

		public Builder args(List<String> args) {
			Assert.notNull(args, "The args can not be null");
			args.forEach(arg -> Assert.notNull(arg, "The args can not contain null"));
			this.args.addAll(args);
			return this;
		}

		public Builder arg(String arg) {
			Assert.notNull(arg, "The arg can not be null");
			this.args.add(arg);
			return this;
		}

		public Builder env(Map<String, String> env) {
			if (env != null) {
				env.forEach(this::addEnvVar);
			}
			return this;
		}

		public Builder addEnvVar(String key, String value) {
			Assert.hasText(key, "The env key can not be empty");
			Assert.notNull(value, "The env value for " + key + " can not be null");
			this.env.put(key, value);
			return this;
		}

		public ServerParameters build() {
			return new ServerParameters(this.command, this.args, this.env);
		}

	}

}
