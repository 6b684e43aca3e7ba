/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.client;

import java.time.Duration;
import java.util.function.Supplier;

import io.mcppool.spec.McpSchema;
import io.mcppool.spec.RequestIdGenerator;
import io.mcppool.util.Assert;

/**
 * Timeouts and identity used by {@link McpStdioSession}.
 */
public final class McpSessionOptions {

	public static final Duration DEFAULT_INITIALIZE_TIMEOUT = Duration.ofSeconds(30);

	public static final Duration DEFAULT_LIST_TOOLS_TIMEOUT = Duration.ofSeconds(10);

	public static final Duration DEFAULT_CALL_TOOL_TIMEOUT = Duration.ofSeconds(180);

	public static final Duration DEFAULT_TERMINATION_GRACE_PERIOD = Duration.ofSeconds(3);

	public static final McpSchema.Implementation DEFAULT_CLIENT_INFO = new McpSchema.Implementation(
			"mcp-stdio-pool", "1.0.0");

	private static final int DEFAULT_MAX_TOOL_PAGES = 100;

	private final Duration initializeTimeout;

	private final Duration listToolsTimeout;

	private final Duration callToolTimeout;

	private final Duration terminationGracePeriod;

	private final McpSchema.Implementation clientInfo;

	private final String protocolVersion;

	private final int maxToolPages;

	private final Supplier<RequestIdGenerator> requestIdGeneratorFactory;

	private McpSessionOptions(Builder builder) {
		this.initializeTimeout = builder.initializeTimeout;
		this.listToolsTimeout = builder.listToolsTimeout;
		this.callToolTimeout = builder.callToolTimeout;
		this.terminationGracePeriod = builder.terminationGracePeriod;
		this.clientInfo = builder.clientInfo;
		this.protocolVersion = builder.protocolVersion;
		this.maxToolPages = builder.maxToolPages;
		this.requestIdGeneratorFactory = builder.requestIdGeneratorFactory;
	}

	public static McpSessionOptions defaults() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public Duration initializeTimeout() {
		return this.initializeTimeout;
	}

	public Duration listToolsTimeout() {
		return this.listToolsTimeout;
	}

	public Duration callToolTimeout() {
		return this.callToolTimeout;
	}

	public Duration terminationGracePeriod() {
		return this.terminationGracePeriod;
	}

	public McpSchema.Implementation clientInfo() {
		return this.clientInfo;
	}

	public String protocolVersion() {
		return this.protocolVersion;
	}

	/**
	 * Upper bound on {@code tools/list} pages followed through {@code nextCursor}.
	 * @return the page limit
	 */
	public int maxToolPages() {
		return this.maxToolPages;
	}

	/**
	 * Creates the id generator of a new session. A session keeps its generator across
	 * reconnects.
	 * @return a fresh request id generator
	 */
	public RequestIdGenerator newRequestIdGenerator() {
		return this.requestIdGeneratorFactory.get();
	}

	public Builder mutate() {
		return new Builder().initializeTimeout(this.initializeTimeout)
			.listToolsTimeout(this.listToolsTimeout)
			.callToolTimeout(this.callToolTimeout)
			.terminationGracePeriod(this.terminationGracePeriod)
			.clientInfo(this.clientInfo)
			.protocolVersion(this.protocolVersion)
			.maxToolPages(this.maxToolPages)
			.requestIdGenerator(this.requestIdGeneratorFactory);
	}

	public static class Builder {

		private Duration initializeTimeout = DEFAULT_INITIALIZE_TIMEOUT;

		private Duration listToolsTimeout = DEFAULT_LIST_TOOLS_TIMEOUT;

		private Duration callToolTimeout = DEFAULT_CALL_TOOL_TIMEOUT;

		private Duration terminationGracePeriod = DEFAULT_TERMINATION_GRACE_PERIOD;

		private McpSchema.Implementation clientInfo = DEFAULT_CLIENT_INFO;

		private String protocolVersion = McpSchema.PROTOCOL_VERSION;

		private int maxToolPages = DEFAULT_MAX_TOOL_PAGES;

		private Supplier<RequestIdGenerator> requestIdGeneratorFactory = RequestIdGenerator::ofDefault;

		private Builder() {
		}

		public Builder initializeTimeout(Duration initializeTimeout) {
			this.initializeTimeout = positive(initializeTimeout, "Initialize timeout");
			return this;
		}

		public Builder listToolsTimeout(Duration listToolsTimeout) {
			this.listToolsTimeout = positive(listToolsTimeout, "List tools timeout");
			return this;
		}

		public Builder callToolTimeout(Duration callToolTimeout) {
			this.callToolTimeout = positive(callToolTimeout, "Call tool timeout");
			return this;
		}

		public Builder terminationGracePeriod(Duration terminationGracePeriod) {
			Assert.notNull(terminationGracePeriod, "Termination grace period must not be null");
			Assert.isTrue(!terminationGracePeriod.isNegative(), "Termination grace period must not be negative");
			this.terminationGracePeriod = terminationGracePeriod;
			return this;
		}

		public Builder clientInfo(McpSchema.Implementation clientInfo) {
			Assert.notNull(clientInfo, "Client info must not be null");
			this.clientInfo = clientInfo;
			return this;
		}

		public Builder protocolVersion(String protocolVersion) {
			Assert.hasText(protocolVersion, "Protocol version must not be empty");
			this.protocolVersion = protocolVersion;
			return this;
		}

		public Builder maxToolPages(int maxToolPages) {
			Assert.isTrue(maxToolPages > 0, "Max tool pages must be positive");
			this.maxToolPages = maxToolPages;
			return this;
		}

		public Builder requestIdGenerator(Supplier<RequestIdGenerator> requestIdGeneratorFactory) {
			Assert.notNull(requestIdGeneratorFactory, "Request id generator factory must not be null");
			this.requestIdGeneratorFactory = requestIdGeneratorFactory;
			return this;
		}

		public McpSessionOptions build() {
			return new McpSessionOptions(this);
		}

		private static Duration positive(Duration duration, String what) {
			Assert.notNull(duration, what + " must not be null");
			Assert.isTrue(!duration.isNegative() && !duration.isZero(), what + " must be positive");
			return duration;
		}

	}

}
