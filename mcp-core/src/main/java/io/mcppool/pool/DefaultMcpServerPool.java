/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.pool;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import io.mcppool.client.McpFailure;
import io.mcppool.client.McpFailure.Kind;
import io.mcppool.client.McpResult;
import io.mcppool.client.McpSessionOptions;
import io.mcppool.client.McpSessionState;
import io.mcppool.client.McpStdioSession;
import io.mcppool.json.McpJsonDefaults;
import io.mcppool.json.McpJsonMapper;
import io.mcppool.pool.ServerStatus.Availability;
import io.mcppool.pool.ServerStatus.RunState;
import io.mcppool.spec.McpSchema.CallToolResult;
import io.mcppool.spec.McpSchema.InitializeResult;
import io.mcppool.spec.McpSchema.Tool;
import io.mcppool.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

/**
 * Default {@link McpServerPool}.
 *
 * <p>
 * The registry maps server names to initialized sessions. Only sessions that completed
 * the handshake are registered, so calls and listings never see a half-started server.
 * Start, stop, restart and reconnect of one server are serialized by a lock per server
 * name; calls to different servers, and concurrent calls to the same server, proceed in
 * parallel. Starting all servers and querying all tools fan out on Reactor's
 * bounded-elastic workers.
 */
public class DefaultMcpServerPool implements McpServerPool {

	private static final Logger logger = LoggerFactory.getLogger(DefaultMcpServerPool.class);

	static final String TOOL_EXECUTION_FAILED = "Tool execution failed";

	private final ServerStateStore stateStore;

	private final McpSessionFactory sessionFactory;

	private final McpSessionOptions sessionOptions;

	private final McpPoolConfigLoader configLoader;

	private final ConcurrentHashMap<String, McpStdioSession> sessions = new ConcurrentHashMap<>();

	private final ConcurrentHashMap<String, ReentrantLock> serverLocks = new ConcurrentHashMap<>();

	private final ConcurrentHashMap<String, String> startFailures = new ConcurrentHashMap<>();

	private volatile McpPoolConfig config = McpPoolConfig.empty();

	private DefaultMcpServerPool(Builder builder) {
		McpJsonMapper jsonMapper = builder.jsonMapper != null ? builder.jsonMapper : McpJsonDefaults.getMapper();
		this.stateStore = builder.stateStore;
		this.sessionOptions = builder.sessionOptions;
		this.sessionFactory = builder.sessionFactory != null ? builder.sessionFactory
				: McpSessionFactory.stdio(jsonMapper);
		this.configLoader = new McpPoolConfigLoader(jsonMapper);
	}

	public static Builder builder() {
		return new Builder();
	}

	// --------------------------
	// Startup and shutdown
	// --------------------------

	@Override
	public boolean startAll(Path configPath) {
		McpPoolConfig loaded;
		try {
			loaded = this.configLoader.load(configPath);
		}
		catch (McpConfigException e) {
			logger.error("Failed to load MCP configuration: {}", e.getMessage(), e);
			return false;
		}
		return startAll(loaded);
	}

	@Override
	public boolean startAll(McpPoolConfig newConfig) {
		Assert.notNull(newConfig, "Config must not be null");
		this.config = newConfig;
		for (String name : List.copyOf(this.sessions.keySet())) {
			if (!newConfig.servers().containsKey(name)) {
				logger.info("MCP server '{}' is no longer configured, stopping it", name);
				withServerLock(name, () -> stopSession(name));
			}
		}
		this.startFailures.keySet().retainAll(newConfig.servers().keySet());
		List<ServerConfig> eligible = newConfig.servers()
			.values()
			.stream()
			.filter(server -> !server.disabled())
			.filter(server -> this.stateStore.isEnabled(server.name()))
			.toList();
		newConfig.servers()
			.values()
			.stream()
			.filter(server -> !eligible.contains(server))
			.forEach(server -> logger.info("MCP server '{}' is disabled, not starting it", server.name()));

		List<Boolean> results = Flux.fromIterable(eligible)
			.flatMap(server -> Mono.fromCallable(() -> withServerLock(server.name(), () -> startSession(server)))
				.subscribeOn(Schedulers.boundedElastic()))
			.collectList()
			.block();
		return results != null && results.stream().allMatch(Boolean::booleanValue);
	}

	@Override
	public void stopAll() {
		for (String name : List.copyOf(this.sessions.keySet())) {
			withServerLock(name, () -> stopSession(name));
		}
	}

	// --------------------------
	// Tools
	// --------------------------

	@Override
	public Map<String, List<Tool>> getAllTools() {
		Map<String, McpResult<List<Tool>>> queried = queryTools();
		Map<String, List<Tool>> allTools = new LinkedHashMap<>();
		queried.forEach((name, result) -> {
			if (result.isFailure()) {
				logger.warn("Failed to list tools of MCP server '{}': {}", name, result.failure().message());
			}
			else if (result.value().isEmpty()) {
				logger.debug("MCP server '{}' provides no tools", name);
			}
			else {
				allTools.put(name, result.value());
			}
		});
		return allTools;
	}

	@Override
	public McpResult<CallToolResult> callTool(String serverName, String toolName, Map<String, Object> arguments) {
		McpStdioSession session = serverName != null ? this.sessions.get(serverName) : null;
		if (session == null) {
			logger.warn("MCP server '{}' is not running", serverName);
			McpFailure failure = McpFailure.of(Kind.UNKNOWN_SERVER, "MCP server '" + serverName + "' is not running");
			return McpResult.failure(failure.withPrefix(TOOL_EXECUTION_FAILED));
		}

		boolean reconnected = false;
		if (!session.isAlive() || session.state() != McpSessionState.INITIALIZED) {
			reconnected = true;
			McpResult<InitializeResult> reconnect = reconnect(serverName, session);
			if (reconnect.isFailure()) {
				return McpResult.failure(reconnect.failure().withPrefix(TOOL_EXECUTION_FAILED));
			}
		}

		McpResult<CallToolResult> result = session.callTool(toolName, arguments);
		if (result.isFailure() && result.failure().kind() == Kind.PROCESS_DIED && !reconnected) {
			logger.warn("MCP server '{}' died during call of '{}', reconnecting once", serverName, toolName);
			McpResult<InitializeResult> reconnect = reconnect(serverName, session);
			if (reconnect.isFailure()) {
				return McpResult.failure(reconnect.failure().withPrefix(TOOL_EXECUTION_FAILED));
			}
			result = session.callTool(toolName, arguments);
		}
		if (result.isFailure()) {
			logger.warn("Tool '{}' on MCP server '{}' failed: {}", toolName, serverName, result.failure().message(),
					result.failure().cause());
			return McpResult.failure(result.failure().withPrefix(TOOL_EXECUTION_FAILED));
		}
		return result;
	}

	// --------------------------
	// Per-server lifecycle
	// --------------------------

	@Override
	public boolean startServer(String serverName) {
		ServerConfig server = this.config.servers().get(serverName);
		if (server == null) {
			logger.warn("Unknown MCP server '{}'", serverName);
			return false;
		}
		if (server.disabled()) {
			logger.warn("MCP server '{}' is disabled in the configuration", serverName);
			return false;
		}
		boolean started = withServerLock(serverName, () -> startSession(server));
		if (started) {
			this.stateStore.setEnabled(serverName, true);
		}
		return started;
	}

	@Override
	public boolean stopServer(String serverName) {
		withServerLock(serverName, () -> stopSession(serverName));
		if (this.config.servers().containsKey(serverName)) {
			this.stateStore.setEnabled(serverName, false);
		}
		return true;
	}

	@Override
	public boolean restartServer(String serverName) {
		ServerConfig server = this.config.servers().get(serverName);
		if (server == null) {
			logger.warn("Unknown MCP server '{}'", serverName);
			return false;
		}
		if (server.disabled()) {
			logger.warn("MCP server '{}' is disabled in the configuration", serverName);
			return false;
		}
		return withServerLock(serverName, () -> {
			stopSession(serverName);
			return startSession(server);
		});
	}

	// --------------------------
	// Status
	// --------------------------

	@Override
	public Map<String, ServerStatus> status() {
		Map<String, McpResult<List<Tool>>> queried = queryTools();
		Map<String, ServerStatus> status = new LinkedHashMap<>();
		for (ServerConfig server : this.config.servers().values()) {
			McpResult<List<Tool>> tools = queried.get(server.name());
			status.put(server.name(), tools != null ? runningStatus(server, tools) : stoppedStatus(server));
		}
		return status;
	}

	private ServerStatus runningStatus(ServerConfig server, McpResult<List<Tool>> tools) {
		if (tools.isFailure()) {
			return new ServerStatus(server.name(), server.command(), server.args(), server.env(), RunState.RUNNING,
					List.of(), Availability.ERROR, "Error querying tools: " + tools.failure().message());
		}
		if (tools.value().isEmpty()) {
			return new ServerStatus(server.name(), server.command(), server.args(), server.env(), RunState.RUNNING,
					List.of(), Availability.NO_TOOLS, "Running, provides no tools");
		}
		return new ServerStatus(server.name(), server.command(), server.args(), server.env(), RunState.RUNNING,
				tools.value(), Availability.TOOLS_PROVIDED, "Provides " + tools.value().size() + " tool(s)");
	}

	private ServerStatus stoppedStatus(ServerConfig server) {
		String failure = this.startFailures.get(server.name());
		if (failure != null) {
			return new ServerStatus(server.name(), server.command(), server.args(), server.env(), RunState.STOPPED,
					List.of(), Availability.ERROR, "Failed to start: " + failure);
		}
		String note;
		if (server.disabled()) {
			note = "Disabled in configuration";
		}
		else if (!this.stateStore.isEnabled(server.name())) {
			note = "Stopped by user";
		}
		else {
			note = "Stopped";
		}
		return new ServerStatus(server.name(), server.command(), server.args(), server.env(), RunState.STOPPED,
				List.of(), Availability.NOT_RUNNING, note);
	}

	// --------------------------
	// Internals
	// --------------------------

	/**
	 * Lists the tools of every registered session that is alive and initialized,
	 * concurrently.
	 */
	private Map<String, McpResult<List<Tool>>> queryTools() {
		List<Tuple2<String, McpResult<List<Tool>>>> results = Flux.fromIterable(this.config.serverNames())
			.filter(name -> {
				McpStdioSession session = this.sessions.get(name);
				return session != null && session.isAlive() && session.state() == McpSessionState.INITIALIZED;
			})
			.flatMapSequential(name -> Mono.fromCallable(() -> {
				McpStdioSession session = this.sessions.get(name);
				McpResult<List<Tool>> tools = session != null ? session.listTools()
						: McpResult.failure(Kind.UNKNOWN_SERVER, "MCP server '" + name + "' is not running");
				return Tuples.of(name, tools);
			}).subscribeOn(Schedulers.boundedElastic()))
			.collectList()
			.block();
		Map<String, McpResult<List<Tool>>> byName = new LinkedHashMap<>();
		if (results != null) {
			results.forEach(tuple -> byName.put(tuple.getT1(), tuple.getT2()));
		}
		return byName;
	}

	/**
	 * Must be called with the server lock held.
	 */
	private boolean startSession(ServerConfig server) {
		McpStdioSession existing = this.sessions.get(server.name());
		if (existing != null && existing.isAlive() && existing.state() == McpSessionState.INITIALIZED) {
			return true;
		}
		if (existing != null) {
			this.sessions.remove(server.name(), existing);
			existing.close();
		}

		McpStdioSession session = this.sessionFactory.create(server, this.sessionOptions);
		McpResult<InitializeResult> initialized = session.start().flatMap(started -> session.initialize());
		if (initialized.isFailure()) {
			logger.warn("Failed to start MCP server '{}': {}", server.name(), initialized.failure().message());
			this.startFailures.put(server.name(), initialized.failure().message());
			session.close();
			return false;
		}
		this.startFailures.remove(server.name());
		this.sessions.put(server.name(), session);
		return true;
	}

	/**
	 * Must be called with the server lock held.
	 */
	private boolean stopSession(String serverName) {
		this.startFailures.remove(serverName);
		McpStdioSession session = this.sessions.remove(serverName);
		if (session != null) {
			session.close();
			logger.info("Stopped MCP server '{}'", serverName);
		}
		return true;
	}

	private McpResult<InitializeResult> reconnect(String serverName, McpStdioSession session) {
		return withServerLock(serverName, () -> {
			if (this.sessions.get(serverName) != session) {
				return McpResult.<InitializeResult>failure(Kind.SESSION_CLOSED,
						"MCP server '" + serverName + "' was stopped");
			}
			if (session.isAlive() && session.state() == McpSessionState.INITIALIZED) {
				return McpResult.success(session.initializeResult());
			}
			McpResult<InitializeResult> result = session.reconnect();
			if (result.isFailure()) {
				logger.warn("Reconnecting MCP server '{}' failed: {}", serverName, result.failure().message());
			}
			return result;
		});
	}

	private <T> T withServerLock(String serverName, Supplier<T> action) {
		ReentrantLock lock = this.serverLocks.computeIfAbsent(serverName, name -> new ReentrantLock());
		lock.lock();
		try {
			return action.get();
		}
		finally {
			lock.unlock();
		}
	}

	public static class Builder {

		private ServerStateStore stateStore = new InMemoryServerStateStore();

		private McpSessionFactory sessionFactory;

		private McpSessionOptions sessionOptions = McpSessionOptions.defaults();

		private McpJsonMapper jsonMapper;

		private Builder() {
		}

		public Builder stateStore(ServerStateStore stateStore) {
			Assert.notNull(stateStore, "State store must not be null");
			this.stateStore = stateStore;
			return this;
		}

		public Builder sessionFactory(McpSessionFactory sessionFactory) {
			Assert.notNull(sessionFactory, "Session factory must not be null");
			this.sessionFactory = sessionFactory;
			return this;
		}

		public Builder sessionOptions(McpSessionOptions sessionOptions) {
			Assert.notNull(sessionOptions, "Session options must not be null");
			this.sessionOptions = sessionOptions;
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "JsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public DefaultMcpServerPool build() {
			return new DefaultMcpServerPool(this);
		}

	}

}
