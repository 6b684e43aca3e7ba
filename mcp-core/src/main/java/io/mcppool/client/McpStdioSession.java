/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.client;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

import io.mcppool.client.McpFailure.Kind;
import io.mcppool.client.transport.ProcessCommandResolver;
import io.mcppool.client.transport.ServerParameters;
import io.mcppool.client.transport.StdioResponseReader;
import io.mcppool.client.transport.StdioServerProcess;
import io.mcppool.json.McpJsonDefaults;
import io.mcppool.json.McpJsonMapper;
import io.mcppool.spec.McpError;
import io.mcppool.spec.McpProcessExitedException;
import io.mcppool.spec.McpSchema;
import io.mcppool.spec.McpSchema.CallToolRequest;
import io.mcppool.spec.McpSchema.CallToolResult;
import io.mcppool.spec.McpSchema.InitializeResult;
import io.mcppool.spec.McpSchema.JSONRPCNotification;
import io.mcppool.spec.McpSchema.JSONRPCRequest;
import io.mcppool.spec.McpSchema.JSONRPCResponse;
import io.mcppool.spec.McpSchema.ListToolsResult;
import io.mcppool.spec.McpSchema.LoggingMessageNotification;
import io.mcppool.spec.McpSchema.Tool;
import io.mcppool.spec.McpTransportException;
import io.mcppool.spec.RequestCorrelator;
import io.mcppool.spec.RequestIdGenerator;
import io.mcppool.util.Assert;
import io.mcppool.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;

/**
 * Client for one MCP server spoken to over the standard streams of a child process.
 *
 * <p>
 * A session owns at most one {@link StdioServerProcess} and the
 * {@link StdioResponseReader} draining its output. Requests from any number of threads
 * are written through the process' write lock and correlated by id, so concurrent calls
 * receive their own responses in whatever order the server answers. Lifecycle
 * operations ({@link #start()}, {@link #initialize()}, {@link #reconnect()},
 * {@link #close()}) are serialized by a lock; requests are not.
 *
 * <p>
 * No operation throws across this class' boundary: each returns an {@link McpResult}
 * whose {@link McpFailure} tells why it failed.
 */
public class McpStdioSession implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(McpStdioSession.class);

	private static final Duration READER_STOP_TIMEOUT = Duration.ofSeconds(1);

	private static final Duration BROKEN_PIPE_EXIT_WAIT = Duration.ofMillis(500);

	private final String name;

	private final ServerParameters parameters;

	private final McpSessionOptions options;

	private final McpJsonMapper jsonMapper;

	private final ProcessCommandResolver commandResolver;

	private final Consumer<String> stderrHandler;

	private final Consumer<LoggingMessageNotification> loggingConsumer;

	private final RequestCorrelator correlator = new RequestCorrelator();

	private final RequestIdGenerator requestIdGenerator;

	private final ReentrantLock lifecycleLock = new ReentrantLock();

	private final AtomicInteger reconnectCount = new AtomicInteger();

	private final Object stateMonitor = new Object();

	private volatile McpSessionState state = McpSessionState.CREATED;

	private volatile StdioServerProcess process;

	private volatile StdioResponseReader reader;

	private volatile InitializeResult initializeResult;

	private McpStdioSession(Builder builder) {
		this.name = builder.name;
		this.parameters = builder.parameters;
		this.options = builder.options;
		this.jsonMapper = builder.jsonMapper != null ? builder.jsonMapper : McpJsonDefaults.getMapper();
		this.commandResolver = builder.commandResolver;
		this.stderrHandler = builder.stderrHandler != null ? builder.stderrHandler
				: StdioServerProcess.loggingStderrHandler(builder.name);
		this.loggingConsumer = builder.loggingConsumer != null ? builder.loggingConsumer
				: new Slf4jLoggingConsumer(builder.name);
		this.requestIdGenerator = builder.options.newRequestIdGenerator();
	}

	public static Builder builder(String name, ServerParameters parameters) {
		return new Builder(name, parameters);
	}

	// --------------------------
	// Lifecycle
	// --------------------------

	/**
	 * Spawns the server process and starts its response reader. Starting a session whose
	 * process is already running succeeds without spawning another.
	 * @return success, or a {@link Kind#SPAWN_ERROR} failure
	 */
	public McpResult<Void> start() {
		this.lifecycleLock.lock();
		try {
			if (this.state == McpSessionState.CLOSED) {
				return McpResult.failure(Kind.SESSION_CLOSED, "Session '" + this.name + "' is closed");
			}
			StdioServerProcess current = this.process;
			if (current != null && current.isAlive()
					&& (this.state == McpSessionState.STARTED || this.state == McpSessionState.INITIALIZED)) {
				return McpResult.success(null);
			}
			if (current != null) {
				stopProcess();
			}
			StdioServerProcess spawned;
			try {
				spawned = StdioServerProcess.spawn(this.name, this.parameters, this.commandResolver,
						this.stderrHandler);
			}
			catch (McpTransportException e) {
				logger.warn("Failed to start MCP server '{}': {}", this.name, e.getMessage(), e.getCause());
				setState(McpSessionState.DISCONNECTED);
				return McpResult.failure(McpFailure.of(Kind.SPAWN_ERROR, e.getMessage(), e.getCause()));
			}
			StdioResponseReader newReader = new StdioResponseReader(this.name, spawned.getInputStream(),
					this.jsonMapper, this.correlator, this::handleNotification, spawned::exitCode);
			newReader.start();
			this.process = spawned;
			this.reader = newReader;
			this.initializeResult = null;
			setState(McpSessionState.STARTED);
			return McpResult.success(null);
		}
		finally {
			this.lifecycleLock.unlock();
		}
	}

	/**
	 * Performs the {@code initialize} handshake and sends
	 * {@code notifications/initialized}. A failed handshake terminates the process and
	 * leaves the session {@link McpSessionState#DISCONNECTED}.
	 * @return the server's initialize result
	 */
	public McpResult<InitializeResult> initialize() {
		this.lifecycleLock.lock();
		try {
			switch (this.state) {
				case CLOSED:
					return McpResult.failure(Kind.SESSION_CLOSED, "Session '" + this.name + "' is closed");
				case INITIALIZED:
					return McpResult.success(this.initializeResult);
				case STARTED:
					break;
				default:
					return McpResult.failure(Kind.NOT_INITIALIZED,
							"Server process of '" + this.name + "' is not started");
			}

			McpSchema.InitializeRequest request = new McpSchema.InitializeRequest(this.options.protocolVersion(),
					McpSchema.ClientCapabilities.empty(), this.options.clientInfo());
			McpResult<InitializeResult> result = request(McpSchema.METHOD_INITIALIZE, request,
					this.options.initializeTimeout())
				.flatMap(payload -> convert(payload, InitializeResult.class))
				.flatMap(initialized -> sendNotification(McpSchema.METHOD_NOTIFICATION_INITIALIZED, null)
					.map(sent -> initialized));
			if (result.isFailure()) {
				logger.warn("Handshake with MCP server '{}' failed: {}", this.name, result.failure().message());
				stopProcess();
				setState(McpSessionState.DISCONNECTED);
				return result;
			}
			InitializeResult initialized = result.value();
			if (initialized.protocolVersion() != null
					&& !initialized.protocolVersion().equals(this.options.protocolVersion())) {
				logger.info("MCP server '{}' answered with protocol version {} (requested {})", this.name,
						initialized.protocolVersion(), this.options.protocolVersion());
			}
			this.initializeResult = initialized;
			setState(McpSessionState.INITIALIZED);
			logger.info("Initialized MCP server '{}' ({})", this.name, initialized.serverInfo());
			return result;
		}
		finally {
			this.lifecycleLock.unlock();
		}
	}

	/**
	 * Terminates the current process, if any, then starts and initializes a new one.
	 * @return the new initialize result, or the failure of the start or handshake
	 */
	public McpResult<InitializeResult> reconnect() {
		this.lifecycleLock.lock();
		try {
			if (this.state == McpSessionState.CLOSED) {
				return McpResult.failure(Kind.SESSION_CLOSED, "Session '" + this.name + "' is closed");
			}
			this.reconnectCount.incrementAndGet();
			logger.info("Reconnecting MCP server '{}'", this.name);
			stopProcess();
			setState(McpSessionState.DISCONNECTED);
			McpResult<Void> started = start();
			if (started.isFailure()) {
				return started.asFailure();
			}
			return initialize();
		}
		finally {
			this.lifecycleLock.unlock();
		}
	}

	/**
	 * Terminates the process, stops the reader and fails every request still pending.
	 * Closing twice is a no-op.
	 */
	@Override
	public void close() {
		this.lifecycleLock.lock();
		try {
			if (this.state == McpSessionState.CLOSED) {
				return;
			}
			stopProcess();
			this.correlator.failAll(new McpTransportException("Session '" + this.name + "' closed"));
			setState(McpSessionState.CLOSED);
		}
		finally {
			this.lifecycleLock.unlock();
		}
	}

	// --------------------------
	// Tools
	// --------------------------

	/**
	 * Lists the server's tools, following {@code nextCursor} pages. A server that rejects
	 * the parameterless request with {@code -32602} is asked once more with an empty
	 * params object. A result without a {@code tools} field means the server provides no
	 * tools.
	 * @return the tools, possibly empty
	 */
	public McpResult<List<Tool>> listTools() {
		McpResult<Void> ready = checkReady();
		if (ready.isFailure()) {
			return ready.asFailure();
		}

		McpResult<ListToolsResult> page = listToolsPage(null);
		if (page.isFailure() && page.failure().kind() == Kind.PROTOCOL_ERROR
				&& Integer.valueOf(McpSchema.ErrorCodes.INVALID_PARAMS).equals(page.failure().errorCode())) {
			logger.debug("MCP server '{}' rejected tools/list without params, retrying with empty params",
					this.name);
			page = listToolsPage(Map.of());
		}

		List<Tool> tools = new ArrayList<>();
		for (int pages = 1;; pages++) {
			if (page.isFailure()) {
				return page.asFailure();
			}
			if (page.value().tools() != null) {
				tools.addAll(page.value().tools());
			}
			String cursor = page.value().nextCursor();
			if (!Utils.hasText(cursor)) {
				break;
			}
			if (pages >= this.options.maxToolPages()) {
				logger.warn("MCP server '{}' returned more than {} tool pages, ignoring the rest", this.name,
						this.options.maxToolPages());
				break;
			}
			page = listToolsPage(Map.of("cursor", cursor));
		}
		return McpResult.success(Collections.unmodifiableList(tools));
	}

	/**
	 * Calls a tool.
	 * @param toolName the tool name
	 * @param arguments the tool arguments, an empty object if {@code null}
	 * @return the tool result
	 */
	public McpResult<CallToolResult> callTool(String toolName, Map<String, Object> arguments) {
		McpResult<Void> ready = checkReady();
		if (ready.isFailure()) {
			return ready.asFailure();
		}
		if (!Utils.hasText(toolName)) {
			return McpResult.failure(Kind.INVALID_REQUEST, "Tool name must not be empty");
		}
		return request(McpSchema.METHOD_TOOLS_CALL, new CallToolRequest(toolName, arguments),
				this.options.callToolTimeout())
			.flatMap(payload -> convert(payload, CallToolResult.class));
	}

	// --------------------------
	// Inspection
	// --------------------------

	public String name() {
		return this.name;
	}

	public McpSessionState state() {
		return this.state;
	}

	public ServerParameters parameters() {
		return this.parameters;
	}

	public boolean isAlive() {
		StdioServerProcess current = this.process;
		return current != null && current.isAlive();
	}

	/**
	 * Returns the exit code of the last process.
	 * @return the exit code, or {@code null} if no process exited yet
	 */
	public Integer exitCode() {
		StdioServerProcess current = this.process;
		return current != null ? current.exitCode() : null;
	}

	public InitializeResult initializeResult() {
		return this.initializeResult;
	}

	public int reconnectCount() {
		return this.reconnectCount.get();
	}

	public int pendingRequestCount() {
		return this.correlator.pendingCount();
	}

	// --------------------------
	// Internals
	// --------------------------

	private McpResult<ListToolsResult> listToolsPage(Object params) {
		return request(McpSchema.METHOD_TOOLS_LIST, params, this.options.listToolsTimeout())
			.flatMap(payload -> convert(payload, ListToolsResult.class));
	}

	/**
	 * Liveness check run before every request. A dead process moves the session to
	 * {@link McpSessionState#DISCONNECTED}.
	 */
	private McpResult<Void> checkReady() {
		McpSessionState current = this.state;
		if (current == McpSessionState.CLOSED) {
			return McpResult.failure(Kind.SESSION_CLOSED, "Session '" + this.name + "' is closed");
		}
		if (current == McpSessionState.DISCONNECTED) {
			return McpResult.failure(Kind.PROCESS_DIED, "MCP server '" + this.name + "' is disconnected");
		}
		if (current != McpSessionState.INITIALIZED) {
			return McpResult.failure(Kind.NOT_INITIALIZED, "MCP server '" + this.name + "' is not initialized");
		}
		StdioServerProcess serverProcess = this.process;
		if (serverProcess == null || !serverProcess.isAlive()) {
			Integer exitCode = serverProcess != null ? serverProcess.exitCode() : null;
			markDisconnected(serverProcess);
			return McpResult.failure(McpFailure.of(Kind.PROCESS_DIED, "MCP server '" + this.name + "' has exited",
					new McpProcessExitedException("MCP server '" + this.name + "' has exited", exitCode)));
		}
		return McpResult.success(null);
	}

	private McpResult<Object> request(String method, Object params, Duration timeout) {
		StdioServerProcess serverProcess = this.process;
		if (serverProcess == null) {
			return McpResult.failure(Kind.NOT_INITIALIZED, "MCP server '" + this.name + "' has no process");
		}
		String id = this.requestIdGenerator.generate();
		String line;
		try {
			line = this.jsonMapper
				.writeValueAsString(new JSONRPCRequest(McpSchema.JSONRPC_VERSION, method, id, params));
		}
		catch (IOException | IllegalArgumentException e) {
			return McpResult.failure(McpFailure.of(Kind.INVALID_REQUEST,
					"Cannot encode " + method + " request for '" + this.name + "': " + e.getMessage(), e));
		}
		try {
			Object result = sendRequest(serverProcess, id, line, method, timeout).block();
			return McpResult.success(result);
		}
		catch (RuntimeException e) {
			McpFailure failure = toFailure(method, Exceptions.unwrap(e));
			if (failure.kind() == Kind.PROCESS_DIED) {
				markDisconnected(serverProcess);
			}
			return McpResult.failure(failure);
		}
	}

	/**
	 * Registers the id before writing so the response cannot overtake the registration.
	 * Emits the {@code result} payload, an empty map when the server sent none.
	 */
	private Mono<Object> sendRequest(StdioServerProcess current, String id, String line, String method,
			Duration timeout) {
		return Mono.defer(() -> {
			this.correlator.register(id);
			Mono<JSONRPCResponse> response = this.correlator.await(id, timeout);
			try {
				current.send(line);
			}
			catch (IOException e) {
				this.correlator.abandon(id);
				// a write usually breaks because the process is exiting
				if (current.awaitExit(BROKEN_PIPE_EXIT_WAIT)) {
					return Mono.error(new McpProcessExitedException("MCP server '" + this.name + "' has exited",
							current.exitCode()));
				}
				return Mono.error(new McpTransportException("Failed to send " + method + " request", e));
			}
			return response;
		}).flatMap(this::unwrapResponse);
	}

	private Mono<Object> unwrapResponse(JSONRPCResponse response) {
		if (response.error() != null) {
			return Mono.error(new McpError(response.error()));
		}
		return Mono.just(response.result() != null ? response.result() : Map.of());
	}

	private McpResult<Void> sendNotification(String method, Object params) {
		StdioServerProcess current = this.process;
		if (current == null) {
			return McpResult.failure(Kind.NOT_INITIALIZED, "No server process");
		}
		try {
			current.send(this.jsonMapper.writeValueAsString(
					new JSONRPCNotification(McpSchema.JSONRPC_VERSION, method, params)));
			return McpResult.success(null);
		}
		catch (IOException e) {
			return McpResult
				.failure(McpFailure.of(Kind.BROKEN_PIPE, "Failed to send " + method + " notification", e));
		}
	}

	private <T> McpResult<T> convert(Object payload, Class<T> type) {
		try {
			return McpResult.success(this.jsonMapper.convertValue(payload, type));
		}
		catch (IllegalArgumentException e) {
			return McpResult.failure(McpFailure.of(Kind.INVALID_RESPONSE,
					"Unexpected " + type.getSimpleName() + " from '" + this.name + "': " + e.getMessage(), e));
		}
	}

	private McpFailure toFailure(String method, Throwable error) {
		if (error instanceof McpError mcpError) {
			return new McpFailure(Kind.PROTOCOL_ERROR,
					method + " failed on '" + this.name + "': " + mcpError.getMessage(), mcpError.getCode(),
					mcpError);
		}
		if (error instanceof McpProcessExitedException) {
			return McpFailure.of(Kind.PROCESS_DIED, error.getMessage(), error);
		}
		if (error instanceof McpTransportException) {
			return McpFailure.of(Kind.BROKEN_PIPE, error.getMessage(), error);
		}
		if (error instanceof TimeoutException) {
			return McpFailure.of(Kind.TIMEOUT, method + " on '" + this.name + "' timed out", error);
		}
		return McpFailure.of(Kind.INVALID_RESPONSE, method + " on '" + this.name + "' failed: " + error, error);
	}

	private void handleNotification(JSONRPCNotification notification) {
		if (McpSchema.METHOD_NOTIFICATION_MESSAGE.equals(notification.method())) {
			this.loggingConsumer
				.accept(this.jsonMapper.convertValue(notification.params(), LoggingMessageNotification.class));
		}
		else {
			logger.debug("Ignoring notification {} from '{}'", notification.method(), this.name);
		}
	}

	/**
	 * Moves the session to {@link McpSessionState#DISCONNECTED} unless the dead process
	 * has already been replaced by a reconnect.
	 */
	private void markDisconnected(StdioServerProcess deadProcess) {
		synchronized (this.stateMonitor) {
			if (this.process == deadProcess
					&& (this.state == McpSessionState.INITIALIZED || this.state == McpSessionState.STARTED)) {
				logger.warn("MCP server '{}' is no longer running (exit code {})", this.name, exitCode());
				this.state = McpSessionState.DISCONNECTED;
			}
		}
	}

	private void setState(McpSessionState newState) {
		synchronized (this.stateMonitor) {
			this.state = newState;
		}
	}

	/**
	 * Stops reader and process. Must be called with the lifecycle lock held.
	 */
	private void stopProcess() {
		StdioResponseReader currentReader = this.reader;
		StdioServerProcess currentProcess = this.process;
		if (currentReader != null) {
			currentReader.close();
		}
		if (currentProcess != null) {
			currentProcess.terminate(this.options.terminationGracePeriod());
			this.correlator.failAll(new McpProcessExitedException("MCP server '" + this.name + "' stopped",
					currentProcess.exitCode()));
		}
		if (currentReader != null && !currentReader.awaitTermination(READER_STOP_TIMEOUT)) {
			logger.warn("Reader of MCP server '{}' did not stop in time", this.name);
		}
		this.reader = null;
		this.initializeResult = null;
	}

	public static class Builder {

		private final String name;

		private final ServerParameters parameters;

		private McpSessionOptions options = McpSessionOptions.defaults();

		private McpJsonMapper jsonMapper;

		private ProcessCommandResolver commandResolver = new ProcessCommandResolver();

		private Consumer<String> stderrHandler;

		private Consumer<LoggingMessageNotification> loggingConsumer;

		private Builder(String name, ServerParameters parameters) {
			Assert.hasText(name, "Server name must not be empty");
			Assert.notNull(parameters, "Server parameters must not be null");
			this.name = name;
			this.parameters = parameters;
		}

		public Builder options(McpSessionOptions options) {
			Assert.notNull(options, "Options must not be null");
			this.options = options;
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "JsonMapper must not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public Builder commandResolver(ProcessCommandResolver commandResolver) {
			Assert.notNull(commandResolver, "Command resolver must not be null");
			this.commandResolver = commandResolver;
			return this;
		}

		/**
		 * Receives each non-blank stderr line of the server; logged at info by default.
		 * @param stderrHandler the handler
		 * @return this builder
		 */
		public Builder stderrHandler(Consumer<String> stderrHandler) {
			Assert.notNull(stderrHandler, "Stderr handler must not be null");
			this.stderrHandler = stderrHandler;
			return this;
		}

		public Builder loggingConsumer(Consumer<LoggingMessageNotification> loggingConsumer) {
			Assert.notNull(loggingConsumer, "Logging consumer must not be null");
			this.loggingConsumer = loggingConsumer;
			return this;
		}

		public McpStdioSession build() {
			return new McpStdioSession(this);
		}

	}

}
