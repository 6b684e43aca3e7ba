/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.client.transport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Supplier;

import io.mcppool.json.McpJsonMapper;
import io.mcppool.spec.McpProcessExitedException;
import io.mcppool.spec.McpSchema;
import io.mcppool.spec.McpSchema.JSONRPCMessage;
import io.mcppool.spec.McpSchema.JSONRPCNotification;
import io.mcppool.spec.McpSchema.JSONRPCRequest;
import io.mcppool.spec.McpSchema.JSONRPCResponse;
import io.mcppool.spec.RequestCorrelator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads newline-delimited JSON-RPC messages from a server process on a dedicated thread.
 *
 * <p>
 * Output is accumulated in a byte buffer and split on {@code '\n'} before decoding, so a
 * multi-byte UTF-8 character split across two reads stays intact. Lines that are not
 * JSON-RPC messages are log noise from the server and are dropped. Responses go to the
 * {@link RequestCorrelator}, notifications to the notification handler, and
 * server-initiated requests are ignored.
 *
 * <p>
 * When the output ends while the reader is still open, every pending request is failed
 * with {@link McpProcessExitedException} instead of running into its timeout.
 */
public class StdioResponseReader implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(StdioResponseReader.class);

	private static final int CHUNK_SIZE = 8192;

	private final String name;

	private final InputStream input;

	private final McpJsonMapper jsonMapper;

	private final RequestCorrelator correlator;

	private final Consumer<JSONRPCNotification> notificationHandler;

	private final Supplier<Integer> exitCodeSupplier;

	private final ExecutorService executor;

	private volatile boolean closing;

	private volatile boolean running;

	public StdioResponseReader(String name, InputStream input, McpJsonMapper jsonMapper, RequestCorrelator correlator,
			Consumer<JSONRPCNotification> notificationHandler, Supplier<Integer> exitCodeSupplier) {
		this.name = name;
		this.input = input;
		this.jsonMapper = jsonMapper;
		this.correlator = correlator;
		this.notificationHandler = notificationHandler;
		this.exitCodeSupplier = exitCodeSupplier;
		this.executor = Executors.newSingleThreadExecutor(runnable -> {
			Thread thread = new Thread(runnable, "mcp-reader-" + name);
			thread.setDaemon(true);
			return thread;
		});
	}

	public void start() {
		this.running = true;
		this.executor.execute(this::readLoop);
	}

	public boolean isRunning() {
		return this.running;
	}

	/**
	 * Stops delivering failures for pending requests and releases the reader thread once
	 * the stream ends. The owner closes the reader before terminating the process and
	 * fails its own pending requests afterwards.
	 */
	@Override
	public void close() {
		this.closing = true;
		this.executor.shutdownNow();
	}

	/**
	 * Waits for the reader thread to finish after {@link #close()}.
	 * @param timeout how long to wait
	 * @return {@code true} if the reader thread has finished
	 */
	public boolean awaitTermination(Duration timeout) {
		try {
			return this.executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	private void readLoop() {
		ByteArrayOutputStream line = new ByteArrayOutputStream();
		byte[] chunk = new byte[CHUNK_SIZE];
		try {
			int read;
			while ((read = this.input.read(chunk)) != -1) {
				int start = 0;
				for (int i = 0; i < read; i++) {
					if (chunk[i] == '\n') {
						line.write(chunk, start, i - start);
						handleLine(line.toString(StandardCharsets.UTF_8));
						line.reset();
						start = i + 1;
					}
				}
				line.write(chunk, start, read - start);
			}
			if (line.size() > 0) {
				handleLine(line.toString(StandardCharsets.UTF_8));
			}
		}
		catch (IOException e) {
			if (!this.closing) {
				logger.warn("Error reading output of MCP server '{}': {}", this.name, e.getMessage());
			}
		}
		finally {
			this.running = false;
			onStreamEnd();
		}
	}

	void handleLine(String rawLine) {
		String line = rawLine.strip();
		if (line.isEmpty()) {
			return;
		}
		JSONRPCMessage message;
		try {
			message = McpSchema.deserializeJsonRpcMessage(this.jsonMapper, line);
		}
		catch (IOException | IllegalArgumentException e) {
			logger.debug("Ignoring non JSON-RPC output from '{}': {}", this.name, line);
			return;
		}
		if (message instanceof JSONRPCResponse response) {
			this.correlator.deposit(response.id(), response);
		}
		else if (message instanceof JSONRPCNotification notification) {
			try {
				this.notificationHandler.accept(notification);
			}
			catch (RuntimeException e) {
				logger.warn("Notification handler failed for {} from '{}'", notification.method(), this.name, e);
			}
		}
		else if (message instanceof JSONRPCRequest request) {
			logger.debug("Ignoring server request {} (id {}) from '{}'", request.method(), request.id(), this.name);
		}
	}

	private void onStreamEnd() {
		if (this.closing) {
			return;
		}
		Integer exitCode = this.exitCodeSupplier.get();
		logger.warn("Output of MCP server '{}' ended (exit code {})", this.name, exitCode);
		this.correlator
			.failAll(new McpProcessExitedException("MCP server '" + this.name + "' exited", exitCode));
	}

}
