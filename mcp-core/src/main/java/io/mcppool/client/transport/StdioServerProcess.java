/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.client.transport;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import io.mcppool.spec.McpTransportException;
import io.mcppool.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One spawned server process and its standard streams.
 *
 * <p>
 * Messages are written to the process input as single UTF-8 lines. Writes from
 * concurrent callers are serialized so request lines never interleave. The error stream
 * is drained on a dedicated daemon thread and each non-blank line is passed to the
 * stderr handler.
 */
public class StdioServerProcess {

	private static final Logger logger = LoggerFactory.getLogger(StdioServerProcess.class);

	private static final Duration KILL_WAIT = Duration.ofSeconds(1);

	private final String name;

	private final Process process;

	private final OutputStream stdin;

	private final Object writeLock = new Object();

	private final Thread stderrDrainer;

	private StdioServerProcess(String name, Process process, Consumer<String> stderrHandler) {
		this.name = name;
		this.process = process;
		this.stdin = process.getOutputStream();
		this.stderrDrainer = new Thread(() -> drainStderr(stderrHandler), "mcp-stderr-" + name);
		this.stderrDrainer.setDaemon(true);
		this.stderrDrainer.start();
	}

	/**
	 * Spawns a server process.
	 * @param name the server name, used in thread names and log messages
	 * @param params the command to run
	 * @param resolver turns the parameters into a command line and environment
	 * @param stderrHandler receives every non-blank line the process writes to stderr
	 * @return the running process
	 * @throws McpTransportException if the process could not be created
	 */
	public static StdioServerProcess spawn(String name, ServerParameters params, ProcessCommandResolver resolver,
			Consumer<String> stderrHandler) {
		Assert.hasText(name, "Server name must not be empty");
		Assert.notNull(params, "Server parameters must not be null");
		Assert.notNull(resolver, "Command resolver must not be null");
		Assert.notNull(stderrHandler, "Stderr handler must not be null");

		ProcessCommandResolver.ResolvedCommand resolved = resolver.resolve(params);
		ProcessBuilder processBuilder = new ProcessBuilder(resolved.command());
		processBuilder.environment().clear();
		processBuilder.environment().putAll(resolved.environment());
		try {
			Process process = processBuilder.start();
			logger.info("Started MCP server '{}' (pid {}): {}", name, process.pid(), resolved.command());
			return new StdioServerProcess(name, process, stderrHandler);
		}
		catch (IOException | SecurityException e) {
			throw new McpTransportException("Failed to start process with command: " + resolved.command(), e);
		}
	}

	/**
	 * Returns a handler logging each stderr line of the named server at info level.
	 * @param name the server name
	 * @return the default stderr handler
	 */
	public static Consumer<String> loggingStderrHandler(String name) {
		return line -> logger.info("[{} stderr] {}", name, line);
	}

	/**
	 * Writes one message line to the process input and flushes it.
	 * @param message a JSON message without line breaks
	 * @throws IOException if the input stream is closed, typically because the process
	 * has exited
	 */
	public void send(String message) throws IOException {
		Assert.isTrue(message.indexOf('\n') < 0 && message.indexOf('\r') < 0,
				"A message must not contain line breaks");
		byte[] bytes = (message + "\n").getBytes(StandardCharsets.UTF_8);
		synchronized (this.writeLock) {
			this.stdin.write(bytes);
			this.stdin.flush();
		}
		logger.debug("Sent to '{}': {}", this.name, message);
	}

	public InputStream getInputStream() {
		return this.process.getInputStream();
	}

	public String getName() {
		return this.name;
	}

	public long pid() {
		return this.process.pid();
	}

	public boolean isAlive() {
		return this.process.isAlive();
	}

	/**
	 * Waits for the process to exit.
	 * @param timeout how long to wait
	 * @return {@code true} if the process has exited
	 */
	public boolean awaitExit(Duration timeout) {
		try {
			return this.process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return !this.process.isAlive();
		}
	}

	/**
	 * Returns the exit code of the process.
	 * @return the exit code, or {@code null} while the process is running
	 */
	public Integer exitCode() {
		return this.process.isAlive() ? null : this.process.exitValue();
	}

	/**
	 * Stops the process: closes its input, asks it to terminate, waits up to the grace
	 * period, then kills it and waits briefly for the kill to take effect.
	 * @param gracePeriod how long the process may take to exit on its own
	 */
	public void terminate(Duration gracePeriod) {
		try {
			this.stdin.close();
		}
		catch (IOException e) {
			logger.debug("Closing stdin of '{}' failed: {}", this.name, e.getMessage());
		}
		try {
			if (this.process.isAlive()) {
				this.process.destroy();
				if (!this.process.waitFor(gracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
					logger.warn("MCP server '{}' did not exit within {}, killing it", this.name, gracePeriod);
					this.process.destroyForcibly();
					this.process.waitFor(KILL_WAIT.toMillis(), TimeUnit.MILLISECONDS);
				}
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			this.process.destroyForcibly();
		}
		closeQuietly(this.process.getInputStream());
		closeQuietly(this.process.getErrorStream());
		logger.info("Stopped MCP server '{}' (exit code {})", this.name, exitCode());
	}

	private void drainStderr(Consumer<String> stderrHandler) {
		try (BufferedReader reader = new BufferedReader(
				new InputStreamReader(this.process.getErrorStream(), StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				if (!line.isBlank()) {
					stderrHandler.accept(line);
				}
			}
		}
		catch (IOException e) {
			logger.debug("Stderr of '{}' closed: {}", this.name, e.getMessage());
		}
	}

	private void closeQuietly(Closeable closeable) {
		try {
			closeable.close();
		}
		catch (IOException e) {
			logger.debug("Closing stream of '{}' failed: {}", this.name, e.getMessage());
		}
	}

}
