/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.pool;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import io.mcppool.json.McpJsonMapper;
import io.mcppool.json.TypeRef;
import io.mcppool.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ServerStateStore} persisted as a JSON object of server name to boolean, for
 * example {@code {"filesystem": true, "git": false}}.
 *
 * <p>
 * The file is read once on construction and rewritten on every change through a
 * temporary file that replaces it, so a crash never leaves a half-written document. A
 * missing or unreadable file starts the store empty; a failed write is logged and the
 * change is kept in memory.
 */
public class FileServerStateStore implements ServerStateStore {

	private static final Logger logger = LoggerFactory.getLogger(FileServerStateStore.class);

	private static final TypeRef<TreeMap<String, Boolean>> STATE_TYPE = new TypeRef<>() {
	};

	private final Path file;

	private final McpJsonMapper jsonMapper;

	private final boolean defaultEnabled;

	private final Map<String, Boolean> states;

	/**
	 * Creates a store treating servers without a recorded state as enabled.
	 * @param file the state file
	 * @param jsonMapper the mapper used to read and write the file
	 */
	public FileServerStateStore(Path file, McpJsonMapper jsonMapper) {
		this(file, jsonMapper, true);
	}

	public FileServerStateStore(Path file, McpJsonMapper jsonMapper, boolean defaultEnabled) {
		Assert.notNull(file, "State file must not be null");
		Assert.notNull(jsonMapper, "JsonMapper must not be null");
		this.file = file;
		this.jsonMapper = jsonMapper;
		this.defaultEnabled = defaultEnabled;
		this.states = read();
	}

	@Override
	public synchronized boolean isEnabled(String serverName) {
		Boolean enabled = this.states.get(serverName);
		return enabled != null ? enabled : this.defaultEnabled;
	}

	@Override
	public synchronized void setEnabled(String serverName, boolean enabled) {
		Assert.hasText(serverName, "Server name must not be empty");
		Boolean previous = this.states.put(serverName, enabled);
		if (previous == null || previous != enabled) {
			write();
		}
	}

	@Override
	public synchronized Map<String, Boolean> snapshot() {
		return Map.copyOf(this.states);
	}

	public Path getFile() {
		return this.file;
	}

	private Map<String, Boolean> read() {
		if (!Files.isRegularFile(this.file)) {
			return new TreeMap<>();
		}
		try {
			TreeMap<String, Boolean> loaded = this.jsonMapper
				.readValue(Files.readString(this.file, StandardCharsets.UTF_8), STATE_TYPE);
			if (loaded == null) {
				return new TreeMap<>();
			}
			loaded.values().removeIf(Objects::isNull);
			return loaded;
		}
		catch (IOException | IllegalArgumentException e) {
			logger.warn("Ignoring unreadable server state file {}: {}", this.file, e.getMessage());
			return new TreeMap<>();
		}
	}

	private void write() {
		try {
			Path parent = this.file.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Path temp = Files.createTempFile(parent, this.file.getFileName().toString(), ".tmp");
			Files.writeString(temp, this.jsonMapper.writeValueAsPrettyString(this.states), StandardCharsets.UTF_8);
			try {
				Files.move(temp, this.file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, this.file, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		catch (IOException e) {
			logger.warn("Failed to save server state to {}: {}", this.file, e.getMessage());
		}
	}

}
