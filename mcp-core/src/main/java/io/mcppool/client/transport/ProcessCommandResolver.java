/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.client.transport;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import io.mcppool.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns {@link ServerParameters} into the exact command line and environment of the
 * child process.
 *
 * <p>
 * The environment is the inherited one with the overrides applied on top. Python servers
 * get extra treatment: when the command is {@code python} or {@code python3} and the first
 * argument is an existing script, a {@code venv/bin/python} interpreter next to that
 * script replaces the command, a {@code PYTHONPATH} override is prepended to the
 * inherited one, and {@code PYTHONIOENCODING=utf-8} and {@code PYTHONUNBUFFERED=1} are
 * forced so the server writes unbuffered UTF-8 lines.
 */
public class ProcessCommandResolver {

	private static final Logger logger = LoggerFactory.getLogger(ProcessCommandResolver.class);

	static final String PYTHONPATH = "PYTHONPATH";

	private final Map<String, String> baseEnvironment;

	/**
	 * Resolver inheriting the environment of the current JVM.
	 */
	public ProcessCommandResolver() {
		this(System.getenv());
	}

	public ProcessCommandResolver(Map<String, String> baseEnvironment) {
		this.baseEnvironment = Map.copyOf(baseEnvironment);
	}

	/**
	 * A resolved command line with its complete environment.
	 *
	 * @param command the program followed by its arguments
	 * @param environment the full environment of the child process
	 */
	public record ResolvedCommand(List<String> command, Map<String, String> environment) {
	}

	public ResolvedCommand resolve(ServerParameters params) {
		Map<String, String> environment = new HashMap<>(this.baseEnvironment);
		String inheritedPythonPath = environment.get(PYTHONPATH);
		environment.putAll(params.getEnv());

		List<String> command = new ArrayList<>();
		command.add(params.getCommand());
		command.addAll(params.getArgs());

		if (isPythonCommand(params.getCommand()) && !params.getArgs().isEmpty()) {
			Path script = Paths.get(params.getArgs().get(0));
			if (Files.isRegularFile(script)) {
				Path venvPython = findVirtualEnvPython(script.toAbsolutePath().getParent());
				if (venvPython != null) {
					logger.debug("Using virtual environment interpreter {}", venvPython);
					command.set(0, venvPython.toString());
				}
				String pythonPath = params.getEnv().get(PYTHONPATH);
				if (Utils.hasText(pythonPath) && Utils.hasText(inheritedPythonPath)
						&& !pythonPath.equals(inheritedPythonPath)) {
					environment.put(PYTHONPATH, pythonPath + File.pathSeparator + inheritedPythonPath);
				}
				environment.put("PYTHONIOENCODING", "utf-8");
				environment.put("PYTHONUNBUFFERED", "1");
			}
		}
		return new ResolvedCommand(List.copyOf(command), environment);
	}

	static boolean isPythonCommand(String command) {
		String fileName = Paths.get(command).getFileName().toString().toLowerCase();
		if (fileName.endsWith(".exe")) {
			fileName = fileName.substring(0, fileName.length() - 4);
		}
		return fileName.equals("python") || fileName.equals("python3");
	}

	private static Path findVirtualEnvPython(Path scriptDir) {
		if (scriptDir == null) {
			return null;
		}
		Path unix = scriptDir.resolve("venv").resolve("bin").resolve("python");
		if (Files.isRegularFile(unix)) {
			return unix;
		}
		Path windows = scriptDir.resolve("venv").resolve("Scripts").resolve("python.exe");
		if (Files.isRegularFile(windows)) {
			return windows;
		}
		return null;
	}

}
