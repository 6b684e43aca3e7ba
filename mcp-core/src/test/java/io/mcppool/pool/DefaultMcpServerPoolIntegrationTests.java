/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.pool;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.mcppool.FakeServers;
import io.mcppool.client.McpResult;
import io.mcppool.client.transport.ServerParameters;
import io.mcppool.json.McpJsonDefaults;
import io.mcppool.json.McpJsonMapper;
import io.mcppool.pool.ServerStatus.Availability;
import io.mcppool.pool.ServerStatus.RunState;
import io.mcppool.spec.McpSchema.CallToolResult;
import io.mcppool.spec.McpSchema.Tool;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the pool against {@code FakeMcpServer} child processes configured through a
 * configuration file and a persisted state file.
 */
@Timeout(120)
class DefaultMcpServerPoolIntegrationTests {

	private final McpJsonMapper jsonMapper = McpJsonDefaults.getMapper();

	@TempDir
	Path dir;

	private DefaultMcpServerPool pool;

	@AfterEach
	void tearDown() {
		if (pool != null) {
			pool.stopAll();
		}
	}

	private Map<String, Object> entry(String... options) {
		ServerParameters parameters = FakeServers.parameters(options);
		Map<String, Object> entry = new LinkedHashMap<>();
		entry.put("command", parameters.getCommand());
		entry.put("args", parameters.getArgs());
		return entry;
	}

	private Path writeConfig(Map<String, Object> servers) throws IOException {
		Path file = dir.resolve("mcp.json");
		Files.writeString(file, jsonMapper.writeValueAsString(Map.of("servers", servers)));
		return file;
	}

	private DefaultMcpServerPool pool(Path stateFile) {
		pool = DefaultMcpServerPool.builder()
			.stateStore(new FileServerStateStore(stateFile, jsonMapper))
			.jsonMapper(jsonMapper)
			.build();
		return pool;
	}

	@Test
	void runtimeDisabledServerStaysStoppedAcrossRestarts() throws IOException {
		Map<String, Object> servers = new LinkedHashMap<>();
		servers.put("alpha", entry("--tools=read_file,write_file"));
		servers.put("beta", entry("--tools=search"));
		Path config = writeConfig(servers);
		Path stateFile = dir.resolve("state.json");

		DefaultMcpServerPool first = pool(stateFile);
		assertThat(first.startAll(config)).isTrue();
		assertThat(first.getAllTools()).containsOnlyKeys("alpha", "beta");
		assertThat(first.stopServer("beta")).isTrue();
		first.stopAll();

		DefaultMcpServerPool second = pool(stateFile);
		assertThat(second.startAll(config)).isTrue();

		Map<String, List<Tool>> tools = second.getAllTools();
		assertThat(tools).containsOnlyKeys("alpha");
		assertThat(tools.get("alpha")).extracting(Tool::name).containsExactly("read_file", "write_file");

		Map<String, ServerStatus> status = second.status();
		assertThat(status.get("alpha").runState()).isEqualTo(RunState.RUNNING);
		assertThat(status.get("alpha").availability()).isEqualTo(Availability.TOOLS_PROVIDED);
		assertThat(status.get("beta").runState()).isEqualTo(RunState.STOPPED);
		assertThat(status.get("beta").availability()).isEqualTo(Availability.NOT_RUNNING);

		assertThat(second.startServer("beta")).isTrue();
		assertThat(second.getAllTools()).containsOnlyKeys("alpha", "beta");
		assertThat(new FileServerStateStore(stateFile, jsonMapper).isEnabled("beta")).isTrue();
	}

	@Test
	void callToolRecoversFromServerExit() throws IOException {
		Path config = writeConfig(Map.of("flaky", entry("--exit-after-calls=1")));
		DefaultMcpServerPool created = pool(dir.resolve("state.json"));
		assertThat(created.startAll(config)).isTrue();

		McpResult<CallToolResult> first = created.callTool("flaky", "echo", Map.of("text", "one"));
		McpResult<CallToolResult> second = created.callTool("flaky", "echo", Map.of("text", "two"));

		assertThat(first.value().text()).isEqualTo("one");
		assertThat(second.isSuccess()).as("second call: %s", second).isTrue();
		assertThat(second.value().text()).isEqualTo("two");
	}

	@Test
	void failingServersDoNotBlockOthers() throws IOException {
		Map<String, Object> servers = new LinkedHashMap<>();
		servers.put("good", entry());
		servers.put("refusing", entry("--fail-initialize"));
		servers.put("missing", Map.of("command", dir.resolve("no-such-binary").toString()));
		Path config = writeConfig(servers);
		DefaultMcpServerPool created = pool(dir.resolve("state.json"));

		assertThat(created.startAll(config)).isFalse();

		assertThat(created.getAllTools()).containsOnlyKeys("good");
		Map<String, ServerStatus> status = created.status();
		assertThat(status.get("refusing").availability()).isEqualTo(Availability.ERROR);
		assertThat(status.get("missing").availability()).isEqualTo(Availability.ERROR);
		assertThat(status.get("missing").note()).startsWith("Failed to start: ");
		assertThat(created.callTool("refusing", "echo", Map.of()).failure().message())
			.startsWith("Tool execution failed: ");
	}

	@Test
	void missingConfigurationFailsStartup() {
		DefaultMcpServerPool created = pool(dir.resolve("state.json"));

		assertThat(created.startAll(dir.resolve("absent.json"))).isFalse();
		assertThat(created.status()).isEmpty();
	}

}
