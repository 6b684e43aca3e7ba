/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.json.jackson2;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import io.mcppool.json.McpJsonDefaults;
import io.mcppool.json.McpJsonMapper;
import io.mcppool.json.TypeRef;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JacksonMcpJsonMapperTests {

	record Entry(String name, List<String> args, Boolean disabled) {
	}

	private final McpJsonMapper mapper = new JacksonMcpJsonMapperSupplier().get();

	@Test
	void serviceLoaderFindsJacksonMapper() {
		assertThat(McpJsonDefaults.getMapper()).isInstanceOf(JacksonMcpJsonMapper.class);
		assertThat(McpJsonDefaults.getMapper()).isSameAs(McpJsonDefaults.getMapper());
	}

	@Test
	void readsRecordsIgnoringUnknownProperties() throws IOException {
		Entry entry = mapper.readValue("{\"name\":\"fs\",\"args\":[\"-y\"],\"extra\":42}", Entry.class);

		assertThat(entry.name()).isEqualTo("fs");
		assertThat(entry.args()).containsExactly("-y");
		assertThat(entry.disabled()).isNull();
	}

	@Test
	void readsParameterizedTypes() throws IOException {
		Map<String, Boolean> states = mapper.readValue("{\"a\":true,\"b\":false}", new TypeRef<Map<String, Boolean>>() {
		});

		assertThat(states).containsEntry("a", true).containsEntry("b", false);
	}

	@Test
	void convertsDecodedMaps() {
		Entry entry = mapper.convertValue(Map.of("name", "git", "disabled", true), Entry.class);

		assertThat(entry.name()).isEqualTo("git");
		assertThat(entry.disabled()).isTrue();
	}

	@Test
	void writesSingleLineJson() throws IOException {
		String json = mapper.writeValueAsString(Map.of("text", "line one\nline two"));

		assertThat(json).doesNotContain("\n").contains("\\n");
	}

	@Test
	void rejectsNonJsonText() {
		assertThatThrownBy(() -> mapper.readValue("server listening on stdio", Map.class))
			.isInstanceOf(IOException.class);
	}

}
