/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.client;

import java.io.IOException;

import io.mcppool.client.McpFailure.Kind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class McpResultTests {

	@Test
	void successCarriesValue() {
		McpResult<String> result = McpResult.success("tools");

		assertThat(result.isSuccess()).isTrue();
		assertThat(result.map(String::length).value()).isEqualTo(5);
		assertThat(result.flatMap(value -> McpResult.failure(Kind.TIMEOUT, "late")).failure().kind())
			.isEqualTo(Kind.TIMEOUT);
		assertThatThrownBy(result::failure).isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(result::asFailure).isInstanceOf(IllegalStateException.class);
	}

	@Test
	void failureSkipsMapping() {
		IOException cause = new IOException("Broken pipe");
		McpResult<String> result = McpResult.failure(McpFailure.of(Kind.BROKEN_PIPE, "write failed", cause));

		McpResult<Integer> mapped = result.map(String::length);

		assertThat(mapped.isFailure()).isTrue();
		assertThat(mapped.failure().cause()).isSameAs(cause);
		assertThat(result.orElse("fallback")).isEqualTo("fallback");
		assertThat(result.toString()).contains("BROKEN_PIPE").contains("write failed");
		assertThatThrownBy(result::value).isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("write failed")
			.hasCause(cause);
	}

	@Test
	void prefixKeepsKindCodeAndCause() {
		IllegalStateException cause = new IllegalStateException("boom");
		McpFailure failure = new McpFailure(Kind.PROTOCOL_ERROR, "Unknown tool", -32602, cause);

		McpFailure prefixed = failure.withPrefix("Tool execution failed");

		assertThat(prefixed.message()).isEqualTo("Tool execution failed: Unknown tool");
		assertThat(prefixed.kind()).isEqualTo(Kind.PROTOCOL_ERROR);
		assertThat(prefixed.errorCode()).isEqualTo(-32602);
		assertThat(prefixed.cause()).isSameAs(cause);
	}

}
