/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.spec;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import io.mcppool.json.McpJsonDefaults;
import io.mcppool.json.McpJsonMapper;
import io.mcppool.json.TypeRef;
import io.mcppool.spec.McpSchema.JSONRPCMessage;
import io.mcppool.spec.McpSchema.JSONRPCNotification;
import io.mcppool.spec.McpSchema.JSONRPCRequest;
import io.mcppool.spec.McpSchema.JSONRPCResponse;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class McpSchemaTests {

	private final McpJsonMapper mapper = McpJsonDefaults.getMapper();

	@Test
	void classifiesResponses() throws IOException {
		JSONRPCMessage message = McpSchema.deserializeJsonRpcMessage(mapper,
				"{\"jsonrpc\":\"2.0\",\"id\":\"abc-1\",\"result\":{\"tools\":[]}}");

		assertThat(message).isInstanceOf(JSONRPCResponse.class);
		JSONRPCResponse response = (JSONRPCResponse) message;
		assertThat(response.id()).isEqualTo("abc-1");
		assertThat(response.result()).isEqualTo(Map.of("tools", List.of()));
		assertThat(response.error()).isNull();
	}

	@Test
	void classifiesErrorResponses() throws IOException {
		JSONRPCResponse response = (JSONRPCResponse) McpSchema.deserializeJsonRpcMessage(mapper,
				"{\"jsonrpc\":\"2.0\",\"id\":3,\"error\":{\"code\":-32602,\"message\":\"Invalid params\"}}");

		assertThat(response.id()).isEqualTo(3);
		assertThat(response.error().code()).isEqualTo(McpSchema.ErrorCodes.INVALID_PARAMS);
		assertThat(response.error().message()).isEqualTo("Invalid params");
	}

	@Test
	void responseWithIdOnlyIsStillAResponse() throws IOException {
		JSONRPCMessage message = McpSchema.deserializeJsonRpcMessage(mapper, "{\"id\":\"x\"}");

		assertThat(message).isInstanceOf(JSONRPCResponse.class);
		assertThat(((JSONRPCResponse) message).result()).isNull();
	}

	@Test
	void classifiesNotificationsAndRequests() throws IOException {
		assertThat(McpSchema.deserializeJsonRpcMessage(mapper,
				"{\"jsonrpc\":\"2.0\",\"method\":\"notifications/message\",\"params\":{\"level\":\"info\"}}"))
			.isInstanceOf(JSONRPCNotification.class);
		assertThat(McpSchema.deserializeJsonRpcMessage(mapper,
				"{\"jsonrpc\":\"2.0\",\"id\":\"s-1\",\"method\":\"roots/list\"}"))
			.isInstanceOf(JSONRPCRequest.class);
	}

	@Test
	void rejectsNoise() {
		assertThatThrownBy(() -> McpSchema.deserializeJsonRpcMessage(mapper, "Starting server on stdio..."))
			.isInstanceOf(IOException.class);
		assertThatThrownBy(() -> McpSchema.deserializeJsonRpcMessage(mapper, "{\"hello\":\"world\"}"))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> McpSchema.deserializeJsonRpcMessage(mapper, "[1,2,3]"))
			.isInstanceOf(IOException.class);
	}

	@Test
	void requestWithoutParamsOmitsField() throws IOException {
		JSONRPCRequest request = new JSONRPCRequest(McpSchema.JSONRPC_VERSION, McpSchema.METHOD_TOOLS_LIST, "id-1",
				null);
		String json = mapper.writeValueAsString(request);

		assertThat(json).doesNotContain("params").contains("\"method\":\"tools/list\"").contains("\"id\":\"id-1\"");
	}

	@Test
	void requestIdMustBeStringOrInteger() {
		assertThatThrownBy(() -> new JSONRPCRequest(McpSchema.JSONRPC_VERSION, "m", null, null))
			.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> new JSONRPCRequest(McpSchema.JSONRPC_VERSION, "m", 1.5, null))
			.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void initializeRequestSerializesEmptyCapabilities() throws IOException {
		String json = mapper.writeValueAsString(new McpSchema.InitializeRequest(McpSchema.PROTOCOL_VERSION,
				McpSchema.ClientCapabilities.empty(), new McpSchema.Implementation("client", "1.0.0")));

		assertThat(mapper.readValue(json, Map.class)).isEqualTo(Map.of("protocolVersion", "2024-11-05",
				"capabilities", Map.of(), "clientInfo", Map.of("name", "client", "version", "1.0.0")));
	}

	@Test
	void callToolRequestDefaultsArguments() throws IOException {
		String json = mapper.writeValueAsString(new McpSchema.CallToolRequest("search", null));

		assertThat(json).contains("\"arguments\":{}");
	}

	@Test
	void toolDescriptorsIgnoreUnknownFields() {
		McpSchema.ListToolsResult result = mapper.convertValue(Map.of("tools",
				List.of(Map.of("name", "read_file", "description", "Reads a file", "title", "Read", "inputSchema",
						Map.of("type", "object", "properties", Map.of("path", Map.of("type", "string")), "required",
								List.of("path"))))),
				McpSchema.ListToolsResult.class);

		assertThat(result.nextCursor()).isNull();
		assertThat(result.tools()).singleElement().satisfies(tool -> {
			assertThat(tool.name()).isEqualTo("read_file");
			assertThat(tool.inputSchema().required()).containsExactly("path");
			assertThat(tool.inputSchema().properties()).containsKey("path");
		});
	}

	@Test
	void toolSchemasKeepObjectAdditionalPropertiesAndDefinitions() {
		McpSchema.ListToolsResult result = mapper.convertValue(Map.of("tools", List.of(
				Map.of("name", "tag", "inputSchema",
						Map.of("type", "object", "properties", Map.of(), "additionalProperties",
								Map.of("type", "string"))),
				Map.of("name", "move", "inputSchema",
						Map.of("type", "object", "properties", Map.of("target", Map.of("$ref", "#/$defs/Point")),
								"$defs", Map.of("Point", Map.of("type", "object")), "definitions",
								Map.of("Legacy", Map.of("type", "string")))))),
				McpSchema.ListToolsResult.class);

		assertThat(result.tools().get(0).inputSchema().additionalProperties()).isEqualTo(Map.of("type", "string"));
		McpSchema.JsonSchema move = result.tools().get(1).inputSchema();
		assertThat(move.defs()).isEqualTo(Map.of("Point", Map.of("type", "object")));
		assertThat(move.definitions()).isEqualTo(Map.of("Legacy", Map.of("type", "string")));
		Map<String, Object> written = mapper.convertValue(move, new TypeRef<Map<String, Object>>() {
		});
		assertThat(written).containsKeys("$defs", "definitions");
	}

	@Test
	void booleanAdditionalPropertiesStillBinds() {
		McpSchema.JsonSchema schema = mapper.convertValue(Map.of("type", "object", "additionalProperties", false),
				McpSchema.JsonSchema.class);

		assertThat(schema.additionalProperties()).isEqualTo(false);
	}

	@Test
	void callToolResultJoinsTextContent() {
		McpSchema.CallToolResult result = mapper.convertValue(
				Map.of("content",
						List.of(Map.of("type", "text", "text", "first"), Map.of("type", "image", "data", "AAAA"),
								Map.of("type", "text", "text", "second"))),
				McpSchema.CallToolResult.class);

		assertThat(result.text()).isEqualTo("first\nsecond");
		assertThat(result.isError()).isNull();
	}

	@Test
	void loggingNotificationAcceptsStructuredData() {
		McpSchema.LoggingMessageNotification notification = mapper.convertValue(
				Map.of("level", "warning", "data", Map.of("detail", "disk almost full")),
				McpSchema.LoggingMessageNotification.class);

		assertThat(notification.level()).isEqualTo(McpSchema.LoggingLevel.WARNING);
		assertThat(notification.data()).isEqualTo(Map.of("detail", "disk almost full"));
	}

}
