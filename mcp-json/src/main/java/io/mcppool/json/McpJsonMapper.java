/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.json;

import java.io.IOException;

/**
 * Abstraction for JSON serialization and deserialization so the stdio client does not
 * depend on a specific JSON library. The Jackson 2 backed implementation lives in the
 * {@code mcp-json-jackson2} module and is discovered through {@link McpJsonDefaults}.
 */
public interface McpJsonMapper {

	/**
	 * Deserialize a JSON document into a target type.
	 * @param content JSON text
	 * @param type target class
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException when the text is not valid JSON or does not bind to the type
	 */
	<T> T readValue(String content, Class<T> type) throws IOException;

	/**
	 * Deserialize a JSON document into a parameterized target type.
	 * @param content JSON text
	 * @param type parameterized type reference
	 * @return deserialized instance
	 * @param <T> generic type
	 * @throws IOException when the text is not valid JSON or does not bind to the type
	 */
	<T> T readValue(String content, TypeRef<T> type) throws IOException;

	/**
	 * Convert an already decoded value (maps, lists, scalars) to a given type.
	 * @param fromValue source value
	 * @param type target class
	 * @return converted value
	 * @param <T> generic type
	 * @throws IllegalArgumentException when the value cannot be converted
	 */
	<T> T convertValue(Object fromValue, Class<T> type);

	/**
	 * Convert an already decoded value to a given parameterized type.
	 * @param fromValue source value
	 * @param type target type reference
	 * @return converted value
	 * @param <T> generic type
	 * @throws IllegalArgumentException when the value cannot be converted
	 */
	<T> T convertValue(Object fromValue, TypeRef<T> type);

	/**
	 * Serialize an object to a single-line JSON string.
	 * @param value object to serialize
	 * @return JSON text without line breaks
	 * @throws IOException on serialization errors
	 */
	String writeValueAsString(Object value) throws IOException;

	/**
	 * Serialize an object to indented JSON, used for files meant to be read by people.
	 * @param value object to serialize
	 * @return indented JSON text
	 * @throws IOException on serialization errors
	 */
	String writeValueAsPrettyString(Object value) throws IOException;

}
