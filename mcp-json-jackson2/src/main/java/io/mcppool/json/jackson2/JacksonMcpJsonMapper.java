/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.json.jackson2;

import java.io.IOException;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mcppool.json.McpJsonMapper;
import io.mcppool.json.TypeRef;

/**
 * Jackson 2 based implementation of {@link McpJsonMapper}.
 */
public final class JacksonMcpJsonMapper implements McpJsonMapper {

	private final ObjectMapper objectMapper;

	/**
	 * Constructs a new mapper delegating to the given {@link ObjectMapper}.
	 * @param objectMapper the Jackson mapper to use, must not be null
	 */
	public JacksonMcpJsonMapper(ObjectMapper objectMapper) {
		if (objectMapper == null) {
			throw new IllegalArgumentException("ObjectMapper must not be null");
		}
		this.objectMapper = objectMapper;
	}

	/**
	 * Returns the underlying Jackson {@link ObjectMapper}.
	 * @return the object mapper
	 */
	public ObjectMapper getObjectMapper() {
		return this.objectMapper;
	}

	@Override
	public <T> T readValue(String content, Class<T> type) throws IOException {
		return this.objectMapper.readValue(content, type);
	}

	@Override
	public <T> T readValue(String content, TypeRef<T> type) throws IOException {
		return this.objectMapper.readValue(content, javaType(type));
	}

	@Override
	public <T> T convertValue(Object fromValue, Class<T> type) {
		return this.objectMapper.convertValue(fromValue, type);
	}

	@Override
	public <T> T convertValue(Object fromValue, TypeRef<T> type) {
		return this.objectMapper.convertValue(fromValue, javaType(type));
	}

	@Override
	public String writeValueAsString(Object value) throws IOException {
		return this.objectMapper.writeValueAsString(value);
	}

	@Override
	public String writeValueAsPrettyString(Object value) throws IOException {
		return this.objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
	}

	private JavaType javaType(TypeRef<?> type) {
		return this.objectMapper.getTypeFactory().constructType(type.getType());
	}

}
