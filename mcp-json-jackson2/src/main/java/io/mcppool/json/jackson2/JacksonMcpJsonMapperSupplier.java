/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.json.jackson2;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import io.mcppool.json.McpJsonMapper;
import io.mcppool.json.McpJsonMapperSupplier;

/**
 * A supplier of {@link McpJsonMapper} instances backed by Jackson 2.
 * <p>
 * The mapper tolerates unknown properties, because tool-provider servers routinely add
 * fields newer than the schema this client was written against, and never emits line
 * breaks, because every outbound message must fit on one line of the stdio stream.
 */
public class JacksonMcpJsonMapperSupplier implements McpJsonMapperSupplier {

	@Override
	public McpJsonMapper get() {
		return new JacksonMcpJsonMapper(createObjectMapper());
	}

	/**
	 * Creates the {@link ObjectMapper} used by the default mapper.
	 * <p>
	 * The {@link ParameterNamesModule} discovers record constructor parameter names from
	 * bytecode, which relies on the {@code -parameters} compiler flag set in the parent
	 * pom.xml.
	 * @return a configured ObjectMapper
	 */
	static ObjectMapper createObjectMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.addModule(new ParameterNamesModule())
			.build();
	}

}
