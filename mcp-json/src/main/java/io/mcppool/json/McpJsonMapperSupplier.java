/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.json;

import java.util.function.Supplier;

/**
 * Service provider interface for {@link McpJsonMapper} implementations. Implementations
 * are registered in {@code META-INF/services/io.mcppool.json.McpJsonMapperSupplier}.
 */
public interface McpJsonMapperSupplier extends Supplier<McpJsonMapper> {

}
