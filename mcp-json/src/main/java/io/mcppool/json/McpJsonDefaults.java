/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.json;

import java.util.ServiceLoader;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Resolves the default {@link McpJsonMapper} from the classpath. The first
 * {@link McpJsonMapperSupplier} found by {@link ServiceLoader} that produces a mapper
 * wins, and the result is cached for the lifetime of the class loader.
 */
public final class McpJsonDefaults {

	private static volatile McpJsonMapper defaultMapper;

	private McpJsonDefaults() {
	}

	/**
	 * Returns the shared default mapper, loading it on first use.
	 * @return the default {@link McpJsonMapper}
	 * @throws IllegalStateException if no implementation is available on the classpath
	 */
	public static McpJsonMapper getMapper() {
		McpJsonMapper mapper = defaultMapper;
		if (mapper == null) {
			synchronized (McpJsonDefaults.class) {
				mapper = defaultMapper;
				if (mapper == null) {
					mapper = createDefault();
					defaultMapper = mapper;
				}
			}
		}
		return mapper;
	}

	/**
	 * Creates a new mapper from the first working {@link McpJsonMapperSupplier}.
	 * @return a new {@link McpJsonMapper}
	 * @throws IllegalStateException if no supplier is registered or every supplier failed
	 */
	public static McpJsonMapper createDefault() {
		AtomicReference<IllegalStateException> ex = new AtomicReference<>();
		return ServiceLoader.load(McpJsonMapperSupplier.class).stream().flatMap(provider -> {
			try {
				return Stream.ofNullable(provider.get());
			}
			catch (Exception e) {
				addException(ex, e);
				return Stream.empty();
			}
		}).flatMap(supplier -> {
			try {
				return Stream.ofNullable(supplier.get());
			}
			catch (Exception e) {
				addException(ex, e);
				return Stream.empty();
			}
		}).findFirst().orElseThrow(() -> {
			if (ex.get() != null) {
				return ex.get();
			}
			return new IllegalStateException("No default McpJsonMapper implementation found");
		});
	}

	private static void addException(AtomicReference<IllegalStateException> ref, Exception toAdd) {
		ref.updateAndGet(existing -> {
			if (existing == null) {
				return new IllegalStateException("Failed to initialize default McpJsonMapper", toAdd);
			}
			existing.addSuppressed(toAdd);
			return existing;
		});
	}

}
