/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.client;

import java.util.function.Function;

import io.mcppool.util.Assert;

/**
 * The outcome of a session or pool operation: a value on success, an {@link McpFailure}
 * otherwise. Operations return failures instead of throwing them.
 *
 * @param <T> the type of the success value
 */
public final class McpResult<T> {

	private final T value;

	private final McpFailure failure;

	private McpResult(T value, McpFailure failure) {
		this.value = value;
		this.failure = failure;
	}

	public static <T> McpResult<T> success(T value) {
		return new McpResult<>(value, null);
	}

	public static <T> McpResult<T> failure(McpFailure failure) {
		Assert.notNull(failure, "Failure must not be null");
		return new McpResult<>(null, failure);
	}

	public static <T> McpResult<T> failure(McpFailure.Kind kind, String message) {
		return failure(McpFailure.of(kind, message));
	}

	public boolean isSuccess() {
		return this.failure == null;
	}

	public boolean isFailure() {
		return this.failure != null;
	}

	/**
	 * Returns the success value.
	 * @return the value, possibly {@code null} for operations without one
	 * @throws IllegalStateException if this result is a failure
	 */
	public T value() {
		if (this.failure != null) {
			throw new IllegalStateException("No value present: " + this.failure.message(), this.failure.cause());
		}
		return this.value;
	}

	/**
	 * Returns the failure.
	 * @return the failure
	 * @throws IllegalStateException if this result is a success
	 */
	public McpFailure failure() {
		if (this.failure == null) {
			throw new IllegalStateException("Result is a success");
		}
		return this.failure;
	}

	public T orElse(T other) {
		return this.failure == null ? this.value : other;
	}

	public <R> McpResult<R> map(Function<? super T, ? extends R> mapper) {
		if (this.failure != null) {
			return failure(this.failure);
		}
		return success(mapper.apply(this.value));
	}

	public <R> McpResult<R> flatMap(Function<? super T, McpResult<R>> mapper) {
		if (this.failure != null) {
			return failure(this.failure);
		}
		return mapper.apply(this.value);
	}

	/**
	 * Casts a failed result to another value type.
	 * @param <R> the new value type
	 * @return this failure as a result of the new type
	 * @throws IllegalStateException if this result is a success
	 */
	public <R> McpResult<R> asFailure() {
		return failure(failure());
	}

	@Override
	public String toString() {
		return this.failure == null ? "McpResult[success=" + this.value + "]"
				: "McpResult[failure=" + this.failure.kind() + ": " + this.failure.message() + "]";
	}

}
