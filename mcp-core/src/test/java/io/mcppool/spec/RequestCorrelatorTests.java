/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.mcppool.spec;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import io.mcppool.spec.McpSchema.JSONRPCResponse;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestCorrelatorTests {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private final RequestCorrelator correlator = new RequestCorrelator();

	private static JSONRPCResponse response(Object id, Object result) {
		return new JSONRPCResponse(McpSchema.JSONRPC_VERSION, id, result, null);
	}

	@Test
	void deliversResponseToMatchingWaiter() {
		correlator.register("a-1");

		StepVerifier.create(correlator.await("a-1", TIMEOUT))
			.then(() -> assertThat(correlator.deposit("a-1", response("a-1", "payload"))).isTrue())
			.assertNext(response -> assertThat(response.result()).isEqualTo("payload"))
			.verifyComplete();

		assertThat(correlator.pendingCount()).isZero();
	}

	@Test
	void responseDepositedBeforeAwaitIsNotLost() {
		correlator.register("a-1");
		correlator.deposit("a-1", response("a-1", "early"));

		StepVerifier.create(correlator.await("a-1", TIMEOUT))
			.assertNext(response -> assertThat(response.result()).isEqualTo("early"))
			.verifyComplete();
	}

	@Test
	void numericIdMatchesStringRegistration() {
		correlator.register("7");

		StepVerifier.create(correlator.await("7", TIMEOUT))
			.then(() -> correlator.deposit(7, response(7, "numeric")))
			.assertNext(response -> assertThat(response.result()).isEqualTo("numeric"))
			.verifyComplete();
	}

	@Test
	void outOfOrderResponsesReachTheirOwnWaiters() {
		List<String> ids = List.of("r-0", "r-1", "r-2", "r-3");
		ids.forEach(correlator::register);

		Mono<List<Object>> results = Flux.fromIterable(ids)
			.flatMapSequential(id -> correlator.await(id, TIMEOUT).map(JSONRPCResponse::result))
			.collectList();

		StepVerifier.create(results).then(() -> {
			for (int i = ids.size() - 1; i >= 0; i--) {
				correlator.deposit(ids.get(i), response(ids.get(i), "result of " + ids.get(i)));
			}
		})
			.assertNext(list -> assertThat(list).containsExactly("result of r-0", "result of r-1", "result of r-2",
					"result of r-3"))
			.verifyComplete();
	}

	@Test
	void timeoutRemovesEntryAndLateResponseIsDropped() {
		correlator.register("slow");
		correlator.register("other");

		StepVerifier.create(correlator.await("slow", Duration.ofMillis(100)))
			.expectError(TimeoutException.class)
			.verify(TIMEOUT);

		assertThat(correlator.isPending("slow")).isFalse();
		assertThat(correlator.deposit("slow", response("slow", "late"))).isFalse();

		assertThat(correlator.isPending("other")).isTrue();
		StepVerifier.create(correlator.await("other", TIMEOUT))
			.then(() -> correlator.deposit("other", response("other", "fine")))
			.assertNext(response -> assertThat(response.result()).isEqualTo("fine"))
			.verifyComplete();
	}

	@Test
	void unknownIdsAreDropped() {
		assertThat(correlator.deposit("never-sent", response("never-sent", "x"))).isFalse();
		assertThat(correlator.deposit(null, response(null, "x"))).isFalse();
		assertThat(correlator.pendingCount()).isZero();
	}

	@Test
	void duplicateRegistrationIsRejected() {
		correlator.register("dup");

		assertThatThrownBy(() -> correlator.register("dup")).isInstanceOf(IllegalStateException.class)
			.hasMessageContaining("dup");
	}

	@Test
	void failAllFailsEveryWaiterAndEmptiesTable() {
		correlator.register("x");
		correlator.register("y");
		Mono<JSONRPCResponse> x = correlator.await("x", TIMEOUT);
		Mono<JSONRPCResponse> y = correlator.await("y", TIMEOUT);

		assertThat(correlator.failAll(new McpProcessExitedException("gone", 1))).isEqualTo(2);

		StepVerifier.create(x).expectError(McpProcessExitedException.class).verify(TIMEOUT);
		StepVerifier.create(y).expectError(McpProcessExitedException.class).verify(TIMEOUT);
		assertThat(correlator.pendingCount()).isZero();
	}

	@Test
	void abandonRemovesEntry() {
		correlator.register("broken");

		correlator.abandon("broken");

		assertThat(correlator.isPending("broken")).isFalse();
		StepVerifier.create(correlator.await("broken", TIMEOUT)).expectError(IllegalStateException.class).verify();
	}

	@Test
	void concurrentRequestsAreNeverCrossDelivered() {
		RequestIdGenerator ids = RequestIdGenerator.ofDefault();
		int count = 200;

		List<Boolean> matches = Flux.range(0, count).flatMap(i -> Mono.fromCallable(() -> {
			String id = ids.generate();
			correlator.register(id);
			Schedulers.parallel().schedule(() -> correlator.deposit(id, response(id, id)));
			return correlator.await(id, TIMEOUT).map(response -> id.equals(response.result())).block();
		}).subscribeOn(Schedulers.boundedElastic())).collectList().block(TIMEOUT.multipliedBy(2));

		assertThat(matches).hasSize(count).containsOnly(true);
		assertThat(correlator.pendingCount()).isZero();
	}

}
