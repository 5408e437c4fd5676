/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

import io.latchkey.auth.OAuthToken;
import io.latchkey.util.Assert;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Reactive facade over a {@link TokenRefresher}. The blocking refresh work runs on
 * {@link Schedulers#boundedElastic()} unless another scheduler is given.
 */
public class AsyncTokenRefresher {

	private final TokenRefresher delegate;

	private final Scheduler scheduler;

	public AsyncTokenRefresher(TokenRefresher delegate) {
		this(delegate, Schedulers.boundedElastic());
	}

	public AsyncTokenRefresher(TokenRefresher delegate, Scheduler scheduler) {
		Assert.notNull(delegate, "delegate must not be null");
		Assert.notNull(scheduler, "scheduler must not be null");
		this.delegate = delegate;
		this.scheduler = scheduler;
	}

	/**
	 * @param key the token key
	 * @return a {@link Mono} emitting the token, refreshed first if it has expired
	 * @see TokenRefresher#ensureFresh(String)
	 */
	public Mono<OAuthToken> ensureFresh(String key) {
		return Mono.fromCallable(() -> delegate.ensureFresh(key)).subscribeOn(scheduler);
	}

	public Mono<OAuthToken> getValidTokenWithThreshold(String key, double threshold) {
		return Mono.fromCallable(() -> delegate.getValidTokenWithThreshold(key, threshold)).subscribeOn(scheduler);
	}

	public Mono<OAuthToken> forceRefresh(String key) {
		return Mono.fromCallable(() -> delegate.forceRefresh(key)).subscribeOn(scheduler);
	}

}
