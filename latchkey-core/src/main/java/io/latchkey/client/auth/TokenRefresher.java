/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.function.Predicate;

import io.latchkey.auth.OAuthToken;
import io.latchkey.client.lock.RefreshLockManager;
import io.latchkey.client.storage.CredentialStore;
import io.latchkey.spec.OAuthException;
import io.latchkey.spec.OAuthStateException;
import io.latchkey.util.Assert;
import io.latchkey.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.util.annotation.Nullable;

/**
 * Keeps stored tokens fresh, calling the token endpoint at most once per key no matter
 * how many callers ask at the same time.
 * <p>
 * Within this refresher, concurrent refreshes of one key are merged: the first caller
 * refreshes and the others wait for its result, or its failure. With a
 * {@link RefreshLockManager} the refresh additionally runs under a file lock for the
 * key, and the stored token is read again once the lock is held, so a process that
 * waited while another one refreshed returns that token instead of refreshing again.
 *
 * @see AsyncTokenRefresher
 */
public class TokenRefresher {

	private static final Logger logger = LoggerFactory.getLogger(TokenRefresher.class);

	private final OAuthClient client;

	private final CredentialStore store;

	@Nullable
	private final RefreshLockManager lockManager;

	private final Clock clock;

	private final ConcurrentMap<String, CompletableFuture<OAuthToken>> inFlight = new ConcurrentHashMap<>();

	private TokenRefresher(Builder builder) {
		this.client = builder.client;
		this.store = builder.client.getCredentialStore();
		this.lockManager = builder.lockManager;
		this.clock = builder.clock != null ? builder.clock : builder.client.getClock();
	}

	public static Builder builder(OAuthClient client) {
		return new Builder(client);
	}

	/**
	 * Creates a refresher that merges refreshes within this instance only.
	 * @param client the client performing the refresh grant
	 * @return the refresher
	 */
	public static TokenRefresher create(OAuthClient client) {
		return builder(client).build();
	}

	public static TokenRefresher withLockManager(OAuthClient client, RefreshLockManager lockManager) {
		return builder(client).lockManager(lockManager).build();
	}

	/**
	 * Creates a refresher coordinating with other processes of the same application
	 * through {@link RefreshLockManager#forApp(String)}.
	 * @param client the client performing the refresh grant
	 * @param appName the application name
	 * @return the refresher
	 */
	public static TokenRefresher withFileLocking(OAuthClient client, String appName) {
		return withLockManager(client, RefreshLockManager.forApp(appName));
	}

	/**
	 * Returns the stored token, refreshing it first if it has expired.
	 * @param key the token key
	 * @return a token that was not expired when it was read or issued
	 * @throws OAuthStateException of kind {@code TOKEN_NOT_FOUND} or
	 * {@code NO_REFRESH_TOKEN}
	 */
	public OAuthToken ensureFresh(String key) {
		OAuthToken token = loadToken(key);
		if (!isExpired(token)) {
			return token;
		}
		return refresh(key, this::isExpired);
	}

	/**
	 * Returns the stored token, refreshing it once the given fraction of its lifetime has
	 * elapsed. Tokens without a known lifetime are only refreshed once expired.
	 * @param key the token key
	 * @param threshold fraction of the lifetime, clamped into {@code [0, 1]}
	 * @return the token
	 */
	public OAuthToken getValidTokenWithThreshold(String key, double threshold) {
		double clamped = clampThreshold(threshold);
		OAuthToken token = loadToken(key);
		if (!needsRefresh(token, clamped)) {
			return token;
		}
		return refresh(key, current -> needsRefresh(current, clamped));
	}

	/**
	 * Refreshes the token for a key. Within this process the refresh is unconditional;
	 * under a file lock the stored token is refreshed only if it is still expired once
	 * the lock is held.
	 * @param key the token key
	 * @return the refreshed token, or the token another process stored meanwhile
	 */
	public OAuthToken refreshTokenForKey(String key) {
		Predicate<OAuthToken> stillNeeded = lockManager != null ? this::isExpired : current -> true;
		return refresh(key, stillNeeded);
	}

	/**
	 * Refreshes the token for a key even if it looks valid, for instance after the
	 * resource server answered {@code 401}. Still merged with concurrent refreshes.
	 * @param key the token key
	 * @return the refreshed token
	 */
	public OAuthToken forceRefresh(String key) {
		return refresh(key, current -> true);
	}

	/**
	 * Waits for a refresh of the key that is currently running, if any, then returns the
	 * stored token.
	 * @param key the token key
	 * @return the stored token
	 */
	public OAuthToken awaitRefresh(String key) {
		CompletableFuture<OAuthToken> running = inFlight.get(key);
		if (running != null) {
			return await(key, running);
		}
		return loadToken(key);
	}

	/**
	 * Returns the stored token without refreshing it.
	 * @param key the token key
	 * @return the token
	 * @throws OAuthStateException of kind {@code TOKEN_EXPIRED} if it has expired
	 */
	public OAuthToken currentToken(String key) {
		OAuthToken token = loadToken(key);
		if (isExpired(token)) {
			throw OAuthStateException.tokenExpired(key);
		}
		return token;
	}

	public boolean isRefreshing(String key) {
		return inFlight.containsKey(key);
	}

	private OAuthToken refresh(String key, Predicate<OAuthToken> stillNeeded) {
		CompletableFuture<OAuthToken> leader = new CompletableFuture<>();
		CompletableFuture<OAuthToken> running = inFlight.putIfAbsent(key, leader);
		if (running != null) {
			logger.debug("Waiting for running refresh of {}", key);
			return await(key, running);
		}
		try {
			OAuthToken token = lockManager != null
					? lockManager.withLock(key, () -> checkThenRefresh(key, stillNeeded))
					: checkThenRefresh(key, stillNeeded);
			leader.complete(token);
			return token;
		}
		catch (RuntimeException | Error e) {
			leader.completeExceptionally(e);
			throw e;
		}
		finally {
			inFlight.remove(key, leader);
		}
	}

	private OAuthToken checkThenRefresh(String key, Predicate<OAuthToken> stillNeeded) {
		OAuthToken current = loadToken(key);
		if (!stillNeeded.test(current)) {
			logger.debug("Token for {} was refreshed meanwhile", key);
			return current;
		}
		if (!Utils.hasText(current.getRefreshToken())) {
			throw OAuthStateException.noRefreshToken(key);
		}
		logger.info("Refreshing token for {}", key);
		OAuthToken refreshed = client.refreshToken(current.getRefreshToken());
		store.saveToken(key, refreshed);
		return refreshed;
	}

	private OAuthToken await(String key, CompletableFuture<OAuthToken> running) {
		try {
			return running.get();
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException runtimeException) {
				throw runtimeException;
			}
			if (cause instanceof Error error) {
				throw error;
			}
			throw new OAuthException("Refresh of " + key + " failed", cause);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new OAuthException("Interrupted while waiting for refresh of " + key, e);
		}
	}

	private OAuthToken loadToken(String key) {
		Assert.hasText(key, "key must not be empty");
		return store.getToken(key).orElseThrow(() -> OAuthStateException.tokenNotFound(key));
	}

	private boolean isExpired(OAuthToken token) {
		return token.isExpired(clock);
	}

	boolean needsRefresh(OAuthToken token, double threshold) {
		if (isExpired(token)) {
			return true;
		}
		Long expiresAt = token.getExpiresAt();
		Long expiresIn = token.getExpiresIn();
		if (expiresAt == null || expiresIn == null || expiresIn <= 0) {
			return false;
		}
		long remaining = Math.max(0, expiresAt - clock.instant().getEpochSecond());
		double elapsed = (double) (expiresIn - remaining) / expiresIn;
		return elapsed >= threshold;
	}

	static double clampThreshold(double threshold) {
		if (Double.isNaN(threshold)) {
			return 1.0;
		}
		return Math.max(0.0, Math.min(1.0, threshold));
	}

	/**
	 * Builder for {@link TokenRefresher}.
	 */
	public static class Builder {

		private final OAuthClient client;

		private RefreshLockManager lockManager;

		private Clock clock;

		private Builder(OAuthClient client) {
			Assert.notNull(client, "client must not be null");
			this.client = client;
		}

		/**
		 * Enables cross-process coordination through file locks.
		 * @param lockManager the lock manager
		 * @return this builder
		 */
		public Builder lockManager(RefreshLockManager lockManager) {
			this.lockManager = lockManager;
			return this;
		}

		/**
		 * Sets the clock for expiry checks. Defaults to the client's clock.
		 * @param clock the clock
		 * @return this builder
		 */
		public Builder clock(Clock clock) {
			Assert.notNull(clock, "clock must not be null");
			this.clock = clock;
			return this;
		}

		public TokenRefresher build() {
			return new TokenRefresher(this);
		}

	}

}
