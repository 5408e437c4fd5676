/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

import java.net.http.HttpRequest;

import io.latchkey.auth.OAuthToken;
import io.latchkey.util.Assert;

/**
 * Authenticator for {@link java.net.http.HttpClient} requests using a stored OAuth
 * token.
 */
public class HttpClientAuthenticator {

	private static final int UNAUTHORIZED = 401;

	private final TokenRefresher refresher;

	private final String key;

	/**
	 * Creates a new HttpClientAuthenticator.
	 * @param refresher the refresher keeping the token fresh
	 * @param key the key of the token to send
	 */
	public HttpClientAuthenticator(TokenRefresher refresher, String key) {
		Assert.notNull(refresher, "refresher must not be null");
		Assert.hasText(key, "key must not be empty");
		this.refresher = refresher;
		this.key = key;
	}

	/**
	 * Authenticate an HTTP request by adding an Authorization header with a fresh access
	 * token.
	 * @param requestBuilder the HTTP request builder
	 * @return the same request builder
	 */
	public HttpRequest.Builder authenticate(HttpRequest.Builder requestBuilder) {
		OAuthToken token = refresher.ensureFresh(key);
		return requestBuilder.setHeader("Authorization", "Bearer " + token.getAccessToken());
	}

	/**
	 * Handle an HTTP response, refreshing the token if it was rejected.
	 * @param statusCode the HTTP status code
	 * @return {@code true} if the token was refreshed and the request should be retried
	 */
	public boolean handleResponse(int statusCode) {
		if (statusCode == UNAUTHORIZED) {
			refresher.forceRefresh(key);
			return true;
		}
		return false;
	}

}
