/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.examples;

import io.latchkey.client.auth.OAuthClient;
import io.latchkey.client.auth.OAuthConfig;
import io.latchkey.client.storage.FileCredentialStore;

/**
 * Shared settings of the examples.
 */
final class ExampleSupport {

	static final String APP_NAME = "latchkey-examples";

	static final String TOKEN_KEY = "github.com:default";

	static final String SCOPE = "read:user";

	private ExampleSupport() {
	}

	/**
	 * Builds a GitHub client from {@code GITHUB_CLIENT_ID} and the optional
	 * {@code GITHUB_CLIENT_SECRET}, storing credentials in the user's data directory.
	 */
	static OAuthClient githubClient() {
		String clientId = System.getenv("GITHUB_CLIENT_ID");
		if (clientId == null || clientId.isBlank()) {
			throw new IllegalStateException("Set GITHUB_CLIENT_ID to the client id of a GitHub OAuth app");
		}
		OAuthConfig.Builder config = OAuthConfig.github(clientId).scope(SCOPE);
		String clientSecret = System.getenv("GITHUB_CLIENT_SECRET");
		if (clientSecret != null && !clientSecret.isBlank()) {
			config.clientSecret(clientSecret);
		}
		return OAuthClient.builder(config.build(), FileCredentialStore.forApp(APP_NAME))
			.sessionDomain("github.com")
			.build();
	}

	static void fail(String action, Exception e) {
		System.err.println(action + " failed: " + e.getMessage());
		System.exit(1);
	}

}
