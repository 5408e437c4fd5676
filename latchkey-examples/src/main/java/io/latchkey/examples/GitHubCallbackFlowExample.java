/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.examples;

import io.latchkey.auth.OAuthToken;
import io.latchkey.client.auth.OAuthClient;
import io.latchkey.spec.OAuthException;

/**
 * Signs in to GitHub with the authorization code flow, receiving the redirect on a
 * loopback listener.
 * <p>
 * GitHub requires the client secret for the code exchange, so set both
 * {@code GITHUB_CLIENT_ID} and {@code GITHUB_CLIENT_SECRET}. The app's callback URL must
 * be {@code http://127.0.0.1/callback}; GitHub accepts any port for loopback redirects.
 */
public class GitHubCallbackFlowExample {

	public static void main(String[] args) {
		try {
			OAuthClient client = ExampleSupport.githubClient();
			OAuthToken token = client.authorize();
			client.saveToken(ExampleSupport.TOKEN_KEY, token);
			System.out.println("Signed in. Token type: " + token.getTokenType());
		}
		catch (OAuthException | IllegalStateException e) {
			ExampleSupport.fail("Authorization", e);
		}
	}

}
