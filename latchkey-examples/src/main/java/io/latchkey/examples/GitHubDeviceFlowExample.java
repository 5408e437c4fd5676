/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.examples;

import io.latchkey.auth.OAuthToken;
import io.latchkey.client.auth.OAuthClient;
import io.latchkey.spec.OAuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Signs in to GitHub with the device flow and stores the token.
 * <p>
 * Run with {@code GITHUB_CLIENT_ID} set to an OAuth app that has the device flow
 * enabled.
 */
public class GitHubDeviceFlowExample {

	private static final Logger logger = LoggerFactory.getLogger(GitHubDeviceFlowExample.class);

	public static void main(String[] args) {
		try {
			OAuthClient client = ExampleSupport.githubClient();
			OAuthToken token = client.authorizeDevice();
			client.saveToken(ExampleSupport.TOKEN_KEY, token);
			logger.info("Stored token under {}", ExampleSupport.TOKEN_KEY);
			System.out.println("Signed in. Scope: " + token.getScope());
		}
		catch (OAuthException | IllegalStateException e) {
			ExampleSupport.fail("Device authorization", e);
		}
	}

}
