/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.examples;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;

import io.latchkey.auth.OAuthToken;
import io.latchkey.client.auth.HttpClientAuthenticator;
import io.latchkey.client.auth.TokenRefresher;
import io.latchkey.spec.OAuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Uses a stored token to call an API, refreshing it once 80% of its lifetime has passed
 * and retrying once after a {@code 401}.
 * <p>
 * Several copies of this program can run at the same time: the file lock makes sure only
 * one of them refreshes, and the others pick up the refreshed token. Sign in first with
 * {@link GitHubDeviceFlowExample}.
 */
public class TokenRefreshExample {

	private static final Logger logger = LoggerFactory.getLogger(TokenRefreshExample.class);

	private static final String DEFAULT_API_URL = "https://api.github.com/user";

	private static final double REFRESH_THRESHOLD = 0.8;

	public static void main(String[] args) {
		String apiUrl = args.length > 0 ? args[0] : DEFAULT_API_URL;
		try {
			TokenRefresher refresher = TokenRefresher.withFileLocking(ExampleSupport.githubClient(),
					ExampleSupport.APP_NAME);

			OAuthToken token = refresher.getValidTokenWithThreshold(ExampleSupport.TOKEN_KEY, REFRESH_THRESHOLD);
			if (token.getExpiresAt() != null) {
				System.out.println("Token valid until " + Instant.ofEpochSecond(token.getExpiresAt()));
			}
			else {
				System.out.println("Token does not expire");
			}

			HttpClientAuthenticator authenticator = new HttpClientAuthenticator(refresher, ExampleSupport.TOKEN_KEY);
			HttpResponse<String> response = call(authenticator, apiUrl);
			if (authenticator.handleResponse(response.statusCode())) {
				logger.info("Token was rejected, retrying with a refreshed one");
				response = call(authenticator, apiUrl);
			}
			System.out.println("GET " + apiUrl + " -> " + response.statusCode());
			System.out.println(response.body());
		}
		catch (OAuthException | IllegalStateException | IOException e) {
			ExampleSupport.fail("API call", e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			ExampleSupport.fail("API call", e);
		}
	}

	private static HttpResponse<String> call(HttpClientAuthenticator authenticator, String url)
			throws IOException, InterruptedException {
		HttpRequest request = authenticator
			.authenticate(HttpRequest.newBuilder(URI.create(url)).header("Accept", "application/json"))
			.GET()
			.build();
		return HttpClient.newHttpClient().send(request, HttpResponse.BodyHandlers.ofString());
	}

}
