/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.transport;

import java.util.Map;

/**
 * Sends {@code application/x-www-form-urlencoded} requests to authorization server
 * endpoints. Implementations ask for JSON responses and return any status code to the
 * caller; only failures to get a response at all are reported as exceptions.
 */
@FunctionalInterface
public interface OAuthHttpTransport {

	/**
	 * POST a form to an endpoint.
	 * @param url the endpoint URL
	 * @param form the form parameters, encoded in iteration order
	 * @return the response
	 * @throws io.latchkey.spec.OAuthTransportException if no response was received
	 */
	HttpFormResponse postForm(String url, Map<String, String> form);

}
