/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.transport;

/**
 * Raw response of a form POST: the HTTP status code and the body as text.
 *
 * @param statusCode the HTTP status code
 * @param body the response body, never {@code null}
 */
public record HttpFormResponse(int statusCode, String body) {

	public HttpFormResponse {
		body = body == null ? "" : body;
	}

	public boolean isSuccess() {
		return statusCode >= 200 && statusCode < 300;
	}

}
