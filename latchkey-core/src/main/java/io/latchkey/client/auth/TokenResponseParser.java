/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

import java.time.Clock;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.latchkey.auth.OAuthErrorResponse;
import io.latchkey.auth.OAuthToken;
import io.latchkey.client.transport.HttpFormResponse;
import io.latchkey.spec.AuthorizationDeniedException;
import io.latchkey.spec.OAuthException;
import io.latchkey.spec.OAuthProtocolException;
import io.latchkey.spec.OAuthStateException;
import io.latchkey.spec.OAuthTransportException;
import reactor.util.annotation.Nullable;

/**
 * Reads token, device authorization and error responses of the authorization server.
 */
final class TokenResponseParser {

	static final String ACCESS_DENIED = "access_denied";

	private final ObjectMapper objectMapper;

	private final Clock clock;

	TokenResponseParser(ObjectMapper objectMapper, Clock clock) {
		this.objectMapper = objectMapper;
		this.clock = clock;
	}

	/**
	 * Returns the {@code error} body of a response. A successful status with an
	 * {@code error} member counts as an error too.
	 * @param response the response
	 * @return the error, or {@code null} for a successful response
	 * @throws OAuthTransportException for a non-success status without a decodable error
	 */
	@Nullable
	OAuthErrorResponse readError(HttpFormResponse response) {
		JsonNode node;
		try {
			node = objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			if (response.isSuccess()) {
				throw new OAuthTransportException("Undecodable response body", response.statusCode(), e);
			}
			throw new OAuthTransportException("Unexpected error response", response.statusCode(), e);
		}
		if (node != null && node.isObject() && node.hasNonNull("error")) {
			return new OAuthErrorResponse(node.get("error").asText(), textOrNull(node, "error_description"));
		}
		if (!response.isSuccess()) {
			throw new OAuthTransportException("Unexpected error response", response.statusCode());
		}
		return null;
	}

	/**
	 * Converts a token endpoint response into a token, stamping {@code expires_at}.
	 * @param response the response
	 * @return the token
	 */
	OAuthToken readToken(HttpFormResponse response) {
		OAuthErrorResponse error = readError(response);
		if (error != null) {
			throw toException(error, response.statusCode());
		}
		OAuthToken token = readValue(response, OAuthToken.class);
		if (token.getAccessToken() == null || token.getAccessToken().isEmpty()) {
			throw OAuthStateException.missingField("access_token");
		}
		if (token.getTokenType() == null) {
			token.setTokenType("bearer");
		}
		return token.issuedAt(clock);
	}

	<T> T readValue(HttpFormResponse response, Class<T> type) {
		try {
			return objectMapper.readValue(response.body(), type);
		}
		catch (JsonProcessingException e) {
			throw new OAuthTransportException("Undecodable " + type.getSimpleName() + " response", response.statusCode(),
					e);
		}
	}

	static OAuthException toException(OAuthErrorResponse error, int statusCode) {
		if (ACCESS_DENIED.equals(error.getError())) {
			return new AuthorizationDeniedException(error.getErrorDescription());
		}
		return new OAuthProtocolException(error.getError(), error.getErrorDescription(), statusCode);
	}

	@Nullable
	private static String textOrNull(JsonNode node, String field) {
		JsonNode value = node.get(field);
		return value == null || value.isNull() ? null : value.asText();
	}

}
