/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

/**
 * Result of an OAuth authorization callback received by the {@link LocalCallbackServer}.
 */
public class AuthCallbackResult {

	private final String code;

	private final String state;

	/**
	 * Creates a new AuthCallbackResult.
	 * @param code the authorization code
	 * @param state the state parameter echoed by the server
	 */
	public AuthCallbackResult(String code, String state) {
		this.code = code;
		this.state = state;
	}

	public String getCode() {
		return code;
	}

	public String getState() {
		return state;
	}

	@Override
	public String toString() {
		return "AuthCallbackResult[state=" + state + "]";
	}

}
