/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

import io.latchkey.auth.DeviceAuthorization;

/**
 * Presents what the user has to act on during an interactive flow. Opening a browser is
 * left to implementations.
 */
public interface AuthorizationPrompt {

	/**
	 * Shows the authorization URL of a code flow.
	 * @param authorizationUrl the URL the user has to open
	 */
	void presentAuthorizationUrl(String authorizationUrl);

	/**
	 * Shows the user code and verification URI of a device flow.
	 * @param authorization the device authorization returned by the server
	 */
	void presentDeviceCode(DeviceAuthorization authorization);

	/**
	 * A prompt writing to standard output.
	 * @return the console prompt
	 */
	static AuthorizationPrompt console() {
		return ConsoleAuthorizationPrompt.INSTANCE;
	}

}
