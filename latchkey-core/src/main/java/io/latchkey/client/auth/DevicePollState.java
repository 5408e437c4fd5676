/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

/**
 * States of the device authorization grant (RFC 8628) as driven by
 * {@link DeviceCodePoller}.
 */
public enum DevicePollState {

	/** Asking the device authorization endpoint for a device code. */
	REQUESTING,

	/** Polling the token endpoint while the user completes authorization. */
	PENDING,

	SUCCESS,

	/** The user denied the request. */
	DENIED,

	/** The device code expired before the user finished. */
	EXPIRED,

	/** The server reported any other error. */
	FATAL;

	public boolean isTerminal() {
		return this != REQUESTING && this != PENDING;
	}

}
