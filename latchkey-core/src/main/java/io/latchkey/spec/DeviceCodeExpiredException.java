/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.spec;

/**
 * The device code expired before the user approved the request, either because the
 * server answered {@code expired_token} or because its {@code expires_in} elapsed.
 */
public class DeviceCodeExpiredException extends OAuthTimeoutException {

	private static final long serialVersionUID = 1L;

	public DeviceCodeExpiredException() {
		super("device code expired");
	}

}
