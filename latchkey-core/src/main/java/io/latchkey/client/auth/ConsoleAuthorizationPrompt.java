/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

import java.io.PrintStream;

import io.latchkey.auth.DeviceAuthorization;
import io.latchkey.util.Utils;

/**
 * {@link AuthorizationPrompt} printing instructions to a {@link PrintStream}.
 */
public class ConsoleAuthorizationPrompt implements AuthorizationPrompt {

	static final ConsoleAuthorizationPrompt INSTANCE = new ConsoleAuthorizationPrompt(System.out);

	private final PrintStream out;

	public ConsoleAuthorizationPrompt(PrintStream out) {
		this.out = out;
	}

	@Override
	public void presentAuthorizationUrl(String authorizationUrl) {
		out.println("Open this URL in your browser to authorize:");
		out.println();
		out.println("  " + authorizationUrl);
		out.println();
		out.flush();
	}

	@Override
	public void presentDeviceCode(DeviceAuthorization authorization) {
		out.println("To authorize, visit " + authorization.getVerificationUri());
		out.println("and enter the code: " + authorization.getUserCode());
		if (Utils.hasText(authorization.getVerificationUriComplete())) {
			out.println("(or open " + authorization.getVerificationUriComplete() + ")");
		}
		out.println();
		out.flush();
	}

}
