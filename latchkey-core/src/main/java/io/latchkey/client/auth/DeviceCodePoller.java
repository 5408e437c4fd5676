/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import io.latchkey.auth.DeviceAuthorization;
import io.latchkey.auth.OAuthErrorResponse;
import io.latchkey.auth.OAuthToken;
import io.latchkey.client.transport.HttpFormResponse;
import io.latchkey.client.transport.OAuthHttpTransport;
import io.latchkey.spec.AuthorizationDeniedException;
import io.latchkey.spec.DeviceCodeExpiredException;
import io.latchkey.spec.OAuthException;
import io.latchkey.spec.OAuthStateException;
import io.latchkey.util.Assert;
import io.latchkey.util.Sleeper;
import io.latchkey.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one device authorization grant (RFC 8628): request a device code, then poll the
 * token endpoint until the user has authorized, denied, or the code expired.
 * <p>
 * {@code authorization_pending} keeps polling at the current interval and
 * {@code slow_down} adds five seconds to it. The expiry deadline is checked before
 * every sleep and before every request, so a poll is never scheduled past it.
 * Instances are not thread-safe; use one per grant.
 */
public class DeviceCodePoller {

	private static final Logger logger = LoggerFactory.getLogger(DeviceCodePoller.class);

	public static final String DEVICE_CODE_GRANT_TYPE = "urn:ietf:params:oauth:grant-type:device_code";

	static final long SLOW_DOWN_INCREMENT_SECONDS = 5;

	static final long MIN_INTERVAL_SECONDS = 1;

	private final OAuthConfig config;

	private final OAuthHttpTransport transport;

	private final TokenResponseParser parser;

	private final Clock clock;

	private final Sleeper sleeper;

	private volatile DevicePollState state = DevicePollState.REQUESTING;

	DeviceCodePoller(OAuthConfig config, OAuthHttpTransport transport, TokenResponseParser parser, Clock clock,
			Sleeper sleeper) {
		Assert.notNull(config, "config must not be null");
		Assert.notNull(transport, "transport must not be null");
		Assert.notNull(clock, "clock must not be null");
		Assert.notNull(sleeper, "sleeper must not be null");
		this.config = config;
		this.transport = transport;
		this.parser = parser;
		this.clock = clock;
		this.sleeper = sleeper;
	}

	public DevicePollState getState() {
		return state;
	}

	/**
	 * Asks the device authorization endpoint for a device and user code.
	 * @return the device authorization
	 * @throws IllegalStateException if no device authorization endpoint is configured
	 */
	public DeviceAuthorization requestAuthorization() {
		String endpoint = config.getDeviceAuthorizationEndpoint();
		if (!Utils.hasText(endpoint)) {
			throw new IllegalStateException("No device authorization endpoint configured");
		}
		state = DevicePollState.REQUESTING;

		Map<String, String> form = new LinkedHashMap<>();
		form.put("client_id", config.getClientId());
		if (Utils.hasText(config.getScope())) {
			form.put("scope", config.getScope());
		}

		DeviceAuthorization authorization;
		try {
			HttpFormResponse response = transport.postForm(endpoint, form);
			OAuthErrorResponse error = parser.readError(response);
			if (error != null) {
				throw TokenResponseParser.toException(error, response.statusCode());
			}
			authorization = parser.readValue(response, DeviceAuthorization.class);
		}
		catch (OAuthException e) {
			state = DevicePollState.FATAL;
			throw e;
		}

		requireField(authorization.getDeviceCode(), "device_code");
		requireField(authorization.getUserCode(), "user_code");
		requireField(authorization.getVerificationUri(), "verification_uri");
		if (authorization.getInterval() <= 0) {
			authorization.setInterval(DeviceAuthorization.DEFAULT_INTERVAL);
		}
		state = DevicePollState.PENDING;
		logger.info("Device authorization started, code expires in {}s", authorization.getExpiresIn());
		return authorization;
	}

	/**
	 * Polls the token endpoint until the grant reaches a terminal state.
	 * @param authorization the device authorization from {@link #requestAuthorization()}
	 * @return the issued token
	 * @throws AuthorizationDeniedException if the user denied the request
	 * @throws DeviceCodeExpiredException if the device code expired first
	 * @throws io.latchkey.spec.OAuthProtocolException for any other server error
	 */
	public OAuthToken pollForToken(DeviceAuthorization authorization) {
		Assert.notNull(authorization, "authorization must not be null");
		Instant deadline = clock.instant().plusSeconds(authorization.getExpiresIn());
		long interval = Math.max(MIN_INTERVAL_SECONDS,
				authorization.getInterval() > 0 ? authorization.getInterval() : DeviceAuthorization.DEFAULT_INTERVAL);
		state = DevicePollState.PENDING;

		Map<String, String> form = new LinkedHashMap<>();
		form.put("grant_type", DEVICE_CODE_GRANT_TYPE);
		form.put("device_code", authorization.getDeviceCode());
		form.put("client_id", config.getClientId());
		if (Utils.hasText(config.getClientSecret())) {
			form.put("client_secret", config.getClientSecret());
		}

		while (true) {
			if (clock.instant().plusSeconds(interval).isAfter(deadline)) {
				throw expired();
			}
			sleep(Duration.ofSeconds(interval));
			if (!clock.instant().isBefore(deadline)) {
				throw expired();
			}

			HttpFormResponse response;
			OAuthErrorResponse error;
			try {
				response = transport.postForm(config.getTokenEndpoint(), form);
				error = parser.readError(response);
			}
			catch (OAuthException e) {
				state = DevicePollState.FATAL;
				throw e;
			}

			if (error == null) {
				try {
					OAuthToken token = parser.readToken(response);
					state = DevicePollState.SUCCESS;
					logger.info("Device authorization completed");
					return token;
				}
				catch (OAuthException e) {
					state = DevicePollState.FATAL;
					throw e;
				}
			}

			switch (error.getError()) {
				case "authorization_pending" -> logger.debug("Authorization pending, polling again in {}s", interval);
				case "slow_down" -> {
					interval += SLOW_DOWN_INCREMENT_SECONDS;
					logger.debug("Server asked to slow down, polling interval is now {}s", interval);
				}
				case TokenResponseParser.ACCESS_DENIED -> {
					state = DevicePollState.DENIED;
					throw new AuthorizationDeniedException(error.getErrorDescription());
				}
				case "expired_token" -> throw expired();
				default -> {
					state = DevicePollState.FATAL;
					throw TokenResponseParser.toException(error, response.statusCode());
				}
			}
		}
	}

	private DeviceCodeExpiredException expired() {
		state = DevicePollState.EXPIRED;
		logger.info("Device code expired before authorization completed");
		return new DeviceCodeExpiredException();
	}

	private void sleep(Duration interval) {
		try {
			sleeper.sleep(interval);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			state = DevicePollState.FATAL;
			throw new OAuthException("Interrupted while polling for device authorization", e);
		}
	}

	private void requireField(String value, String field) {
		if (!Utils.hasText(value)) {
			state = DevicePollState.FATAL;
			throw OAuthStateException.missingField(field);
		}
	}

}
