/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.latchkey.auth.DeviceAuthorization;
import io.latchkey.auth.OAuthToken;
import io.latchkey.auth.Session;
import io.latchkey.client.storage.CredentialStore;
import io.latchkey.client.transport.JdkOAuthHttpTransport;
import io.latchkey.client.transport.OAuthHttpTransport;
import io.latchkey.spec.OAuthStateException;
import io.latchkey.util.Assert;
import io.latchkey.util.FormEncoding;
import io.latchkey.util.Sleeper;
import io.latchkey.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the OAuth 2.0 authorization code flow with PKCE and the device authorization
 * flow against one authorization server, and keeps sessions and tokens in a
 * {@link CredentialStore}.
 * <p>
 * Every code flow attempt stores a {@link Session} under a fresh random {@code state}.
 * {@link #exchangeCode(String, String)} only accepts a {@code state} that has a stored
 * session and deletes it once the code has been exchanged, so a redirect can be
 * redeemed at most once.
 *
 * @see TokenRefresher
 */
public class OAuthClient {

	private static final Logger logger = LoggerFactory.getLogger(OAuthClient.class);

	/** Default time to wait for the authorization redirect. */
	public static final Duration DEFAULT_CALLBACK_TIMEOUT = Duration.ofSeconds(30);

	private static final SecureRandom secureRandom = new SecureRandom();

	private final OAuthConfig config;

	private final CredentialStore store;

	private final OAuthHttpTransport transport;

	private final TokenResponseParser parser;

	private final Clock clock;

	private final AuthorizationPrompt prompt;

	private final Sleeper sleeper;

	private final Duration callbackTimeout;

	private final String sessionDomain;

	private OAuthClient(Builder builder) {
		this.config = builder.config;
		this.store = builder.store;
		this.transport = builder.transport != null ? builder.transport : JdkOAuthHttpTransport.create();
		this.clock = builder.clock;
		this.parser = new TokenResponseParser(builder.objectMapper, builder.clock);
		this.prompt = builder.prompt;
		this.sleeper = builder.sleeper;
		this.callbackTimeout = builder.callbackTimeout;
		this.sessionDomain = builder.sessionDomain;
	}

	public static Builder builder(OAuthConfig config, CredentialStore store) {
		return new Builder(config, store);
	}

	public OAuthConfig getConfig() {
		return config;
	}

	public CredentialStore getCredentialStore() {
		return store;
	}

	public Clock getClock() {
		return clock;
	}

	/**
	 * Runs a complete code flow: binds a {@link LocalCallbackServer}, presents the
	 * authorization URL, waits for the redirect and exchanges the code. The token is
	 * returned, not stored.
	 * @return the issued token
	 */
	public OAuthToken authorize() {
		try (LocalCallbackServer server = new LocalCallbackServer()) {
			AuthFlowResult flow = startAuthFlow(server.getRedirectUri());
			prompt.presentAuthorizationUrl(flow.url());
			AuthCallbackResult callback = server.waitForCallback(callbackTimeout);
			if (!flow.state().equals(callback.getState())) {
				throw OAuthStateException.invalidState();
			}
			return exchangeCode(callback.getCode(), callback.getState());
		}
	}

	/**
	 * Starts a code flow redirecting to the configured redirect URI. The caller is in
	 * charge of receiving the redirect and calling {@link #exchangeCode(String, String)}.
	 * @return the authorization URL and its state
	 */
	public AuthFlowResult startAuthFlow() {
		return startAuthFlow(config.getRedirectUri());
	}

	/**
	 * Starts a code flow: generates the PKCE pair and state, stores the session and builds
	 * the authorization URL.
	 * @param redirectUri the redirect URI to send, repeated in the token request
	 * @return the authorization URL and its state
	 */
	public AuthFlowResult startAuthFlow(String redirectUri) {
		Assert.hasText(redirectUri, "redirectUri must not be empty");
		if (!Utils.hasText(config.getAuthorizationEndpoint())) {
			throw new IllegalStateException("No authorization endpoint configured");
		}
		PkceChallenge pkce = PkceChallenge.generate();
		String state = generateState();

		Session session = new Session(state, pkce.getVerifier(), sessionDomain, clock.instant().getEpochSecond());
		session.setRedirectUri(redirectUri);
		store.saveSession(state, session);

		Map<String, String> params = new LinkedHashMap<>();
		params.put("client_id", config.getClientId());
		params.put("redirect_uri", redirectUri);
		params.put("response_type", "code");
		params.put("state", state);
		params.put("code_challenge", pkce.getChallenge());
		params.put("code_challenge_method", PkceChallenge.METHOD);
		if (Utils.hasText(config.getScope())) {
			params.put("scope", config.getScope());
		}

		String endpoint = config.getAuthorizationEndpoint();
		String url = endpoint + (endpoint.contains("?") ? "&" : "?") + FormEncoding.format(params);
		logger.info("Started authorization code flow");
		return new AuthFlowResult(url, state);
	}

	/**
	 * Exchanges an authorization code for a token. The session stored under
	 * {@code state} supplies the code verifier and redirect URI and is deleted on
	 * success.
	 * @param code the authorization code
	 * @param state the state returned on the redirect
	 * @return the issued token
	 * @throws OAuthStateException of kind {@code INVALID_STATE} when no session exists
	 */
	public OAuthToken exchangeCode(String code, String state) {
		Assert.hasText(code, "code must not be empty");
		Session session = (state == null ? Optional.<Session>empty() : store.getSession(state))
			.orElseThrow(OAuthStateException::invalidState);

		Map<String, String> form = new LinkedHashMap<>();
		form.put("grant_type", "authorization_code");
		form.put("code", code);
		form.put("redirect_uri",
				Utils.hasText(session.getRedirectUri()) ? session.getRedirectUri() : config.getRedirectUri());
		form.put("client_id", config.getClientId());
		form.put("code_verifier", session.getCodeVerifier());
		addClientSecret(form);

		OAuthToken token = parser.readToken(transport.postForm(config.getTokenEndpoint(), form));
		store.deleteSession(state);
		logger.info("Exchanged authorization code for a token");
		return token;
	}

	/**
	 * Runs a device flow: requests a device code, presents the user code and polls until
	 * the user has authorized. The token is returned, not stored.
	 * @return the issued token
	 */
	public OAuthToken authorizeDevice() {
		DeviceCodePoller poller = deviceCodePoller();
		DeviceAuthorization authorization = poller.requestAuthorization();
		prompt.presentDeviceCode(authorization);
		return poller.pollForToken(authorization);
	}

	/**
	 * Creates a poller for a single device grant, for callers that drive the steps
	 * themselves.
	 * @return a new poller
	 */
	public DeviceCodePoller deviceCodePoller() {
		return new DeviceCodePoller(config, transport, parser, clock, sleeper);
	}

	/**
	 * Redeems a refresh token. When the server does not rotate the refresh token the
	 * given one is kept on the returned token.
	 * @param refreshToken the refresh token
	 * @return the new token
	 */
	public OAuthToken refreshToken(String refreshToken) {
		Assert.hasText(refreshToken, "refreshToken must not be empty");
		Map<String, String> form = new LinkedHashMap<>();
		form.put("grant_type", "refresh_token");
		form.put("refresh_token", refreshToken);
		form.put("client_id", config.getClientId());
		addClientSecret(form);

		OAuthToken token = parser.readToken(transport.postForm(config.getTokenEndpoint(), form));
		if (!Utils.hasText(token.getRefreshToken())) {
			token.setRefreshToken(refreshToken);
		}
		logger.debug("Refreshed access token");
		return token;
	}

	public Optional<OAuthToken> getToken(String key) {
		return store.getToken(key);
	}

	public void saveToken(String key, OAuthToken token) {
		Assert.notNull(token, "token must not be null");
		store.saveToken(key, token);
	}

	public void deleteToken(String key) {
		store.deleteToken(key);
	}

	private void addClientSecret(Map<String, String> form) {
		if (Utils.hasText(config.getClientSecret())) {
			form.put("client_secret", config.getClientSecret());
		}
	}

	private static String generateState() {
		byte[] bytes = new byte[32];
		secureRandom.nextBytes(bytes);
		return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
	}

	/**
	 * Builder for {@link OAuthClient}.
	 */
	public static class Builder {

		private final OAuthConfig config;

		private final CredentialStore store;

		private OAuthHttpTransport transport;

		private ObjectMapper objectMapper = new ObjectMapper();

		private Clock clock = Clock.systemUTC();

		private AuthorizationPrompt prompt = AuthorizationPrompt.console();

		private Sleeper sleeper = Sleeper.SYSTEM;

		private Duration callbackTimeout = DEFAULT_CALLBACK_TIMEOUT;

		private String sessionDomain;

		private Builder(OAuthConfig config, CredentialStore store) {
			Assert.notNull(config, "config must not be null");
			Assert.notNull(store, "store must not be null");
			this.config = config;
			this.store = store;
		}

		/**
		 * Sets the transport used for all endpoint requests. Defaults to a
		 * {@link JdkOAuthHttpTransport}.
		 * @param transport the transport
		 * @return this builder
		 */
		public Builder transport(OAuthHttpTransport transport) {
			Assert.notNull(transport, "transport must not be null");
			this.transport = transport;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		public Builder clock(Clock clock) {
			Assert.notNull(clock, "clock must not be null");
			this.clock = clock;
			return this;
		}

		public Builder prompt(AuthorizationPrompt prompt) {
			Assert.notNull(prompt, "prompt must not be null");
			this.prompt = prompt;
			return this;
		}

		/**
		 * Sets how the device poller waits between polls.
		 * @param sleeper the sleeper
		 * @return this builder
		 */
		public Builder sleeper(Sleeper sleeper) {
			Assert.notNull(sleeper, "sleeper must not be null");
			this.sleeper = sleeper;
			return this;
		}

		public Builder callbackTimeout(Duration callbackTimeout) {
			Assert.notNull(callbackTimeout, "callbackTimeout must not be null");
			Assert.isTrue(!callbackTimeout.isNegative() && !callbackTimeout.isZero(),
					"callbackTimeout must be positive");
			this.callbackTimeout = callbackTimeout;
			return this;
		}

		/**
		 * Sets the domain recorded on sessions, used by stores that partition by domain.
		 * @param sessionDomain the domain, for example {@code github.com}
		 * @return this builder
		 */
		public Builder sessionDomain(String sessionDomain) {
			this.sessionDomain = sessionDomain;
			return this;
		}

		public OAuthClient build() {
			return new OAuthClient(this);
		}

	}

}
