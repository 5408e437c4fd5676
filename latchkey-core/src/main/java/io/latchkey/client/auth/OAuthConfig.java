/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

import io.latchkey.util.Assert;
import io.latchkey.util.Utils;
import reactor.util.annotation.Nullable;

/**
 * Client registration and endpoints of one authorization server.
 * <p>
 * Use {@link #builder(String)} for arbitrary servers or one of the presets
 * ({@link #github(String)}, {@link #google(String)}, {@link #microsoft(String, String)},
 * {@link #gitlab(String, String)}).
 */
public class OAuthConfig {

	/** Redirect URI used by {@link OAuthClient#startAuthFlow()} when none is configured. */
	public static final String DEFAULT_REDIRECT_URI = "http://127.0.0.1:8080/callback";

	private final String clientId;

	private final String clientSecret;

	private final String authorizationEndpoint;

	private final String tokenEndpoint;

	private final String deviceAuthorizationEndpoint;

	private final String redirectUri;

	private final String scope;

	private OAuthConfig(Builder builder) {
		this.clientId = builder.clientId;
		this.clientSecret = builder.clientSecret;
		this.authorizationEndpoint = builder.authorizationEndpoint;
		this.tokenEndpoint = builder.tokenEndpoint;
		this.deviceAuthorizationEndpoint = builder.deviceAuthorizationEndpoint;
		this.redirectUri = builder.redirectUri;
		this.scope = builder.scope;
	}

	public static Builder builder(String clientId) {
		return new Builder(clientId);
	}

	/**
	 * GitHub OAuth apps, including the device flow.
	 * @param clientId the OAuth app client id
	 * @return a builder preset with GitHub's endpoints
	 */
	public static Builder github(String clientId) {
		return builder(clientId).authorizationEndpoint("https://github.com/login/oauth/authorize")
			.tokenEndpoint("https://github.com/login/oauth/access_token")
			.deviceAuthorizationEndpoint("https://github.com/login/device/code");
	}

	public static Builder google(String clientId) {
		return builder(clientId).authorizationEndpoint("https://accounts.google.com/o/oauth2/v2/auth")
			.tokenEndpoint("https://oauth2.googleapis.com/token")
			.deviceAuthorizationEndpoint("https://oauth2.googleapis.com/device/code");
	}

	/**
	 * Microsoft identity platform (v2.0 endpoints).
	 * @param clientId the application id
	 * @param tenant the tenant, {@code common} when {@code null}
	 * @return a builder preset with the tenant's endpoints
	 */
	public static Builder microsoft(String clientId, @Nullable String tenant) {
		String base = "https://login.microsoftonline.com/" + (Utils.hasText(tenant) ? tenant : "common")
				+ "/oauth2/v2.0/";
		return builder(clientId).authorizationEndpoint(base + "authorize")
			.tokenEndpoint(base + "token")
			.deviceAuthorizationEndpoint(base + "devicecode");
	}

	/**
	 * GitLab, hosted or self-managed. GitLab has no device flow endpoint.
	 * @param clientId the application id
	 * @param baseUrl the instance URL, {@code https://gitlab.com} when {@code null}
	 * @return a builder preset with the instance's endpoints
	 */
	public static Builder gitlab(String clientId, @Nullable String baseUrl) {
		String base = Utils.hasText(baseUrl) ? stripTrailingSlash(baseUrl) : "https://gitlab.com";
		return builder(clientId).authorizationEndpoint(base + "/oauth/authorize").tokenEndpoint(base + "/oauth/token");
	}

	private static String stripTrailingSlash(String url) {
		return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
	}

	public String getClientId() {
		return clientId;
	}

	@Nullable
	public String getClientSecret() {
		return clientSecret;
	}

	@Nullable
	public String getAuthorizationEndpoint() {
		return authorizationEndpoint;
	}

	public String getTokenEndpoint() {
		return tokenEndpoint;
	}

	@Nullable
	public String getDeviceAuthorizationEndpoint() {
		return deviceAuthorizationEndpoint;
	}

	public String getRedirectUri() {
		return redirectUri;
	}

	@Nullable
	public String getScope() {
		return scope;
	}

	/**
	 * Builder for {@link OAuthConfig}.
	 */
	public static class Builder {

		private final String clientId;

		private String clientSecret;

		private String authorizationEndpoint;

		private String tokenEndpoint;

		private String deviceAuthorizationEndpoint;

		private String redirectUri = DEFAULT_REDIRECT_URI;

		private String scope;

		private Builder(String clientId) {
			Assert.hasText(clientId, "clientId must not be empty");
			this.clientId = clientId;
		}

		public Builder clientSecret(String clientSecret) {
			this.clientSecret = clientSecret;
			return this;
		}

		public Builder authorizationEndpoint(String authorizationEndpoint) {
			this.authorizationEndpoint = authorizationEndpoint;
			return this;
		}

		public Builder tokenEndpoint(String tokenEndpoint) {
			this.tokenEndpoint = tokenEndpoint;
			return this;
		}

		public Builder deviceAuthorizationEndpoint(String deviceAuthorizationEndpoint) {
			this.deviceAuthorizationEndpoint = deviceAuthorizationEndpoint;
			return this;
		}

		public Builder redirectUri(String redirectUri) {
			Assert.hasText(redirectUri, "redirectUri must not be empty");
			this.redirectUri = redirectUri;
			return this;
		}

		/**
		 * Sets the requested scope, a space separated list.
		 * @param scope the scope
		 * @return this builder
		 */
		public Builder scope(String scope) {
			this.scope = scope;
			return this;
		}

		public OAuthConfig build() {
			Assert.hasText(tokenEndpoint, "tokenEndpoint must not be empty");
			return new OAuthConfig(this);
		}

	}

}
