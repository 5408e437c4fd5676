/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.auth;

import java.time.Clock;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * OAuth token as defined in RFC 6749 section 5.1
 * https://datatracker.ietf.org/doc/html/rfc6749#section-5.1, extended with the absolute
 * {@code expires_at} instant computed when the token was issued.
 * <p>
 * {@code expires_at} is the only basis for expiry checks. A token without it never
 * expires.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class OAuthToken {

	@JsonProperty("access_token")
	private String accessToken;

	@JsonProperty("refresh_token")
	private String refreshToken;

	@JsonProperty("token_type")
	private String tokenType;

	@JsonProperty("expires_in")
	private Long expiresIn;

	@JsonProperty("expires_at")
	private Long expiresAt;

	@JsonProperty("scope")
	private String scope;

	public OAuthToken() {
		this.tokenType = "bearer";
	}

	public OAuthToken(String accessToken, String refreshToken, Long expiresIn, Long expiresAt) {
		this.accessToken = accessToken;
		this.refreshToken = refreshToken;
		this.tokenType = "bearer";
		this.expiresIn = expiresIn;
		this.expiresAt = expiresAt;
	}

	/**
	 * Stamp {@code expires_at = now + expires_in} on a freshly issued token. Leaves
	 * {@code expires_at} unset when the server sent no lifetime.
	 * @param clock the clock providing "now"
	 * @return this token
	 */
	public OAuthToken issuedAt(Clock clock) {
		this.expiresAt = expiresIn != null ? clock.instant().getEpochSecond() + expiresIn : null;
		return this;
	}

	/**
	 * Check if the token is expired.
	 * @return true when {@code expires_at} is set and not in the future
	 */
	@JsonIgnore
	public boolean isExpired() {
		return isExpired(Clock.systemUTC());
	}

	@JsonIgnore
	public boolean isExpired(Clock clock) {
		return expiresAt != null && clock.instant().getEpochSecond() >= expiresAt;
	}

	public String getAccessToken() {
		return accessToken;
	}

	public void setAccessToken(String accessToken) {
		this.accessToken = accessToken;
	}

	public String getRefreshToken() {
		return refreshToken;
	}

	public void setRefreshToken(String refreshToken) {
		this.refreshToken = refreshToken;
	}

	public String getTokenType() {
		return tokenType;
	}

	public void setTokenType(String tokenType) {
		this.tokenType = tokenType;
	}

	public Long getExpiresIn() {
		return expiresIn;
	}

	public void setExpiresIn(Long expiresIn) {
		this.expiresIn = expiresIn;
	}

	public Long getExpiresAt() {
		return expiresAt;
	}

	public void setExpiresAt(Long expiresAt) {
		this.expiresAt = expiresAt;
	}

	public String getScope() {
		return scope;
	}

	public void setScope(String scope) {
		this.scope = scope;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof OAuthToken)) {
			return false;
		}
		OAuthToken that = (OAuthToken) o;
		return Objects.equals(accessToken, that.accessToken) && Objects.equals(refreshToken, that.refreshToken)
				&& Objects.equals(tokenType, that.tokenType) && Objects.equals(expiresIn, that.expiresIn)
				&& Objects.equals(expiresAt, that.expiresAt) && Objects.equals(scope, that.scope);
	}

	@Override
	public int hashCode() {
		return Objects.hash(accessToken, refreshToken, tokenType, expiresIn, expiresAt, scope);
	}

	@Override
	public String toString() {
		// never print the secrets
		return "OAuthToken[tokenType=" + tokenType + ", expiresIn=" + expiresIn + ", expiresAt=" + expiresAt
				+ ", scope=" + scope + ", hasRefreshToken=" + (refreshToken != null) + "]";
	}

}
