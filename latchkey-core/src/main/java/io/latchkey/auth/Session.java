/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.auth;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * State kept between starting an authorization code attempt and exchanging the code it
 * produced. Looked up by {@code state} and deleted once the exchange succeeds.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Session {

	@JsonProperty("state")
	private String state;

	@JsonProperty("code_verifier")
	private String codeVerifier;

	@JsonProperty("created_at")
	private long createdAt;

	@JsonProperty("domain")
	private String domain;

	@JsonProperty("redirect_uri")
	private String redirectUri;

	public Session() {
	}

	public Session(String state, String codeVerifier) {
		this(state, codeVerifier, null);
	}

	public Session(String state, String codeVerifier, String domain) {
		this(state, codeVerifier, domain, Instant.now().getEpochSecond());
	}

	public Session(String state, String codeVerifier, String domain, long createdAt) {
		this.state = state;
		this.codeVerifier = codeVerifier;
		this.domain = domain;
		this.createdAt = createdAt;
	}

	public String getState() {
		return state;
	}

	public void setState(String state) {
		this.state = state;
	}

	public String getCodeVerifier() {
		return codeVerifier;
	}

	public void setCodeVerifier(String codeVerifier) {
		this.codeVerifier = codeVerifier;
	}

	/**
	 * @return creation time in epoch seconds
	 */
	public long getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(long createdAt) {
		this.createdAt = createdAt;
	}

	/**
	 * Optional namespace hint used by stores that partition their data.
	 * @return the domain, or {@code null}
	 */
	public String getDomain() {
		return domain;
	}

	public void setDomain(String domain) {
		this.domain = domain;
	}

	/**
	 * The redirect URI sent with the authorization request. The token request has to
	 * repeat it verbatim.
	 * @return the redirect URI, or {@code null} to use the configured one
	 */
	public String getRedirectUri() {
		return redirectUri;
	}

	public void setRedirectUri(String redirectUri) {
		this.redirectUri = redirectUri;
	}

}
