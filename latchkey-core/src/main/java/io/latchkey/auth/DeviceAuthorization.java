/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.auth;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Device authorization response as defined in RFC 8628 section 3.2.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeviceAuthorization {

	/**
	 * Polling interval in seconds used when the server does not send one.
	 */
	public static final long DEFAULT_INTERVAL = 5;

	@JsonProperty("device_code")
	private String deviceCode;

	@JsonProperty("user_code")
	private String userCode;

	// Google still sends the draft name
	@JsonProperty("verification_uri")
	@JsonAlias("verification_url")
	private String verificationUri;

	@JsonProperty("verification_uri_complete")
	private String verificationUriComplete;

	@JsonProperty("expires_in")
	private long expiresIn;

	@JsonProperty("interval")
	private long interval = DEFAULT_INTERVAL;

	public DeviceAuthorization() {
	}

	public DeviceAuthorization(String deviceCode, String userCode, String verificationUri, long expiresIn,
			long interval) {
		this.deviceCode = deviceCode;
		this.userCode = userCode;
		this.verificationUri = verificationUri;
		this.expiresIn = expiresIn;
		this.interval = interval;
	}

	public String getDeviceCode() {
		return deviceCode;
	}

	public void setDeviceCode(String deviceCode) {
		this.deviceCode = deviceCode;
	}

	public String getUserCode() {
		return userCode;
	}

	public void setUserCode(String userCode) {
		this.userCode = userCode;
	}

	public String getVerificationUri() {
		return verificationUri;
	}

	public void setVerificationUri(String verificationUri) {
		this.verificationUri = verificationUri;
	}

	public String getVerificationUriComplete() {
		return verificationUriComplete;
	}

	public void setVerificationUriComplete(String verificationUriComplete) {
		this.verificationUriComplete = verificationUriComplete;
	}

	public long getExpiresIn() {
		return expiresIn;
	}

	public void setExpiresIn(long expiresIn) {
		this.expiresIn = expiresIn;
	}

	public long getInterval() {
		return interval;
	}

	public void setInterval(long interval) {
		this.interval = interval;
	}

}
