/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.spec;

/**
 * Thrown when the HTTP exchange with the authorization server fails: the connection
 * could not be made, or the server answered with something that is not a usable OAuth
 * response.
 */
public class OAuthTransportException extends OAuthException {

	private static final long serialVersionUID = 1L;

	/**
	 * Status code used when no HTTP response was received.
	 */
	public static final int NO_STATUS = -1;

	private final int statusCode;

	public OAuthTransportException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = NO_STATUS;
	}

	/**
	 * Constructor for OAuthTransportException.
	 * @param message the error message
	 * @param statusCode the HTTP status code of the offending response
	 */
	public OAuthTransportException(String message, int statusCode) {
		super(message + " (HTTP " + statusCode + ")");
		this.statusCode = statusCode;
	}

	public OAuthTransportException(String message, int statusCode, Throwable cause) {
		super(message + " (HTTP " + statusCode + ")", cause);
		this.statusCode = statusCode;
	}

	/**
	 * Gets the HTTP status code associated with this exception.
	 * @return the status code, or {@link #NO_STATUS} if no response was received
	 */
	public int getStatusCode() {
		return statusCode;
	}

}
