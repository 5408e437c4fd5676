/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.storage;

import java.util.Optional;

import io.latchkey.auth.OAuthToken;
import io.latchkey.auth.Session;

/**
 * Storage for authorization sessions and tokens.
 * <p>
 * Implementations must be safe for concurrent use and make every save or delete atomic.
 * Failures are reported as {@link io.latchkey.spec.CredentialStoreException}.
 */
public interface CredentialStore {

	/**
	 * Save a session under its {@code state} value.
	 * @param state the state parameter of the attempt
	 * @param session the session to store
	 */
	void saveSession(String state, Session session);

	/**
	 * Get a session by state.
	 * @param state the state parameter returned on the redirect
	 * @return the session, or empty if none is stored
	 */
	Optional<Session> getSession(String state);

	/**
	 * Delete a session. Deleting a missing session is not an error.
	 * @param state the state parameter
	 */
	void deleteSession(String state);

	/**
	 * Save a token.
	 * @param key the token key, conventionally {@code <domain>:<principal>}
	 * @param token the token to store
	 */
	void saveToken(String key, OAuthToken token);

	/**
	 * Get a token by key.
	 * @param key the token key
	 * @return the token, or empty if none is stored
	 */
	Optional<OAuthToken> getToken(String key);

	/**
	 * Delete a token. Deleting a missing token is not an error.
	 * @param key the token key
	 */
	void deleteToken(String key);

}
