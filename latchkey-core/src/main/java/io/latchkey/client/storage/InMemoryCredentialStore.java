/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.storage;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import io.latchkey.auth.OAuthToken;
import io.latchkey.auth.Session;

/**
 * In-memory implementation of {@link CredentialStore}. Nothing survives the JVM, which
 * makes it suitable for tests and single-shot tools.
 */
public class InMemoryCredentialStore implements CredentialStore {

	private final Map<String, Session> sessions = new ConcurrentHashMap<>();

	private final Map<String, OAuthToken> tokens = new ConcurrentHashMap<>();

	@Override
	public void saveSession(String state, Session session) {
		sessions.put(state, session);
	}

	@Override
	public Optional<Session> getSession(String state) {
		return Optional.ofNullable(sessions.get(state));
	}

	@Override
	public void deleteSession(String state) {
		sessions.remove(state);
	}

	@Override
	public void saveToken(String key, OAuthToken token) {
		tokens.put(key, token);
	}

	@Override
	public Optional<OAuthToken> getToken(String key) {
		return Optional.ofNullable(tokens.get(key));
	}

	@Override
	public void deleteToken(String key) {
		tokens.remove(key);
	}

}
