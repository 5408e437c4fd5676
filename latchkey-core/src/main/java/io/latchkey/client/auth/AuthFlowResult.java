/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

/**
 * Outcome of starting a code flow without the local listener: the URL to send the user
 * to and the state that {@link OAuthClient#exchangeCode(String, String)} expects back.
 *
 * @param url the authorization URL
 * @param state the state parameter the session is stored under
 */
public record AuthFlowResult(String url, String state) {
}
