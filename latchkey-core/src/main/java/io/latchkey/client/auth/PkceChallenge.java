/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;

import io.latchkey.util.Assert;

/**
 * PKCE (Proof Key for Code Exchange) verifier and challenge pair.
 * <p>
 * The verifier is 32 random bytes encoded as base64url without padding (43 characters).
 * The challenge is the base64url encoded SHA-256 digest of the verifier (43 characters).
 */
public final class PkceChallenge {

	/** The only challenge method produced. */
	public static final String METHOD = "S256";

	private static final int VERIFIER_BYTES = 32;

	private static final SecureRandom secureRandom = new SecureRandom();

	private static final Base64.Encoder BASE64_URL = Base64.getUrlEncoder().withoutPadding();

	private final String verifier;

	private final String challenge;

	private PkceChallenge(String verifier, String challenge) {
		this.verifier = verifier;
		this.challenge = challenge;
	}

	/**
	 * Generates a new pair from a shared {@link SecureRandom}.
	 * @return a fresh PKCE pair
	 */
	public static PkceChallenge generate() {
		return generate(secureRandom);
	}

	/**
	 * Generates a pair from the given random source. The same random output always yields
	 * the same pair.
	 * @param random the source of the verifier bytes
	 * @return the PKCE pair
	 */
	public static PkceChallenge generate(SecureRandom random) {
		Assert.notNull(random, "random must not be null");
		byte[] bytes = new byte[VERIFIER_BYTES];
		random.nextBytes(bytes);
		String verifier = BASE64_URL.encodeToString(bytes);
		return new PkceChallenge(verifier, deriveChallenge(verifier));
	}

	/**
	 * Computes the S256 code challenge of a verifier.
	 * @param verifier the code verifier
	 * @return base64url(SHA-256(verifier)) without padding
	 */
	public static String deriveChallenge(String verifier) {
		Assert.notNull(verifier, "verifier must not be null");
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			byte[] hash = digest.digest(verifier.getBytes(StandardCharsets.US_ASCII));
			return BASE64_URL.encodeToString(hash);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 algorithm not available", e);
		}
	}

	public String getVerifier() {
		return verifier;
	}

	public String getChallenge() {
		return challenge;
	}

	public String getMethod() {
		return METHOD;
	}

	@Override
	public String toString() {
		return "PkceChallenge[challenge=" + challenge + ", method=" + METHOD + "]";
	}

}
