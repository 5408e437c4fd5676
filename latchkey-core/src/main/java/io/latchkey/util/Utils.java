/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.util;

import java.util.Map;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * Check whether the given {@code String} contains actual <em>text</em>.
	 * <p>
	 * More specifically, this method returns {@code true} if the {@code String} is not
	 * {@code null}, its length is greater than 0, and it contains at least one
	 * non-whitespace character.
	 * @param str the {@code String} to check (may be {@code null})
	 * @return {@code true} if the {@code String} is not {@code null}, its length is
	 * greater than 0, and it does not contain whitespace only
	 * @see Character#isWhitespace
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Return {@code true} if the supplied Map is {@code null} or empty. Otherwise, return
	 * {@code false}.
	 * @param map the Map to check
	 * @return whether the given Map is empty
	 */
	public static boolean isEmpty(@Nullable Map<?, ?> map) {
		return (map == null || map.isEmpty());
	}

	/**
	 * Replaces characters that are hostile to file names ({@code / \ : * ? " < > |} and
	 * whitespace) with underscores.
	 * @param name the raw name, for example a token key such as {@code github.com:alice}
	 * @return a name usable as a single path segment
	 */
	public static String sanitizeFileName(String name) {
		StringBuilder result = new StringBuilder(name.length());
		for (int i = 0; i < name.length(); i++) {
			char c = name.charAt(i);
			switch (c) {
				case '/', '\\', ':', '*', '?', '"', '<', '>', '|' -> result.append('_');
				default -> result.append(Character.isWhitespace(c) ? '_' : c);
			}
		}
		return result.toString();
	}

}
