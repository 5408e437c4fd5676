/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.util;

import java.io.ByteArrayOutputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encoding and decoding of {@code application/x-www-form-urlencoded} data and URL query
 * strings.
 * <p>
 * Encoding leaves the RFC 3986 unreserved characters ({@code ALPHA DIGIT - . _ ~})
 * untouched, writes a space as {@code +} and percent-encodes every other UTF-8 byte.
 */
public final class FormEncoding {

	private FormEncoding() {
	}

	/**
	 * Percent-encode a single component.
	 * @param value the raw value
	 * @return the encoded value
	 */
	public static String encode(String value) {
		// URLEncoder keeps '*' and escapes '~'; RFC 3986 wants the opposite
		return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("*", "%2A").replace("%7E", "~");
	}

	/**
	 * Decode a single component: {@code %XX} becomes the byte {@code XX}, {@code +}
	 * becomes a space and the resulting bytes are read as UTF-8. A {@code %} that is not
	 * followed by two hex digits is kept as is.
	 * @param value the encoded value
	 * @return the decoded value
	 */
	public static String decode(String value) {
		ByteArrayOutputStream bytes = new ByteArrayOutputStream(value.length());
		int i = 0;
		while (i < value.length()) {
			char c = value.charAt(i);
			if (c == '%' && i + 2 < value.length() && isHex(value.charAt(i + 1)) && isHex(value.charAt(i + 2))) {
				bytes.write(Character.digit(value.charAt(i + 1), 16) << 4 | Character.digit(value.charAt(i + 2), 16));
				i += 3;
			}
			else if (c == '+') {
				bytes.write(' ');
				i++;
			}
			else {
				int codePoint = value.codePointAt(i);
				byte[] raw = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
				bytes.write(raw, 0, raw.length);
				i += Character.charCount(codePoint);
			}
		}
		return bytes.toString(StandardCharsets.UTF_8);
	}

	/**
	 * Format parameters as a form body or query string, keeping their iteration order.
	 * @param params the parameters
	 * @return {@code k1=v1&k2=v2...} with keys and values encoded
	 */
	public static String format(Map<String, String> params) {
		if (Utils.isEmpty(params)) {
			return "";
		}
		StringBuilder result = new StringBuilder();
		for (Map.Entry<String, String> entry : params.entrySet()) {
			if (result.length() > 0) {
				result.append('&');
			}
			result.append(encode(entry.getKey())).append('=').append(encode(entry.getValue()));
		}
		return result.toString();
	}

	/**
	 * Parse a query string into decoded parameters. Empty pairs are skipped, a key without
	 * {@code =} maps to an empty value and the first occurrence of a repeated key wins.
	 * @param query the raw query string, without the leading {@code ?}
	 * @return the decoded parameters in order of appearance
	 */
	public static Map<String, String> parse(String query) {
		Map<String, String> params = new LinkedHashMap<>();
		if (query == null || query.isEmpty()) {
			return params;
		}
		for (String pair : query.split("&")) {
			if (pair.isEmpty()) {
				continue;
			}
			int idx = pair.indexOf('=');
			String key = idx >= 0 ? pair.substring(0, idx) : pair;
			String value = idx >= 0 ? pair.substring(idx + 1) : "";
			params.putIfAbsent(decode(key), decode(value));
		}
		return params;
	}

	private static boolean isHex(char c) {
		return Character.digit(c, 16) >= 0;
	}

}
