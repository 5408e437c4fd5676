/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import io.latchkey.spec.OAuthProtocolException;
import io.latchkey.spec.OAuthStateException;
import io.latchkey.spec.OAuthTimeoutException;
import io.latchkey.spec.OAuthTransportException;
import io.latchkey.util.Assert;
import io.latchkey.util.FormEncoding;
import io.latchkey.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loopback HTTP listener receiving the authorization redirect of a code flow.
 * <p>
 * The listener binds {@code 127.0.0.1} on an ephemeral port as soon as it is created and
 * accepts exactly one {@code GET /callback} carrying either {@code code} and
 * {@code state} or an {@code error}. Requests for other paths get a {@code 404}, and
 * malformed requests a {@code 400}; both leave the listener waiting. It is single use:
 * create a new listener for every authorization attempt.
 */
public class LocalCallbackServer implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(LocalCallbackServer.class);

	public static final String CALLBACK_PATH = "/callback";

	private static final long MAX_REQUEST_READ_MILLIS = 10_000;

	private static final String SUCCESS_PAGE = "<!DOCTYPE html><html><head><title>Authorization complete</title></head>"
			+ "<body><h1>Authorization complete</h1>"
			+ "<p>You can close this window and return to the application.</p></body></html>";

	private final ServerSocket serverSocket;

	private final AtomicBoolean used = new AtomicBoolean();

	/**
	 * Binds a listener on an ephemeral loopback port.
	 */
	public LocalCallbackServer() {
		this(0);
	}

	/**
	 * Binds a listener on the given loopback port.
	 * @param port the port, {@code 0} for an ephemeral one
	 */
	public LocalCallbackServer(int port) {
		try {
			this.serverSocket = new ServerSocket(port, 50, InetAddress.getByName("127.0.0.1"));
		}
		catch (IOException e) {
			throw new OAuthTransportException("Failed to bind callback listener on port " + port, e);
		}
		logger.debug("Callback listener bound to {}", getRedirectUri());
	}

	public int getPort() {
		return serverSocket.getLocalPort();
	}

	/**
	 * The redirect URI to register in the authorization request.
	 * @return {@code http://127.0.0.1:<port>/callback}
	 */
	public String getRedirectUri() {
		return "http://127.0.0.1:" + getPort() + CALLBACK_PATH;
	}

	/**
	 * Blocks until the authorization redirect arrives or the timeout elapses. The
	 * listener is closed when this method returns.
	 * @param timeout how long to wait overall
	 * @return the received code and state
	 * @throws OAuthTimeoutException if no valid callback arrived in time
	 * @throws OAuthProtocolException if the redirect carried an {@code error}
	 * @throws OAuthStateException if {@code code} or {@code state} is missing
	 * @throws IllegalStateException if this listener was already used
	 */
	public AuthCallbackResult waitForCallback(Duration timeout) {
		Assert.notNull(timeout, "timeout must not be null");
		if (!used.compareAndSet(false, true)) {
			throw new IllegalStateException("Callback listener has already been used");
		}
		long deadline = System.nanoTime() + timeout.toNanos();
		try {
			while (true) {
				long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
				if (remainingMillis <= 0) {
					throw new OAuthTimeoutException("callback not received in time");
				}
				serverSocket.setSoTimeout((int) Math.min(remainingMillis, Integer.MAX_VALUE));
				Socket socket;
				try {
					socket = serverSocket.accept();
				}
				catch (SocketTimeoutException e) {
					throw new OAuthTimeoutException("callback not received in time", e);
				}
				AuthCallbackResult result = null;
				try (Socket connection = socket) {
					connection.setSoTimeout((int) Math.min(remainingMillis, MAX_REQUEST_READ_MILLIS));
					result = handle(connection);
				}
				catch (SocketTimeoutException e) {
					logger.debug("Dropped a callback connection that sent no complete request");
				}
				catch (IOException e) {
					// one broken connection does not end the wait
					logger.debug("Dropped a callback connection: {}", e.getMessage());
				}
				if (result != null) {
					return result;
				}
			}
		}
		catch (IOException e) {
			throw new OAuthTransportException("Callback listener failed", e);
		}
		finally {
			close();
		}
	}

	/**
	 * Answers one connection.
	 * @return the callback result, or {@code null} to keep listening
	 */
	private AuthCallbackResult handle(Socket connection) throws IOException {
		BufferedReader reader = new BufferedReader(
				new InputStreamReader(connection.getInputStream(), StandardCharsets.ISO_8859_1));
		String requestLine = reader.readLine();
		skipHeaders(reader);
		OutputStream out = connection.getOutputStream();

		String[] parts = requestLine == null ? new String[0] : requestLine.split(" ");
		if (parts.length < 2 || !"GET".equals(parts[0])) {
			logger.debug("Rejecting malformed callback request: {}", requestLine);
			writeResponse(out, 400, "Bad Request", errorPage("Malformed request"));
			return null;
		}

		String target = parts[1];
		int queryStart = target.indexOf('?');
		String path = queryStart >= 0 ? target.substring(0, queryStart) : target;
		if (!CALLBACK_PATH.equals(path)) {
			writeResponse(out, 404, "Not Found", errorPage("Not found"));
			return null;
		}
		String query = queryStart >= 0 ? target.substring(queryStart + 1) : "";
		if (query.isEmpty()) {
			writeResponse(out, 400, "Bad Request", errorPage("Missing query parameters"));
			return null;
		}

		Map<String, String> params = FormEncoding.parse(query);
		String error = params.get("error");
		if (error != null) {
			String description = params.get("error_description");
			respond(out, 400, "Bad Request",
					errorPage("Authorization failed: " + error + (description != null ? " (" + description + ")" : "")));
			throw new OAuthProtocolException(error, description);
		}
		String code = params.get("code");
		String state = params.get("state");
		if (!Utils.hasText(code) || !Utils.hasText(state)) {
			respond(out, 400, "Bad Request", errorPage("Missing code or state parameter"));
			throw OAuthStateException.missingField(!Utils.hasText(code) ? "code" : "state");
		}
		respond(out, 200, "OK", SUCCESS_PAGE);
		logger.debug("Received authorization callback");
		return new AuthCallbackResult(code, state);
	}

	private static void skipHeaders(BufferedReader reader) throws IOException {
		String line;
		do {
			line = reader.readLine();
		}
		while (line != null && !line.isEmpty());
	}

	/**
	 * Writes a response whose request already decided the outcome of the wait; a client
	 * that went away meanwhile does not change that outcome.
	 */
	private static void respond(OutputStream out, int status, String reason, String html) {
		try {
			writeResponse(out, status, reason, html);
		}
		catch (IOException e) {
			logger.debug("Could not answer callback request: {}", e.getMessage());
		}
	}

	private static void writeResponse(OutputStream out, int status, String reason, String html) throws IOException {
		byte[] body = html.getBytes(StandardCharsets.UTF_8);
		String head = "HTTP/1.1 " + status + " " + reason + "\r\n" + "Content-Type: text/html; charset=utf-8\r\n"
				+ "Content-Length: " + body.length + "\r\n" + "Connection: close\r\n\r\n";
		out.write(head.getBytes(StandardCharsets.ISO_8859_1));
		out.write(body);
		out.flush();
	}

	private static String errorPage(String message) {
		return "<!DOCTYPE html><html><head><title>Authorization error</title></head><body><h1>Authorization error</h1><p>"
				+ escapeHtml(message) + "</p></body></html>";
	}

	static String escapeHtml(String text) {
		StringBuilder escaped = new StringBuilder(text.length());
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			switch (c) {
				case '<' -> escaped.append("&lt;");
				case '>' -> escaped.append("&gt;");
				case '&' -> escaped.append("&amp;");
				case '"' -> escaped.append("&quot;");
				case '\'' -> escaped.append("&#39;");
				default -> escaped.append(c);
			}
		}
		return escaped.toString();
	}

	public boolean isClosed() {
		return serverSocket.isClosed();
	}

	@Override
	public void close() {
		if (serverSocket.isClosed()) {
			return;
		}
		try {
			serverSocket.close();
		}
		catch (IOException e) {
			logger.warn("Failed to close callback listener: {}", e.getMessage());
		}
	}

}
