/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.transport;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.latchkey.spec.OAuthTransportException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JdkOAuthHttpTransportTests {

	private HttpServer server;

	private final AtomicReference<String> receivedBody = new AtomicReference<>();

	private final AtomicReference<Headers> receivedHeaders = new AtomicReference<>();

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.createContext("/token", exchange -> {
			receivedHeaders.set(exchange.getRequestHeaders());
			receivedBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
			respond(exchange, 200, "{\"access_token\":\"at\"}");
		});
		server.createContext("/error", exchange -> {
			exchange.getRequestBody().readAllBytes();
			respond(exchange, 400, "{\"error\":\"invalid_grant\"}");
		});
		server.start();
	}

	@AfterEach
	void tearDown() {
		server.stop(0);
	}

	private String url(String path) {
		return "http://127.0.0.1:" + server.getAddress().getPort() + path;
	}

	@Test
	void postsFormAndAcceptsJson() {
		Map<String, String> form = new LinkedHashMap<>();
		form.put("grant_type", "refresh_token");
		form.put("refresh_token", "a b/c");

		HttpFormResponse response = JdkOAuthHttpTransport.create().postForm(url("/token"), form);

		assertThat(response.statusCode()).isEqualTo(200);
		assertThat(response.isSuccess()).isTrue();
		assertThat(response.body()).isEqualTo("{\"access_token\":\"at\"}");
		assertThat(receivedBody.get()).isEqualTo("grant_type=refresh_token&refresh_token=a+b%2Fc");
		assertThat(receivedHeaders.get().getFirst("Accept")).isEqualTo("application/json");
		assertThat(receivedHeaders.get().getFirst("Content-Type")).isEqualTo("application/x-www-form-urlencoded");
	}

	@Test
	void returnsErrorStatusesToTheCaller() {
		HttpFormResponse response = JdkOAuthHttpTransport.create().postForm(url("/error"), Map.of());

		assertThat(response.statusCode()).isEqualTo(400);
		assertThat(response.isSuccess()).isFalse();
		assertThat(response.body()).contains("invalid_grant");
	}

	@Test
	void appliesRequestCustomizer() {
		JdkOAuthHttpTransport transport = JdkOAuthHttpTransport.builder()
			.customizeRequest(request -> request.header("User-Agent", "latchkey-tests"))
			.requestTimeout(Duration.ofSeconds(5))
			.build();

		transport.postForm(url("/token"), Map.of("a", "b"));

		assertThat(receivedHeaders.get().getFirst("User-Agent")).isEqualTo("latchkey-tests");
	}

	@Test
	void connectionFailureIsTransportException() throws IOException {
		int closedPort;
		try (ServerSocket socket = new ServerSocket(0)) {
			closedPort = socket.getLocalPort();
		}

		assertThatThrownBy(() -> JdkOAuthHttpTransport.create()
			.postForm("http://127.0.0.1:" + closedPort + "/token", Map.of()))
			.isInstanceOfSatisfying(OAuthTransportException.class,
					e -> assertThat(e.getStatusCode()).isEqualTo(OAuthTransportException.NO_STATUS));
	}

	@Test
	void rejectsNonPositiveTimeout() {
		assertThatThrownBy(() -> JdkOAuthHttpTransport.builder().requestTimeout(Duration.ZERO))
			.isInstanceOf(IllegalArgumentException.class);
	}

	private static void respond(HttpExchange exchange, int status, String body)
			throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.getResponseHeaders().set("Content-Type", "application/json");
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}

}
