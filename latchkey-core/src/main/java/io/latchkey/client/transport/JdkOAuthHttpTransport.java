/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.transport;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;
import java.util.function.Consumer;

import io.latchkey.spec.OAuthTransportException;
import io.latchkey.util.Assert;
import io.latchkey.util.FormEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link OAuthHttpTransport} on top of the JDK {@link HttpClient}.
 * <p>
 * Every request carries {@code Accept: application/json} so that servers which answer
 * form encoded bodies by default (GitHub does) return JSON.
 *
 * @see Builder
 */
public class JdkOAuthHttpTransport implements OAuthHttpTransport {

	private static final Logger logger = LoggerFactory.getLogger(JdkOAuthHttpTransport.class);

	private static final String FORM_CONTENT_TYPE = "application/x-www-form-urlencoded";

	private static final String JSON_CONTENT_TYPE = "application/json";

	/** Default timeout of a single request. */
	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	private final HttpClient httpClient;

	private final Duration requestTimeout;

	private final Consumer<HttpRequest.Builder> requestCustomizer;

	JdkOAuthHttpTransport(HttpClient httpClient, Duration requestTimeout,
			Consumer<HttpRequest.Builder> requestCustomizer) {
		this.httpClient = httpClient;
		this.requestTimeout = requestTimeout;
		this.requestCustomizer = requestCustomizer;
	}

	/**
	 * Creates a transport with default settings.
	 * @return a new transport
	 */
	public static JdkOAuthHttpTransport create() {
		return builder().build();
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public HttpFormResponse postForm(String url, Map<String, String> form) {
		Assert.hasText(url, "url must not be empty");
		Assert.notNull(form, "form must not be null");

		HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Accept", JSON_CONTENT_TYPE)
			.header("Content-Type", FORM_CONTENT_TYPE)
			.timeout(requestTimeout)
			.POST(HttpRequest.BodyPublishers.ofString(FormEncoding.format(form)));
		requestCustomizer.accept(requestBuilder);

		logger.debug("POST {}", url);
		try {
			HttpResponse<String> response = httpClient.send(requestBuilder.build(),
					HttpResponse.BodyHandlers.ofString());
			logger.debug("POST {} returned {}", url, response.statusCode());
			return new HttpFormResponse(response.statusCode(), response.body());
		}
		catch (IOException e) {
			throw new OAuthTransportException("Request to " + url + " failed", e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new OAuthTransportException("Request to " + url + " was interrupted", e);
		}
	}

	/**
	 * Builder for {@link JdkOAuthHttpTransport}.
	 */
	public static class Builder {

		private HttpClient.Builder clientBuilder = HttpClient.newBuilder()
			.version(HttpClient.Version.HTTP_1_1)
			.connectTimeout(Duration.ofSeconds(10));

		private HttpClient httpClient;

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private Consumer<HttpRequest.Builder> requestCustomizer = builder -> {
		};

		private Builder() {
		}

		/**
		 * Sets the HTTP client builder to use. Ignored when {@link #httpClient} is set.
		 * @param clientBuilder the HTTP client builder
		 * @return this builder
		 */
		public Builder clientBuilder(HttpClient.Builder clientBuilder) {
			Assert.notNull(clientBuilder, "clientBuilder must not be null");
			this.clientBuilder = clientBuilder;
			return this;
		}

		/**
		 * Customizes the HTTP client builder.
		 * @param clientCustomizer the consumer to customize the HTTP client builder
		 * @return this builder
		 */
		public Builder customizeClient(final Consumer<HttpClient.Builder> clientCustomizer) {
			Assert.notNull(clientCustomizer, "clientCustomizer must not be null");
			clientCustomizer.accept(clientBuilder);
			return this;
		}

		public Builder httpClient(HttpClient httpClient) {
			Assert.notNull(httpClient, "httpClient must not be null");
			this.httpClient = httpClient;
			return this;
		}

		/**
		 * Customizes every outgoing request, for instance to add a {@code User-Agent}.
		 * @param requestCustomizer the consumer to customize the HTTP request builder
		 * @return this builder
		 */
		public Builder customizeRequest(final Consumer<HttpRequest.Builder> requestCustomizer) {
			Assert.notNull(requestCustomizer, "requestCustomizer must not be null");
			this.requestCustomizer = requestCustomizer;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "requestTimeout must not be null");
			Assert.isTrue(!requestTimeout.isNegative() && !requestTimeout.isZero(), "requestTimeout must be positive");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public JdkOAuthHttpTransport build() {
			HttpClient client = httpClient != null ? httpClient : clientBuilder.build();
			return new JdkOAuthHttpTransport(client, requestTimeout, requestCustomizer);
		}

	}

}
