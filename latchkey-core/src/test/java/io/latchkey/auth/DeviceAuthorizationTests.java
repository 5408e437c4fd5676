/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DeviceAuthorizationTests {

	private final ObjectMapper objectMapper = new ObjectMapper();

	@Test
	void defaultsIntervalToFiveSeconds() throws Exception {
		DeviceAuthorization authorization = objectMapper.readValue(
				"{\"device_code\":\"dc\",\"user_code\":\"ABCD-1234\",\"verification_uri\":\"https://example.com/device\",\"expires_in\":900}",
				DeviceAuthorization.class);

		assertThat(authorization.getInterval()).isEqualTo(DeviceAuthorization.DEFAULT_INTERVAL);
		assertThat(authorization.getExpiresIn()).isEqualTo(900);
		assertThat(authorization.getUserCode()).isEqualTo("ABCD-1234");
	}

	@Test
	void acceptsVerificationUrlSpelling() throws Exception {
		DeviceAuthorization authorization = objectMapper.readValue(
				"{\"device_code\":\"dc\",\"user_code\":\"u\",\"verification_url\":\"https://www.google.com/device\",\"expires_in\":1800,\"interval\":5}",
				DeviceAuthorization.class);

		assertThat(authorization.getVerificationUri()).isEqualTo("https://www.google.com/device");
	}

}
