/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.testutil;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * A {@link Clock} that only moves when told to.
 */
public class MutableClock extends Clock {

	private volatile Instant now;

	public MutableClock(Instant now) {
		this.now = now;
	}

	public static MutableClock atEpochSecond(long epochSecond) {
		return new MutableClock(Instant.ofEpochSecond(epochSecond));
	}

	public void advance(Duration duration) {
		this.now = now.plus(duration);
	}

	public long epochSecond() {
		return now.getEpochSecond();
	}

	@Override
	public ZoneId getZone() {
		return ZoneOffset.UTC;
	}

	@Override
	public Clock withZone(ZoneId zone) {
		return this;
	}

	@Override
	public Instant instant() {
		return now;
	}

}
