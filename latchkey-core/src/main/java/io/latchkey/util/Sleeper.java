/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.util;

import java.time.Duration;

/**
 * Blocks the calling thread for a given duration. Pollers take one of these so that
 * tests can advance a clock instead of waiting.
 */
@FunctionalInterface
public interface Sleeper {

	/**
	 * Sleeper backed by {@link Thread#sleep(long)}.
	 */
	Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

	void sleep(Duration duration) throws InterruptedException;

}
