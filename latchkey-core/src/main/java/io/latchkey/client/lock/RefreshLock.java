/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.lock;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A held refresh lock. Closing it deletes the lock file (best effort) and releases the
 * OS lock; closing twice is a no-op. Use it in a try-with-resources block so that every
 * exit path releases it. It has to be closed by the thread that acquired it.
 */
public final class RefreshLock implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(RefreshLock.class);

	private final Path path;

	private final FileChannel channel;

	private final FileLock fileLock;

	private final Runnable unlockGuard;

	private final AtomicBoolean released = new AtomicBoolean();

	RefreshLock(Path path, FileChannel channel, FileLock fileLock, Runnable unlockGuard) {
		this.path = path;
		this.channel = channel;
		this.fileLock = fileLock;
		this.unlockGuard = unlockGuard;
	}

	/**
	 * Get the path to the lock file.
	 * @return the lock file path
	 */
	public Path getPath() {
		return path;
	}

	public boolean isHeld() {
		return !released.get();
	}

	@Override
	public void close() {
		if (!released.compareAndSet(false, true)) {
			return;
		}
		try {
			// deleted before unlocking: waiters that still have the old file open see a
			// different file under the path once they get the lock
			Files.deleteIfExists(path);
		}
		catch (IOException e) {
			logger.warn("Could not delete lock file {}: {}", path, e.getMessage());
		}
		try (FileChannel ignored = channel) {
			fileLock.release();
		}
		catch (IOException e) {
			logger.warn("Could not release lock file {}: {}", path, e.getMessage());
		}
		finally {
			unlockGuard.run();
			logger.debug("Released refresh lock {}", path);
		}
	}

}
