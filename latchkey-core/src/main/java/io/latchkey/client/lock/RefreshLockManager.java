/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.lock;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import io.latchkey.spec.CredentialStoreException;
import io.latchkey.util.Assert;
import io.latchkey.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named, file-backed exclusive locks that coordinate token refreshes across processes.
 * <p>
 * Each key maps to {@code <lockDirectory>/<sanitized key>.lock}. The exclusive OS lock on
 * that file is what provides mutual exclusion; the file itself is deleted again on
 * release. Because {@link FileChannel#lock()} locks are held on behalf of the whole JVM,
 * threads of one JVM are first serialized on a JVM-wide lock per path, shared by every
 * manager instance. That guard is dropped again once no thread holds or waits for it.
 * <p>
 * POSIX record locks are released when the process closes <em>any</em> descriptor of
 * the locked file, so the file is never opened a second time while it is locked. Whether
 * the locked file is still the one the path names is decided from file attributes
 * alone.
 *
 * <pre>{@code
 * RefreshLockManager locks = RefreshLockManager.forApp("my-cli");
 * try (RefreshLock lock = locks.acquireLock("github.com:alice")) {
 *     // re-read, refresh, persist
 * }
 * }</pre>
 */
public class RefreshLockManager {

	private static final Logger logger = LoggerFactory.getLogger(RefreshLockManager.class);

	static final String RUNTIME_DIR_ENV = "XDG_RUNTIME_DIR";

	private static final String LOCK_DIR_NAME = "latchkey-locks";

	private static final String LOCK_FILE_SUFFIX = ".lock";

	private static final Map<Path, PathGuard> guards = new ConcurrentHashMap<>();

	private final Path lockDirectory;

	/**
	 * Creates a lock manager rooted at the given directory, creating it if needed.
	 * @param lockDirectory the directory holding the lock files
	 * @throws CredentialStoreException if the directory cannot be created
	 */
	public RefreshLockManager(Path lockDirectory) {
		Assert.notNull(lockDirectory, "lockDirectory must not be null");
		this.lockDirectory = lockDirectory.toAbsolutePath().normalize();
		ensureLockDirectory();
	}

	/**
	 * Creates a lock manager using the default directory: {@code $XDG_RUNTIME_DIR} when set,
	 * a per-user directory under {@code java.io.tmpdir} otherwise.
	 * @return the lock manager
	 */
	public static RefreshLockManager withDefaultDirectory() {
		return new RefreshLockManager(defaultLockDirectory(System.getenv()));
	}

	/**
	 * Creates a lock manager whose locks are scoped to one application.
	 * @param appName the application name, used as a sub directory
	 * @return the lock manager
	 */
	public static RefreshLockManager forApp(String appName) {
		Assert.hasText(appName, "appName must not be empty");
		return new RefreshLockManager(defaultLockDirectory(System.getenv()).resolve(Utils.sanitizeFileName(appName)));
	}

	static Path defaultLockDirectory(Map<String, String> env) {
		String runtimeDir = env.get(RUNTIME_DIR_ENV);
		if (Utils.hasText(runtimeDir)) {
			return Paths.get(runtimeDir, LOCK_DIR_NAME);
		}
		String user = Utils.sanitizeFileName(System.getProperty("user.name", "unknown"));
		return Paths.get(System.getProperty("java.io.tmpdir"), LOCK_DIR_NAME + "-" + user);
	}

	public Path getLockDirectory() {
		return lockDirectory;
	}

	/**
	 * Acquire the exclusive lock for a key, blocking until it is available. There is no
	 * timeout; use {@link #tryAcquireLock(String)} in a loop for a bounded wait.
	 * @param key the token key
	 * @return the held lock, to be closed by the caller
	 * @throws CredentialStoreException if the lock file cannot be created or locked
	 * @throws IllegalStateException if the calling thread already holds this lock
	 */
	public RefreshLock acquireLock(String key) {
		Path path = lockPath(key);
		PathGuard guard = retainGuard(path);
		if (guard.lock.isHeldByCurrentThread()) {
			releaseGuard(path);
			throw new IllegalStateException("Refresh lock already held by this thread: " + path);
		}
		guard.lock.lock();
		try {
			RefreshLock lock = lockFile(path, guard, true);
			logger.debug("Acquired refresh lock {}", path);
			return lock;
		}
		catch (RuntimeException e) {
			unlockGuard(path, guard);
			throw e;
		}
	}

	/**
	 * Try to acquire the exclusive lock for a key without blocking.
	 * @param key the token key
	 * @return the held lock, or empty if another thread or process holds it
	 * @throws CredentialStoreException if the lock file cannot be created or locked
	 */
	public Optional<RefreshLock> tryAcquireLock(String key) {
		Path path = lockPath(key);
		PathGuard guard = retainGuard(path);
		if (guard.lock.isHeldByCurrentThread() || !guard.lock.tryLock()) {
			releaseGuard(path);
			return Optional.empty();
		}
		try {
			RefreshLock lock = lockFile(path, guard, false);
			if (lock == null) {
				unlockGuard(path, guard);
				return Optional.empty();
			}
			logger.debug("Acquired refresh lock {}", path);
			return Optional.of(lock);
		}
		catch (RuntimeException e) {
			unlockGuard(path, guard);
			throw e;
		}
	}

	/**
	 * Run an action while holding the lock for a key. The lock is released when the
	 * action returns or throws.
	 * @param key the token key
	 * @param action the protected block
	 * @param <T> the result type
	 * @return the action's result
	 */
	public <T> T withLock(String key, Supplier<T> action) {
		try (RefreshLock lock = acquireLock(key)) {
			return action.get();
		}
	}

	/**
	 * Resolve the lock file for a key.
	 * @param key the token key
	 * @return the path of the lock file
	 */
	public Path lockPath(String key) {
		Assert.hasText(key, "key must not be empty");
		return lockDirectory.resolve(Utils.sanitizeFileName(key) + LOCK_FILE_SUFFIX);
	}

	static boolean hasGuard(Path path) {
		return guards.containsKey(path);
	}

	private static PathGuard retainGuard(Path path) {
		return guards.compute(path, (p, guard) -> {
			PathGuard retained = (guard != null) ? guard : new PathGuard();
			retained.users++;
			return retained;
		});
	}

	private static void releaseGuard(Path path) {
		guards.computeIfPresent(path, (p, guard) -> (--guard.users == 0) ? null : guard);
	}

	private static void unlockGuard(Path path, PathGuard guard) {
		guard.lock.unlock();
		releaseGuard(path);
	}

	private void ensureLockDirectory() {
		try {
			// tolerates the directory being created concurrently by another process
			Files.createDirectories(lockDirectory);
		}
		catch (IOException e) {
			throw new CredentialStoreException("Failed to create lock directory " + lockDirectory, e);
		}
	}

	/**
	 * Lock the file at {@code path}. A previous holder deletes the file while still
	 * holding it, so the file we opened may have been unlinked by the time we get the
	 * lock; in that case the lock protects nothing and we start over with a fresh file.
	 */
	private RefreshLock lockFile(Path path, PathGuard guard, boolean blocking) {
		while (true) {
			ensureLockDirectory();
			FileChannel channel = null;
			try {
				Object identity = fileIdentity(path);
				if (identity == null) {
					createLockFile(path);
					continue;
				}
				// no CREATE: a file that vanished since the check above is retried
				channel = FileChannel.open(path, StandardOpenOption.WRITE);
				if (!identity.equals(fileIdentity(path))) {
					channel.close();
					continue;
				}
				FileLock fileLock = blocking ? channel.lock() : channel.tryLock();
				if (fileLock == null) {
					channel.close();
					return null;
				}
				if (identity.equals(fileIdentity(path))) {
					return new RefreshLock(path, channel, fileLock, () -> unlockGuard(path, guard));
				}
				logger.debug("Lock file {} was replaced while waiting, retrying", path);
				fileLock.release();
				channel.close();
			}
			catch (NoSuchFileException e) {
				closeAfterFailure(channel, e);
				logger.debug("Lock file {} was removed while opening, retrying", path);
			}
			catch (IOException e) {
				closeAfterFailure(channel, e);
				throw new CredentialStoreException("Failed to lock " + path, e);
			}
		}
	}

	/**
	 * Identity of the file the path currently names, read with {@code stat} so that no
	 * descriptor is opened. Falls back to the creation time where the platform has no
	 * file key.
	 * @return the identity, or {@code null} if there is no such file
	 */
	static Object fileIdentity(Path path) throws IOException {
		BasicFileAttributes attributes;
		try {
			attributes = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
		}
		catch (NoSuchFileException e) {
			return null;
		}
		return (attributes.fileKey() != null) ? attributes.fileKey() : attributes.creationTime();
	}

	private static void createLockFile(Path path) throws IOException {
		try {
			Files.createFile(path);
		}
		catch (FileAlreadyExistsException e) {
			logger.trace("Lock file {} created concurrently", path);
		}
	}

	private static void closeAfterFailure(FileChannel channel, IOException failure) {
		if (channel == null) {
			return;
		}
		try {
			channel.close();
		}
		catch (IOException e) {
			failure.addSuppressed(e);
		}
	}

	private static final class PathGuard {

		private final ReentrantLock lock = new ReentrantLock();

		// guarded by the map entry
		private int users;

	}

}
