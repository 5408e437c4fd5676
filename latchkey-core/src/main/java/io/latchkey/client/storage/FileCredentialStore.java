/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.storage;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.latchkey.auth.OAuthToken;
import io.latchkey.auth.Session;
import io.latchkey.client.lock.RefreshLockManager;
import io.latchkey.spec.CredentialStoreException;
import io.latchkey.util.Assert;
import io.latchkey.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CredentialStore} keeping sessions and tokens in JSON files, one pair of files
 * per domain: {@code sessions_<domain>.json} and {@code tokens_<domain>.json}.
 * <p>
 * The domain of a token is the part of its key before the first {@code :} (so
 * {@code github.com:alice} lives in {@code tokens_github.com.json}), or {@code default}.
 * Sessions use {@link Session#getDomain()}. Files are replaced atomically and every
 * read-modify-write runs under a file lock, so several processes can share one store.
 */
public class FileCredentialStore implements CredentialStore {

	private static final Logger logger = LoggerFactory.getLogger(FileCredentialStore.class);

	static final String DATA_HOME_ENV = "XDG_DATA_HOME";

	private static final String DEFAULT_DOMAIN = "default";

	private static final String SESSIONS_PREFIX = "sessions_";

	private static final String TOKENS_PREFIX = "tokens_";

	private static final String JSON_SUFFIX = ".json";

	private static final TypeReference<LinkedHashMap<String, Session>> SESSIONS_TYPE = new TypeReference<>() {
	};

	private static final TypeReference<LinkedHashMap<String, OAuthToken>> TOKENS_TYPE = new TypeReference<>() {
	};

	private final Path basePath;

	private final ObjectMapper objectMapper;

	private final RefreshLockManager fileLocks;

	/**
	 * Create a file store with a custom path.
	 * @param basePath the directory holding the JSON files, created if missing
	 */
	public FileCredentialStore(Path basePath) {
		this(basePath, new ObjectMapper());
	}

	public FileCredentialStore(Path basePath, ObjectMapper objectMapper) {
		Assert.notNull(basePath, "basePath must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.basePath = basePath.toAbsolutePath().normalize();
		this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
		try {
			Files.createDirectories(this.basePath);
		}
		catch (IOException e) {
			throw new CredentialStoreException("Failed to create storage directory " + this.basePath, e);
		}
		this.fileLocks = new RefreshLockManager(this.basePath.resolve(".locks"));
	}

	/**
	 * Create a file store for an application in the user's data directory:
	 * {@code $XDG_DATA_HOME/<appName>} when the variable is set,
	 * {@code ~/.local/share/<appName>} (or {@code %APPDATA%\<appName>} on Windows)
	 * otherwise.
	 * @param appName the application name
	 * @return the store
	 */
	public static FileCredentialStore forApp(String appName) {
		Assert.hasText(appName, "appName must not be empty");
		return new FileCredentialStore(defaultDataDirectory(System.getenv()).resolve(Utils.sanitizeFileName(appName)));
	}

	static Path defaultDataDirectory(Map<String, String> env) {
		String dataHome = env.get(DATA_HOME_ENV);
		if (Utils.hasText(dataHome)) {
			return Paths.get(dataHome);
		}
		String appData = env.get("APPDATA");
		if (System.getProperty("os.name", "").startsWith("Windows") && Utils.hasText(appData)) {
			return Paths.get(appData);
		}
		return Paths.get(System.getProperty("user.home"), ".local", "share");
	}

	public Path getBasePath() {
		return basePath;
	}

	@Override
	public void saveSession(String state, Session session) {
		String domain = Utils.hasText(session.getDomain()) ? session.getDomain() : DEFAULT_DOMAIN;
		update(sessionsPath(domain), SESSIONS_TYPE, sessions -> {
			sessions.put(state, session);
			return true;
		});
	}

	@Override
	public Optional<Session> getSession(String state) {
		Session session = read(sessionsPath(DEFAULT_DOMAIN), SESSIONS_TYPE).get(state);
		if (session != null) {
			return Optional.of(session);
		}
		for (Path file : listFiles(SESSIONS_PREFIX)) {
			session = read(file, SESSIONS_TYPE).get(state);
			if (session != null) {
				return Optional.of(session);
			}
		}
		return Optional.empty();
	}

	@Override
	public void deleteSession(String state) {
		for (Path file : listFiles(SESSIONS_PREFIX)) {
			if (read(file, SESSIONS_TYPE).containsKey(state)) {
				update(file, SESSIONS_TYPE, sessions -> sessions.remove(state) != null);
				return;
			}
		}
	}

	@Override
	public void saveToken(String key, OAuthToken token) {
		update(tokensPath(domainOf(key)), TOKENS_TYPE, tokens -> {
			tokens.put(key, token);
			return true;
		});
	}

	@Override
	public Optional<OAuthToken> getToken(String key) {
		return Optional.ofNullable(read(tokensPath(domainOf(key)), TOKENS_TYPE).get(key));
	}

	@Override
	public void deleteToken(String key) {
		update(tokensPath(domainOf(key)), TOKENS_TYPE, tokens -> tokens.remove(key) != null);
	}

	static String domainOf(String key) {
		int idx = key.indexOf(':');
		return idx > 0 ? key.substring(0, idx) : DEFAULT_DOMAIN;
	}

	Path sessionsPath(String domain) {
		return basePath.resolve(SESSIONS_PREFIX + Utils.sanitizeFileName(domain) + JSON_SUFFIX);
	}

	Path tokensPath(String domain) {
		return basePath.resolve(TOKENS_PREFIX + Utils.sanitizeFileName(domain) + JSON_SUFFIX);
	}

	/**
	 * Read-modify-write of one file under its lock. The mutation returns whether it
	 * changed anything; unchanged maps are not written back.
	 */
	private <V> void update(Path file, TypeReference<LinkedHashMap<String, V>> type,
			Function<Map<String, V>, Boolean> mutation) {
		fileLocks.withLock(file.getFileName().toString(), () -> {
			Map<String, V> entries = read(file, type);
			if (mutation.apply(entries)) {
				write(file, entries);
			}
			return null;
		});
	}

	private <V> Map<String, V> read(Path file, TypeReference<LinkedHashMap<String, V>> type) {
		if (!Files.exists(file)) {
			return new LinkedHashMap<>();
		}
		try {
			return objectMapper.readValue(file.toFile(), type);
		}
		catch (IOException e) {
			throw new CredentialStoreException("Failed to read " + file, e);
		}
	}

	private void write(Path file, Object content) {
		Path temp = null;
		try {
			temp = Files.createTempFile(basePath, file.getFileName().toString(), ".tmp");
			restrictToOwner(temp);
			objectMapper.writeValue(temp.toFile(), content);
			try {
				Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
			}
		}
		catch (IOException e) {
			deleteQuietly(temp, e);
			throw new CredentialStoreException("Failed to write " + file, e);
		}
	}

	private List<Path> listFiles(String prefix) {
		List<Path> files = new ArrayList<>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(basePath, prefix + "*" + JSON_SUFFIX)) {
			stream.forEach(files::add);
		}
		catch (IOException e) {
			throw new CredentialStoreException("Failed to read storage directory " + basePath, e);
		}
		return files;
	}

	private static void restrictToOwner(Path file) throws IOException {
		try {
			Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
		}
		catch (UnsupportedOperationException e) {
			logger.debug("POSIX permissions not supported for {}", file);
		}
	}

	private static void deleteQuietly(Path temp, IOException failure) {
		if (temp == null) {
			return;
		}
		try {
			Files.deleteIfExists(temp);
		}
		catch (IOException e) {
			failure.addSuppressed(e);
		}
	}

}
