/*
 * Copyright 2025-2026 the original author or authors.
 */

package io.latchkey.client.auth;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;

import io.latchkey.auth.OAuthToken;
import io.latchkey.client.lock.RefreshLockManager;
import io.latchkey.client.storage.CredentialStore;
import io.latchkey.client.storage.FileCredentialStore;
import io.latchkey.client.storage.InMemoryCredentialStore;
import io.latchkey.client.transport.HttpFormResponse;
import io.latchkey.spec.OAuthProtocolException;
import io.latchkey.spec.OAuthStateException;
import io.latchkey.testutil.MutableClock;
import io.latchkey.testutil.RecordingTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class TokenRefresherTests {

	private static final String KEY = "example.com:alice";

	private static final long NOW = 1_700_000_000L;

	private static final String REFRESHED = "{\"access_token\":\"at-2\",\"refresh_token\":\"rt-2\",\"expires_in\":3600}";

	private final MutableClock clock = MutableClock.atEpochSecond(NOW);

	private CredentialStore store;

	private RecordingTransport transport;

	@BeforeEach
	void setUp() {
		store = new InMemoryCredentialStore();
		transport = new RecordingTransport().enqueue(200, REFRESHED);
	}

	private OAuthClient client(CredentialStore store, RecordingTransport transport) {
		OAuthConfig config = OAuthConfig.builder("client-1").tokenEndpoint("https://auth.example.com/token").build();
		return OAuthClient.builder(config, store).transport(transport).clock(clock).build();
	}

	private TokenRefresher refresher() {
		return TokenRefresher.create(client(store, transport));
	}

	private static OAuthToken token(String accessToken, long expiresIn, long expiresAt) {
		return new OAuthToken(accessToken, "rt-1", expiresIn, expiresAt);
	}

	@Test
	void ensureFreshReturnsValidTokenWithoutNetworkCall() {
		OAuthToken valid = token("at-1", 3600, NOW + 100);
		store.saveToken(KEY, valid);

		assertThat(refresher().ensureFresh(KEY)).isEqualTo(valid);
		assertThat(transport.requestCount()).isZero();
	}

	@Test
	void ensureFreshRefreshesAndStoresExpiredToken() {
		store.saveToken(KEY, token("at-1", 3600, NOW - 1));

		OAuthToken refreshed = refresher().ensureFresh(KEY);

		assertThat(refreshed.getAccessToken()).isEqualTo("at-2");
		assertThat(refreshed.getExpiresAt()).isEqualTo(NOW + 3600);
		assertThat(store.getToken(KEY)).contains(refreshed);
		assertThat(transport.lastRequest().form()).containsEntry("refresh_token", "rt-1");
	}

	@Test
	void missingTokenAndMissingRefreshTokenAreReported() {
		TokenRefresher refresher = refresher();
		assertThatThrownBy(() -> refresher.ensureFresh(KEY)).isInstanceOfSatisfying(OAuthStateException.class,
				e -> assertThat(e.getKind()).isEqualTo(OAuthStateException.Kind.TOKEN_NOT_FOUND));

		store.saveToken(KEY, new OAuthToken("at-1", null, 3600L, NOW - 1));
		assertThatThrownBy(() -> refresher.ensureFresh(KEY)).isInstanceOfSatisfying(OAuthStateException.class,
				e -> assertThat(e.getKind()).isEqualTo(OAuthStateException.Kind.NO_REFRESH_TOKEN));
		assertThat(transport.requestCount()).isZero();
	}

	@Test
	void currentTokenReportsExpiry() {
		store.saveToken(KEY, token("at-1", 3600, NOW - 1));

		assertThatThrownBy(() -> refresher().currentToken(KEY)).isInstanceOfSatisfying(OAuthStateException.class,
				e -> assertThat(e.getKind()).isEqualTo(OAuthStateException.Kind.TOKEN_EXPIRED));
	}

	@Test
	void thresholdDoesNotRefreshEarlyInLifetime() {
		// 10% of the lifetime has elapsed
		OAuthToken young = token("at-1", 3600, NOW + 3240);
		store.saveToken(KEY, young);
		TokenRefresher refresher = refresher();

		assertThat(refresher.getValidTokenWithThreshold(KEY, 0.8)).isEqualTo(young);
		assertThat(refresher.getValidTokenWithThreshold(KEY, 0.5)).isEqualTo(young);
		assertThat(refresher.getValidTokenWithThreshold(KEY, 1.5)).isEqualTo(young);
		assertThat(refresher.getValidTokenWithThreshold(KEY, Double.NaN)).isEqualTo(young);
		assertThat(transport.requestCount()).isZero();
	}

	@Test
	void thresholdRefreshesLateInLifetime() {
		// 90% of the lifetime has elapsed
		store.saveToken(KEY, token("at-1", 3600, NOW + 360));

		OAuthToken refreshed = refresher().getValidTokenWithThreshold(KEY, 0.8);

		assertThat(refreshed.getAccessToken()).isEqualTo("at-2");
		assertThat(transport.requestCount()).isEqualTo(1);
	}

	@Test
	void thresholdRefreshesExpiredToken() {
		store.saveToken(KEY, token("at-1", 3600, NOW - 10));

		assertThat(refresher().getValidTokenWithThreshold(KEY, 1.0).getAccessToken()).isEqualTo("at-2");
	}

	@Test
	void thresholdIgnoresTokensWithoutLifetime() {
		OAuthToken forever = new OAuthToken("at-1", "rt-1", null, null);
		store.saveToken(KEY, forever);

		assertThat(refresher().getValidTokenWithThreshold(KEY, 0.0)).isEqualTo(forever);
		assertThat(transport.requestCount()).isZero();
	}

	@Test
	void clampsThreshold() {
		assertThat(TokenRefresher.clampThreshold(1.5)).isEqualTo(1.0);
		assertThat(TokenRefresher.clampThreshold(-0.5)).isEqualTo(0.0);
		assertThat(TokenRefresher.clampThreshold(Double.NaN)).isEqualTo(1.0);
		assertThat(TokenRefresher.clampThreshold(0.8)).isEqualTo(0.8);
	}

	@Test
	void forceRefreshIgnoresValidity() {
		store.saveToken(KEY, token("at-1", 3600, NOW + 3600));

		assertThat(refresher().forceRefresh(KEY).getAccessToken()).isEqualTo("at-2");
		assertThat(transport.requestCount()).isEqualTo(1);
	}

	@Test
	void concurrentRefreshesMakeOneNetworkCall() throws Exception {
		store.saveToken(KEY, token("at-1", 3600, NOW - 1));
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		transport = blockingTransport(entered, release, new HttpFormResponse(200, REFRESHED));
		TokenRefresher refresher = refresher();

		int callers = 8;
		AtomicReferenceArray<OAuthToken> results = new AtomicReferenceArray<>(callers);
		List<Thread> threads = new ArrayList<>();
		for (int i = 0; i < callers; i++) {
			int index = i;
			threads.add(new Thread(() -> results.set(index, refresher.ensureFresh(KEY))));
		}
		threads.forEach(Thread::start);

		assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
		// the leader waits in the transport, everybody else on its result
		await().atMost(Duration.ofSeconds(10))
			.until(() -> threads.stream().allMatch(TokenRefresherTests::isParked));
		release.countDown();
		for (Thread thread : threads) {
			thread.join(10_000);
		}

		assertThat(transport.requestCount()).isEqualTo(1);
		OAuthToken stored = store.getToken(KEY).orElseThrow();
		assertThat(stored.getAccessToken()).isEqualTo("at-2");
		for (int i = 0; i < callers; i++) {
			assertThat(results.get(i)).isEqualTo(stored);
		}
		assertThat(refresher.isRefreshing(KEY)).isFalse();
	}

	@Test
	void waitersReceiveTheLeadersFailure() throws Exception {
		store.saveToken(KEY, token("at-1", 3600, NOW - 1));
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		transport = blockingTransport(entered, release,
				new HttpFormResponse(400, "{\"error\":\"invalid_grant\",\"error_description\":\"revoked\"}"));
		TokenRefresher refresher = refresher();

		AtomicReference<Throwable> leaderFailure = new AtomicReference<>();
		AtomicReference<Throwable> waiterFailure = new AtomicReference<>();
		Thread leader = new Thread(() -> capture(() -> refresher.ensureFresh(KEY), leaderFailure));
		leader.start();
		assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

		Thread waiter = new Thread(() -> capture(() -> refresher.awaitRefresh(KEY), waiterFailure));
		waiter.start();
		await().atMost(Duration.ofSeconds(10)).until(() -> isParked(waiter));
		release.countDown();
		leader.join(10_000);
		waiter.join(10_000);

		assertThat(leaderFailure.get()).isInstanceOf(OAuthProtocolException.class);
		assertThat(waiterFailure.get()).isSameAs(leaderFailure.get());
		assertThat(refresher.isRefreshing(KEY)).isFalse();
		assertThat(transport.requestCount()).isEqualTo(1);
		assertThat(store.getToken(KEY).orElseThrow().getAccessToken()).isEqualTo("at-1");
	}

	@Test
	void awaitRefreshWithoutRunningRefreshReturnsStoredToken() {
		OAuthToken valid = token("at-1", 3600, NOW + 100);
		store.saveToken(KEY, valid);

		assertThat(refresher().awaitRefresh(KEY)).isEqualTo(valid);
	}

	@Test
	void secondProcessUsesTokenRefreshedWhileItWaitedForTheLock(@TempDir Path tempDir) throws Exception {
		FileCredentialStore sharedStore = new FileCredentialStore(tempDir.resolve("data"));
		sharedStore.saveToken(KEY, token("at-1", 3600, NOW - 1));
		CountDownLatch entered = new CountDownLatch(1);
		CountDownLatch release = new CountDownLatch(1);
		RecordingTransport firstTransport = blockingTransport(entered, release, new HttpFormResponse(200, REFRESHED));
		RecordingTransport secondTransport = new RecordingTransport().enqueue(200, REFRESHED);

		// separate lock managers and refreshers stand in for two processes
		TokenRefresher first = TokenRefresher.withLockManager(client(sharedStore, firstTransport),
				new RefreshLockManager(tempDir.resolve("locks")));
		TokenRefresher second = TokenRefresher.withLockManager(client(sharedStore, secondTransport),
				new RefreshLockManager(tempDir.resolve("locks")));

		AtomicReference<OAuthToken> firstResult = new AtomicReference<>();
		AtomicReference<OAuthToken> secondResult = new AtomicReference<>();
		Thread firstProcess = new Thread(() -> firstResult.set(first.refreshTokenForKey(KEY)));
		firstProcess.start();
		assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();

		Thread secondProcess = new Thread(() -> secondResult.set(second.refreshTokenForKey(KEY)));
		secondProcess.start();
		await().atMost(Duration.ofSeconds(10)).until(() -> isParked(secondProcess));
		release.countDown();
		firstProcess.join(10_000);
		secondProcess.join(10_000);

		assertThat(firstTransport.requestCount()).isEqualTo(1);
		assertThat(secondTransport.requestCount()).isZero();
		assertThat(firstResult.get().getAccessToken()).isEqualTo("at-2");
		assertThat(secondResult.get()).isEqualTo(firstResult.get());
	}

	@Test
	void refreshTokenForKeyWithoutLocksAlwaysRefreshes() {
		store.saveToken(KEY, token("at-1", 3600, NOW + 3600));

		assertThat(refresher().refreshTokenForKey(KEY).getAccessToken()).isEqualTo("at-2");
		assertThat(transport.requestCount()).isEqualTo(1);
	}

	@Test
	void refreshTokenForKeyUnderLockSkipsValidToken(@TempDir Path tempDir) {
		OAuthToken valid = token("at-1", 3600, NOW + 3600);
		store.saveToken(KEY, valid);
		TokenRefresher refresher = TokenRefresher.builder(client(store, transport))
			.lockManager(new RefreshLockManager(tempDir))
			.build();

		assertThat(refresher.refreshTokenForKey(KEY)).isEqualTo(valid);
		assertThat(transport.requestCount()).isZero();
	}

	@Test
	void forceRefreshUnderLockCallsNetwork(@TempDir Path tempDir) {
		store.saveToken(KEY, token("at-1", 3600, NOW + 3600));
		TokenRefresher refresher = TokenRefresher.withLockManager(client(store, transport),
				new RefreshLockManager(tempDir));

		assertThat(refresher.forceRefresh(KEY).getAccessToken()).isEqualTo("at-2");
		assertThat(tempDir.resolve("example.com_alice.lock")).doesNotExist();
	}

	private static RecordingTransport blockingTransport(CountDownLatch entered, CountDownLatch release,
			HttpFormResponse response) {
		return RecordingTransport.respondingWith(request -> {
			entered.countDown();
			try {
				if (!release.await(10, TimeUnit.SECONDS)) {
					throw new IllegalStateException("transport was never released");
				}
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				throw new IllegalStateException(e);
			}
			return response;
		});
	}

	private static boolean isParked(Thread thread) {
		Thread.State state = thread.getState();
		return state == Thread.State.WAITING || state == Thread.State.TIMED_WAITING;
	}

	private static void capture(Runnable action, AtomicReference<Throwable> failure) {
		try {
			action.run();
		}
		catch (RuntimeException e) {
			failure.set(e);
		}
	}

}
