package org.authrelay.interceptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.apache.http.Header;
import org.apache.http.HttpRequest;
import org.apache.http.HttpResponse;
import org.apache.http.message.BasicHttpRequest;
import org.testng.Assert;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import org.authrelay.interceptor.AuthenticationException.Reason;

public class AuthenticationInterceptorTest {

  static class TestCredential implements Credential {
    final String value;
    final boolean requiresRefresh;

    TestCredential(String value, boolean requiresRefresh) {
      this.value = value;
      this.requiresRefresh = requiresRefresh;
    }

    @Override
    public boolean requiresRefresh() {
      return requiresRefresh;
    }
  }

  static class TestAuthenticator implements Authenticator<TestCredential> {
    final List<CompletableFuture<TestCredential>> refreshes =
      Collections.synchronizedList(new ArrayList<>());
    volatile boolean authenticationFailure = true;

    @Override
    public void apply(TestCredential credential, HttpRequest request) {
      request.setHeader("Authorization", credential.value);
    }

    @Override
    public CompletionStage<TestCredential> refresh(TestCredential credential) {
      CompletableFuture<TestCredential> refresh = new CompletableFuture<>();
      refreshes.add(refresh);
      return refresh;
    }

    @Override
    public boolean didRequestFailDueToAuthenticationError(
        HttpRequest request, HttpResponse response, Exception error) {
      return authenticationFailure;
    }

    @Override
    public boolean isRequestAuthenticatedWith(HttpRequest request, TestCredential credential) {
      Header header = request.getFirstHeader("Authorization");
      return header != null && header.getValue().equals(credential.value);
    }

    CompletableFuture<TestCredential> lastRefresh() {
      return refreshes.get(refreshes.size() - 1);
    }
  }

  /** Holds drain tasks until the test runs them. */
  static class QueueingExecutor implements Executor {
    final List<Runnable> tasks = new ArrayList<>();

    @Override
    public synchronized void execute(Runnable command) {
      tasks.add(command);
    }

    synchronized void runAll() {
      List<Runnable> pending = new ArrayList<>(tasks);
      tasks.clear();
      pending.forEach(Runnable::run);
    }
  }

  static class ManualClock extends Clock {
    private Instant now;

    ManualClock(Instant start) {
      this.now = start;
    }

    void advance(Duration duration) {
      now = now.plus(duration);
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

  private static final TestCredential VALID = new TestCredential("token-1", false);
  private static final TestCredential EXPIRED = new TestCredential("token-expired", true);
  private static final TestCredential REFRESHED = new TestCredential("token-2", false);

  private TestAuthenticator authenticator;
  private QueueingExecutor executor;
  private ManualClock clock;

  @BeforeMethod
  public void beforeEach() {
    authenticator = new TestAuthenticator();
    executor = new QueueingExecutor();
    clock = new ManualClock(Instant.parse("2024-05-01T12:00:00Z"));
  }

  private AuthenticationInterceptor<TestCredential> newInterceptor(TestCredential credential) {
    return new AuthenticationInterceptor<>(authenticator, credential, clock, executor);
  }

  private static HttpRequest newRequest(String path) {
    return new BasicHttpRequest("GET", path);
  }

  private static String authorization(HttpRequest request) {
    return request.getFirstHeader("Authorization").getValue();
  }

  @Test
  public void testAdaptAppliesCurrentCredential() throws Exception {
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(VALID);
    HttpRequest request = newRequest("/runs");

    CompletableFuture<HttpRequest> adapted = interceptor.adapt(request, null);

    Assert.assertTrue(adapted.isDone());
    Assert.assertSame(adapted.get(), request);
    Assert.assertEquals(authorization(request), "token-1");
    Assert.assertTrue(authenticator.refreshes.isEmpty());
  }

  @Test
  public void testAdaptFailsWithoutCredential() {
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(null);

    CompletableFuture<HttpRequest> adapted = interceptor.adapt(newRequest("/runs"), null);

    Assert.assertTrue(adapted.isCompletedExceptionally());
    Throwable error = Assert.expectThrows(Exception.class, adapted::join).getCause();
    Assert.assertTrue(error instanceof AuthenticationException, String.valueOf(error));
    Assert.assertEquals(((AuthenticationException) error).getReason(), Reason.MISSING_CREDENTIAL);
  }

  @Test
  public void testRetryFailsWithoutCredential() {
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(null);

    RetryResult result = interceptor.retry(newRequest("/runs"), null, null,
      new IllegalStateException("401")).join();

    Assert.assertEquals(result.getKind(), RetryResult.Kind.DO_NOT_RETRY_WITH_ERROR);
    Assert.assertEquals(((AuthenticationException) result.getError()).getReason(),
      Reason.MISSING_CREDENTIAL);
  }

  @Test
  public void testRetryIgnoresFailuresThatAreNotAuthenticationErrors() {
    authenticator.authenticationFailure = false;
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(VALID);
    HttpRequest request = newRequest("/runs");
    interceptor.adapt(request, null).join();

    RetryResult result = interceptor.retry(request, null, null,
      new IllegalStateException("500")).join();

    Assert.assertEquals(result.getKind(), RetryResult.Kind.DO_NOT_RETRY);
    Assert.assertTrue(authenticator.refreshes.isEmpty());
  }

  @Test
  public void testRequestSentWithPreviousCredentialIsRetriedImmediately() {
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(VALID);
    HttpRequest request = newRequest("/runs");
    interceptor.adapt(request, null).join();

    // The credential moved on while the request was in flight.
    interceptor.setCredential(REFRESHED);
    CompletableFuture<RetryResult> result = interceptor.retry(request, null, null,
      new IllegalStateException("401"));

    Assert.assertTrue(result.isDone());
    Assert.assertEquals(result.join().getKind(), RetryResult.Kind.RETRY);
    Assert.assertTrue(authenticator.refreshes.isEmpty());
    Assert.assertFalse(interceptor.isRefreshing());
  }

  /** Replaces the interceptor's credential while the request's credential is being checked. */
  private AuthenticationInterceptor<TestCredential> newInterceptorReplacingCredentialWith(
      TestCredential replacement) {
    AtomicReference<AuthenticationInterceptor<TestCredential>> interceptor =
      new AtomicReference<>();
    authenticator = new TestAuthenticator() {
      @Override
      public boolean isRequestAuthenticatedWith(HttpRequest request, TestCredential credential) {
        boolean authenticated = super.isRequestAuthenticatedWith(request, credential);
        interceptor.get().setCredential(replacement);
        return authenticated;
      }
    };
    interceptor.set(newInterceptor(VALID));
    return interceptor.get();
  }

  @Test
  public void testRetryRechecksCredentialReplacedByConcurrentRefresh() {
    AuthenticationInterceptor<TestCredential> interceptor =
      newInterceptorReplacingCredentialWith(REFRESHED);
    HttpRequest request = newRequest("/runs");
    request.setHeader("Authorization", "token-1");

    CompletableFuture<RetryResult> result = interceptor.retry(request, null, null,
      new IllegalStateException("401"));

    Assert.assertTrue(result.isDone());
    Assert.assertEquals(result.join().getKind(), RetryResult.Kind.RETRY);
    Assert.assertTrue(authenticator.refreshes.isEmpty());
    Assert.assertFalse(interceptor.isRefreshing());
    Assert.assertSame(interceptor.getCredential(), REFRESHED);
  }

  @Test
  public void testRetryRechecksCredentialClearedConcurrently() {
    AuthenticationInterceptor<TestCredential> interceptor =
      newInterceptorReplacingCredentialWith(null);
    HttpRequest request = newRequest("/runs");
    request.setHeader("Authorization", "token-1");

    CompletableFuture<RetryResult> result = interceptor.retry(request, null, null,
      new IllegalStateException("401"));

    Assert.assertTrue(result.isDone());
    Assert.assertEquals(result.join().getKind(), RetryResult.Kind.DO_NOT_RETRY_WITH_ERROR);
    Assert.assertEquals(((AuthenticationException) result.join().getError()).getReason(),
      Reason.MISSING_CREDENTIAL);
    Assert.assertTrue(authenticator.refreshes.isEmpty());
    Assert.assertFalse(interceptor.isRefreshing());
  }

  @Test
  public void testRetryWithLatestCredentialTriggersRefresh() {
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(VALID);
    HttpRequest request = newRequest("/runs");
    interceptor.adapt(request, null).join();

    CompletableFuture<RetryResult> result = interceptor.retry(request, null, null,
      new IllegalStateException("401"));

    Assert.assertFalse(result.isDone());
    Assert.assertEquals(authenticator.refreshes.size(), 1);
    Assert.assertTrue(interceptor.isRefreshing());

    authenticator.lastRefresh().complete(REFRESHED);
    Assert.assertFalse(result.isDone(), "Waiters must be resumed on the drain executor");
    executor.runAll();

    Assert.assertTrue(result.join().shouldRetry());
    Assert.assertSame(interceptor.getCredential(), REFRESHED);
    Assert.assertFalse(interceptor.isRefreshing());
  }

  @Test
  public void testConcurrentDiscoverersShareOneRefresh() {
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(EXPIRED);

    List<HttpRequest> requests = new ArrayList<>();
    List<CompletableFuture<HttpRequest>> adapted = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      HttpRequest request = newRequest("/runs/" + i);
      requests.add(request);
      adapted.add(interceptor.adapt(request, null));
    }

    Assert.assertEquals(authenticator.refreshes.size(), 1);
    for (CompletableFuture<HttpRequest> future : adapted) {
      Assert.assertFalse(future.isDone());
    }

    authenticator.lastRefresh().complete(REFRESHED);
    executor.runAll();

    Assert.assertEquals(authenticator.refreshes.size(), 1);
    for (int i = 0; i < requests.size(); i++) {
      Assert.assertSame(adapted.get(i).join(), requests.get(i));
      Assert.assertEquals(authorization(requests.get(i)), "token-2");
    }
  }

  @Test
  public void testQueuedRequestsResumeInArrivalOrder() {
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(EXPIRED);
    List<String> adaptOrder = Collections.synchronizedList(new ArrayList<>());
    List<String> retryOrder = Collections.synchronizedList(new ArrayList<>());

    for (String name : new String[] {"w1", "w2", "w3"}) {
      interceptor.adapt(newRequest("/" + name), null).thenRun(() -> adaptOrder.add(name));
    }
    // Retries queue behind the same in-flight refresh.
    HttpRequest sentWithExpired = newRequest("/retry");
    sentWithExpired.setHeader("Authorization", "token-expired");
    for (String name : new String[] {"r1", "r2", "r3"}) {
      interceptor.retry(sentWithExpired, null, null, new IllegalStateException("401"))
        .thenRun(() -> retryOrder.add(name));
    }
    Assert.assertEquals(authenticator.refreshes.size(), 1);

    authenticator.lastRefresh().complete(REFRESHED);
    executor.runAll();

    Assert.assertEquals(adaptOrder, List.of("w1", "w2", "w3"));
    Assert.assertEquals(retryOrder, List.of("r1", "r2", "r3"));
  }

  @Test
  public void testRefreshFailureIsDeliveredToEveryWaiter() {
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(EXPIRED);
    CompletableFuture<HttpRequest> first = interceptor.adapt(newRequest("/a"), null);
    CompletableFuture<HttpRequest> second = interceptor.adapt(newRequest("/b"), null);
    HttpRequest sentWithExpired = newRequest("/c");
    sentWithExpired.setHeader("Authorization", "token-expired");
    CompletableFuture<RetryResult> retry = interceptor.retry(sentWithExpired, null, null,
      new IllegalStateException("401"));

    IllegalStateException refreshError = new IllegalStateException("invalid_grant");
    authenticator.lastRefresh().completeExceptionally(refreshError);
    executor.runAll();

    Assert.assertSame(Assert.expectThrows(Exception.class, first::join).getCause(), refreshError);
    Assert.assertSame(Assert.expectThrows(Exception.class, second::join).getCause(), refreshError);
    Assert.assertEquals(retry.join().getKind(), RetryResult.Kind.DO_NOT_RETRY_WITH_ERROR);
    Assert.assertSame(retry.join().getError(), refreshError);
    Assert.assertFalse(interceptor.isRefreshing());
    Assert.assertSame(interceptor.getCredential(), EXPIRED);
  }

  @Test
  public void testEveryWaiterIsResumedExactlyOnce() {
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(EXPIRED);
    AtomicInteger completions = new AtomicInteger();
    for (int i = 0; i < 5; i++) {
      interceptor.adapt(newRequest("/runs/" + i), null)
        .whenComplete((r, e) -> completions.incrementAndGet());
    }

    authenticator.lastRefresh().complete(REFRESHED);
    executor.runAll();
    Assert.assertEquals(completions.get(), 5);

    // A second refresh cycle must not touch the already drained waiters.
    interceptor.setCredential(EXPIRED);
    interceptor.adapt(newRequest("/later"), null);
    authenticator.lastRefresh().complete(REFRESHED);
    executor.runAll();
    executor.runAll();
    Assert.assertEquals(completions.get(), 5);
    Assert.assertEquals(authenticator.refreshes.size(), 2);
  }

  @Test
  public void testRefreshesBeyondTheAllowedCountAreRejected() {
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(VALID);
    Assert.assertEquals(interceptor.getRefreshCountAllowed(), 5);
    Assert.assertEquals(interceptor.getRefreshSafetyInterval(), Duration.ofSeconds(30));

    for (int i = 0; i < 6; i++) {
      interceptor.setCredential(EXPIRED);
      CompletableFuture<HttpRequest> adapted = interceptor.adapt(newRequest("/runs"), null);
      authenticator.lastRefresh().complete(REFRESHED);
      executor.runAll();
      Assert.assertEquals(authorization(adapted.join()), "token-2");
      clock.advance(Duration.ofSeconds(1));
    }
    Assert.assertEquals(authenticator.refreshes.size(), 6);
    Assert.assertEquals(interceptor.getRefreshTimestamps().size(), 6);

    interceptor.setCredential(EXPIRED);
    CompletableFuture<HttpRequest> rejected = interceptor.adapt(newRequest("/runs"), null);
    executor.runAll();

    Throwable error = Assert.expectThrows(Exception.class, rejected::join).getCause();
    Assert.assertEquals(((AuthenticationException) error).getReason(), Reason.EXCESSIVE_REFRESH);
    Assert.assertEquals(authenticator.refreshes.size(), 6, "No refresh call may be made");
    Assert.assertFalse(interceptor.isRefreshing());

    // Once the earlier refreshes age out of the window, refreshing is allowed again.
    clock.advance(Duration.ofSeconds(30));
    CompletableFuture<HttpRequest> allowed = interceptor.adapt(newRequest("/runs"), null);
    Assert.assertEquals(authenticator.refreshes.size(), 7);
    authenticator.lastRefresh().complete(REFRESHED);
    executor.runAll();
    Assert.assertEquals(authorization(allowed.join()), "token-2");
    Assert.assertEquals(interceptor.getRefreshTimestamps().size(), 1);
  }

  @Test
  public void testExcessiveRefreshFailsQueuedRetry() {
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(VALID);
    interceptor.setRefreshCountAllowed(0);
    HttpRequest request = newRequest("/runs");
    interceptor.adapt(request, null).join();

    interceptor.retry(request, null, null, new IllegalStateException("401"));
    authenticator.lastRefresh().complete(REFRESHED);
    executor.runAll();

    interceptor.adapt(request, null).join();
    CompletableFuture<RetryResult> result = interceptor.retry(request, null, null,
      new IllegalStateException("401"));
    executor.runAll();

    Assert.assertEquals(result.join().getKind(), RetryResult.Kind.DO_NOT_RETRY_WITH_ERROR);
    Assert.assertEquals(((AuthenticationException) result.join().getError()).getReason(),
      Reason.EXCESSIVE_REFRESH);
    Assert.assertEquals(authenticator.refreshes.size(), 1);
  }

  @Test
  public void testAuthenticatorThrowingFromRefreshFailsWaiters() {
    IllegalStateException boom = new IllegalStateException("token endpoint misconfigured");
    Authenticator<TestCredential> throwing = new TestAuthenticator() {
      @Override
      public CompletionStage<TestCredential> refresh(TestCredential credential) {
        throw boom;
      }
    };
    AuthenticationInterceptor<TestCredential> interceptor =
      new AuthenticationInterceptor<>(throwing, EXPIRED, clock, executor);

    CompletableFuture<HttpRequest> adapted = interceptor.adapt(newRequest("/runs"), null);
    executor.runAll();

    Assert.assertSame(Assert.expectThrows(Exception.class, adapted::join).getCause(), boom);
    Assert.assertFalse(interceptor.isRefreshing());
  }

  @Test
  public void testRefreshCompletingSynchronouslyDoesNotDeadlock() throws Exception {
    Authenticator<TestCredential> immediate = new TestAuthenticator() {
      @Override
      public CompletionStage<TestCredential> refresh(TestCredential credential) {
        return CompletableFuture.completedFuture(REFRESHED);
      }
    };
    AuthenticationInterceptor<TestCredential> interceptor =
      new AuthenticationInterceptor<>(immediate, EXPIRED, clock, Runnable::run);

    HttpRequest request = newRequest("/runs");
    HttpRequest adapted = interceptor.adapt(request, null).get(5, TimeUnit.SECONDS);

    Assert.assertEquals(authorization(adapted), "token-2");
    Assert.assertFalse(interceptor.isRefreshing());
  }

  @Test
  public void testConcurrentAdaptsFromManyThreads() throws Exception {
    ExecutorService callers = Executors.newFixedThreadPool(8);
    ExecutorService drain = Executors.newSingleThreadExecutor();
    try {
      AuthenticationInterceptor<TestCredential> interceptor =
        new AuthenticationInterceptor<>(authenticator, EXPIRED, clock, drain);
      CountDownLatch start = new CountDownLatch(1);
      List<Future<CompletableFuture<HttpRequest>>> submitted = new ArrayList<>();
      for (int i = 0; i < 64; i++) {
        HttpRequest request = newRequest("/runs/" + i);
        submitted.add(callers.submit(() -> {
          start.await();
          return interceptor.adapt(request, null);
        }));
      }
      start.countDown();

      List<CompletableFuture<HttpRequest>> adapted = new ArrayList<>();
      for (Future<CompletableFuture<HttpRequest>> future : submitted) {
        adapted.add(future.get(5, TimeUnit.SECONDS));
      }
      Assert.assertEquals(authenticator.refreshes.size(), 1);

      authenticator.lastRefresh().complete(REFRESHED);
      for (CompletableFuture<HttpRequest> future : adapted) {
        Assert.assertEquals(authorization(future.get(5, TimeUnit.SECONDS)), "token-2");
      }
      Assert.assertEquals(authenticator.refreshes.size(), 1);
    } finally {
      callers.shutdownNow();
      drain.shutdownNow();
    }
  }

  @Test
  public void testConfigurationValidation() {
    AuthenticationInterceptor<TestCredential> interceptor = newInterceptor(VALID);
    interceptor.setRefreshSafetyInterval(Duration.ofMinutes(1));
    interceptor.setRefreshCountAllowed(2);
    Assert.assertEquals(interceptor.getRefreshSafetyInterval(), Duration.ofMinutes(1));
    Assert.assertEquals(interceptor.getRefreshCountAllowed(), 2);

    Assert.expectThrows(IllegalArgumentException.class,
      () -> interceptor.setRefreshCountAllowed(-1));
    Assert.expectThrows(IllegalArgumentException.class,
      () -> interceptor.setRefreshSafetyInterval(Duration.ofSeconds(-1)));
    Assert.expectThrows(IllegalArgumentException.class,
      () -> new AuthenticationInterceptor<TestCredential>(null));
  }
}
