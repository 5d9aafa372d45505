package org.authrelay.interceptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import org.apache.http.HttpRequest;
import org.apache.http.HttpResponse;
import org.apache.http.protocol.HttpContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.authrelay.interceptor.AuthenticationException.Reason;

/**
 * Attaches a {@link Credential} to outgoing requests and coordinates refreshing it.
 *
 * <p>Any number of threads may call {@link #adapt} and {@link #retry} concurrently. At most one
 * {@link Authenticator#refresh} call is outstanding at a time: requests that need the credential
 * while it is being refreshed are queued and resumed, in the order they arrived, once the refresh
 * completes. On success queued requests are authenticated with the new credential and queued
 * retries are told to retry; on failure every queued caller receives the refresh error.
 *
 * <p>To protect against a credential that can never be refreshed successfully, refreshes are
 * rate limited: once more than {@link #getRefreshCountAllowed()} refreshes have happened within
 * {@link #getRefreshSafetyInterval()}, further refreshes fail immediately with
 * {@link Reason#EXCESSIVE_REFRESH}.
 *
 * <p>The state lock is only held while deciding what to do. Authenticator calls, future
 * completions and the resumption of queued callers all happen after it is released, and queued
 * callers are resumed on a separate executor so that re-adapting them cannot re-enter the lock
 * from inside a critical section.
 *
 * @param <C> the credential type
 */
public class AuthenticationInterceptor<C extends Credential> {
  private static final Logger logger = LoggerFactory.getLogger(AuthenticationInterceptor.class);

  public static final Duration DEFAULT_REFRESH_SAFETY_INTERVAL = Duration.ofSeconds(30);
  public static final int DEFAULT_REFRESH_COUNT_ALLOWED = 5;

  private final Authenticator<C> authenticator;
  private final Clock clock;
  private final Executor drainExecutor;

  private final ReentrantLock lock = new ReentrantLock();

  // Everything below is guarded by lock.
  private C credential;
  private boolean isRefreshing = false;
  private final Deque<Instant> refreshTimestamps = new ArrayDeque<>();
  private Duration refreshSafetyInterval = DEFAULT_REFRESH_SAFETY_INTERVAL;
  private int refreshCountAllowed = DEFAULT_REFRESH_COUNT_ALLOWED;
  private List<AdaptOperation> adaptOperations = new ArrayList<>();
  private List<CompletableFuture<RetryResult>> requestsToRetry = new ArrayList<>();

  private static final class AdaptOperation {
    final HttpRequest request;
    final HttpContext context;
    final CompletableFuture<HttpRequest> future;

    AdaptOperation(HttpRequest request, HttpContext context,
                   CompletableFuture<HttpRequest> future) {
      this.request = request;
      this.context = context;
      this.future = future;
    }
  }

  /** Create an interceptor with no credential; one must be set before requests can be sent. */
  public AuthenticationInterceptor(Authenticator<C> authenticator) {
    this(authenticator, null);
  }

  public AuthenticationInterceptor(Authenticator<C> authenticator, C credential) {
    this(authenticator, credential, Clock.systemUTC(), ForkJoinPool.commonPool());
  }

  /**
   * @param clock source of refresh timestamps for rate limiting.
   * @param drainExecutor executor on which queued callers are resumed after a refresh.
   */
  @VisibleForTesting
  AuthenticationInterceptor(Authenticator<C> authenticator,
                            C credential,
                            Clock clock,
                            Executor drainExecutor) {
    if (authenticator == null) {
      throw new IllegalArgumentException("authenticator must not be null");
    }
    this.authenticator = authenticator;
    this.credential = credential;
    this.clock = clock;
    this.drainExecutor = drainExecutor;
  }

  /**
   * Authenticate a request before it is sent.
   *
   * <p>The returned future completes with the same request once the current credential has been
   * applied to it. If the credential has to be refreshed first, it completes after the refresh,
   * either with the request authenticated by the new credential or exceptionally with the
   * refresh error. It fails with an {@link AuthenticationException} if no credential is set.
   */
  public CompletableFuture<HttpRequest> adapt(HttpRequest request, HttpContext context) {
    CompletableFuture<HttpRequest> future = new CompletableFuture<>();
    List<Runnable> afterUnlock = new ArrayList<>();
    C adaptWith = null;
    AuthenticationException failure = null;

    lock.lock();
    try {
      if (isRefreshing) {
        adaptOperations.add(new AdaptOperation(request, context, future));
      } else if (credential == null) {
        failure = new AuthenticationException(Reason.MISSING_CREDENTIAL);
      } else if (credential.requiresRefresh()) {
        adaptOperations.add(new AdaptOperation(request, context, future));
        refreshInsideLock(afterUnlock);
      } else {
        adaptWith = credential;
      }
    } finally {
      lock.unlock();
    }

    afterUnlock.forEach(Runnable::run);
    if (adaptWith != null) {
      try {
        authenticator.apply(adaptWith, request);
        future.complete(request);
      } catch (RuntimeException e) {
        future.completeExceptionally(e);
      }
    } else if (failure != null) {
      future.completeExceptionally(failure);
    } else {
      logger.debug("Deferring {} until the credential refresh completes",
                   request.getRequestLine());
    }
    return future;
  }

  /**
   * Decide whether a failed request should be retried.
   *
   * <p>Failures the {@link Authenticator} does not classify as authentication errors yield
   * {@link RetryResult#doNotRetry()}. A request that was authenticated with an older credential
   * is retried right away. Otherwise the request was rejected with the latest credential: the
   * verdict is deferred until a refresh (started now if none is in flight) completes.
   *
   * @param request the request as it was sent
   * @param response the response received, or null
   * @param error the error the request failed with
   */
  public CompletableFuture<RetryResult> retry(HttpRequest request,
                                              HttpResponse response,
                                              HttpContext context,
                                              Exception error) {
    C current = getCredential();
    if (current == null) {
      return CompletableFuture.completedFuture(
        RetryResult.doNotRetryWithError(new AuthenticationException(Reason.MISSING_CREDENTIAL)));
    }

    if (!authenticator.didRequestFailDueToAuthenticationError(request, response, error)) {
      return CompletableFuture.completedFuture(RetryResult.doNotRetry());
    }

    if (!authenticator.isRequestAuthenticatedWith(request, current)) {
      logger.debug("{} was sent with a previous credential, retrying", request.getRequestLine());
      return CompletableFuture.completedFuture(RetryResult.retry());
    }

    CompletableFuture<RetryResult> future = new CompletableFuture<>();
    List<Runnable> afterUnlock = new ArrayList<>();
    RetryResult immediate = null;

    lock.lock();
    try {
      if (isRefreshing) {
        requestsToRetry.add(future);
      } else if (credential == null) {
        immediate = RetryResult.doNotRetryWithError(
          new AuthenticationException(Reason.MISSING_CREDENTIAL));
      } else if (credential != current) {
        // A refresh finished after the credential check above.
        immediate = RetryResult.retry();
      } else {
        requestsToRetry.add(future);
        refreshInsideLock(afterUnlock);
      }
    } finally {
      lock.unlock();
    }

    afterUnlock.forEach(Runnable::run);
    if (immediate != null) {
      future.complete(immediate);
    }
    return future;
  }

  /**
   * Start a refresh of the current credential, or fail every queued caller if refreshing is
   * excessive. Work that must happen outside the lock is appended to {@code afterUnlock}.
   */
  private void refreshInsideLock(List<Runnable> afterUnlock) {
    if (isRefreshExcessiveInsideLock()) {
      logger.warn("More than {} credential refreshes within {}, failing {} queued request(s)",
                  refreshCountAllowed,
                  refreshSafetyInterval,
                  adaptOperations.size() + requestsToRetry.size());
      Runnable drain = handleRefreshFailureInsideLock(
        new AuthenticationException(Reason.EXCESSIVE_REFRESH));
      afterUnlock.add(() -> dispatch(drain));
      return;
    }

    Instant now = clock.instant();
    Instant last = refreshTimestamps.peekLast();
    refreshTimestamps.addLast(last != null && last.isAfter(now) ? last : now);
    isRefreshing = true;

    C refreshing = credential;
    afterUnlock.add(() -> startRefresh(refreshing));
  }

  /**
   * Counts the refreshes within the safety interval and drops the ones that have fallen out of
   * it.
   */
  private boolean isRefreshExcessiveInsideLock() {
    Instant windowStart = clock.instant().minus(refreshSafetyInterval);
    while (!refreshTimestamps.isEmpty() && refreshTimestamps.peekFirst().isBefore(windowStart)) {
      refreshTimestamps.pollFirst();
    }
    return refreshTimestamps.size() > refreshCountAllowed;
  }

  private void startRefresh(C refreshing) {
    logger.debug("Refreshing credential");
    CompletionStage<C> stage;
    try {
      stage = authenticator.refresh(refreshing);
      if (stage == null) {
        throw new IllegalStateException("Authenticator returned no refresh result");
      }
    } catch (RuntimeException e) {
      CompletableFuture<C> failed = new CompletableFuture<>();
      failed.completeExceptionally(e);
      stage = failed;
    }
    stage.whenComplete(this::onRefreshComplete);
  }

  private void onRefreshComplete(C refreshed, Throwable error) {
    Runnable drain;
    lock.lock();
    try {
      if (error != null) {
        drain = handleRefreshFailureInsideLock(unwrap(error));
      } else if (refreshed == null) {
        drain = handleRefreshFailureInsideLock(
          new IllegalStateException("Authenticator refreshed to a null credential"));
      } else {
        drain = handleRefreshSuccessInsideLock(refreshed);
      }
    } finally {
      lock.unlock();
    }
    dispatch(drain);
  }

  private Runnable handleRefreshSuccessInsideLock(C refreshed) {
    credential = refreshed;

    List<AdaptOperation> adapts = ImmutableList.copyOf(adaptOperations);
    List<CompletableFuture<RetryResult>> retries = ImmutableList.copyOf(requestsToRetry);
    adaptOperations = new ArrayList<>();
    requestsToRetry = new ArrayList<>();
    isRefreshing = false;

    logger.debug("Credential refreshed, resuming {} request(s) and {} retry(s)",
                 adapts.size(), retries.size());
    return () -> {
      for (AdaptOperation operation : adapts) {
        adapt(operation.request, operation.context).whenComplete((request, e) -> {
          if (e != null) {
            operation.future.completeExceptionally(unwrap(e));
          } else {
            operation.future.complete(request);
          }
        });
      }
      for (CompletableFuture<RetryResult> retry : retries) {
        retry.complete(RetryResult.retry());
      }
    };
  }

  private Runnable handleRefreshFailureInsideLock(Throwable error) {
    List<AdaptOperation> adapts = ImmutableList.copyOf(adaptOperations);
    List<CompletableFuture<RetryResult>> retries = ImmutableList.copyOf(requestsToRetry);
    adaptOperations = new ArrayList<>();
    requestsToRetry = new ArrayList<>();
    isRefreshing = false;

    if (!(error instanceof AuthenticationException)) {
      logger.warn("Credential refresh failed, failing {} request(s) and {} retry(s)",
                  adapts.size(), retries.size(), error);
    }
    return () -> {
      for (AdaptOperation operation : adapts) {
        operation.future.completeExceptionally(error);
      }
      for (CompletableFuture<RetryResult> retry : retries) {
        retry.complete(RetryResult.doNotRetryWithError(error));
      }
    };
  }

  /** Resume queued callers on the drain executor; must not be called with the lock held. */
  private void dispatch(Runnable drain) {
    try {
      drainExecutor.execute(drain);
    } catch (RejectedExecutionException e) {
      logger.warn("Drain executor rejected queued requests, resuming them on the caller thread",
                  e);
      drain.run();
    }
  }

  private static Throwable unwrap(Throwable error) {
    if ((error instanceof CompletionException || error instanceof ExecutionException)
        && error.getCause() != null) {
      return error.getCause();
    }
    return error;
  }

  public C getCredential() {
    lock.lock();
    try {
      return credential;
    } finally {
      lock.unlock();
    }
  }

  /** Replace the current credential, e.g. after the user logs in again. */
  public void setCredential(C credential) {
    lock.lock();
    try {
      this.credential = credential;
    } finally {
      lock.unlock();
    }
  }

  public Duration getRefreshSafetyInterval() {
    lock.lock();
    try {
      return refreshSafetyInterval;
    } finally {
      lock.unlock();
    }
  }

  public void setRefreshSafetyInterval(Duration refreshSafetyInterval) {
    if (refreshSafetyInterval == null || refreshSafetyInterval.isNegative()) {
      throw new IllegalArgumentException("refreshSafetyInterval must be non-negative");
    }
    lock.lock();
    try {
      this.refreshSafetyInterval = refreshSafetyInterval;
    } finally {
      lock.unlock();
    }
  }

  public int getRefreshCountAllowed() {
    lock.lock();
    try {
      return refreshCountAllowed;
    } finally {
      lock.unlock();
    }
  }

  public void setRefreshCountAllowed(int refreshCountAllowed) {
    if (refreshCountAllowed < 0) {
      throw new IllegalArgumentException("refreshCountAllowed must be non-negative");
    }
    lock.lock();
    try {
      this.refreshCountAllowed = refreshCountAllowed;
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  boolean isRefreshing() {
    lock.lock();
    try {
      return isRefreshing;
    } finally {
      lock.unlock();
    }
  }

  @VisibleForTesting
  List<Instant> getRefreshTimestamps() {
    lock.lock();
    try {
      return ImmutableList.copyOf(refreshTimestamps);
    } finally {
      lock.unlock();
    }
  }
}
