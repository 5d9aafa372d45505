package org.authrelay.interceptor;

/** Verdict on whether a failed request should be sent again. */
public final class RetryResult {

  public enum Kind {
    RETRY,
    DO_NOT_RETRY,
    DO_NOT_RETRY_WITH_ERROR
  }

  private static final RetryResult RETRY = new RetryResult(Kind.RETRY, null);
  private static final RetryResult DO_NOT_RETRY = new RetryResult(Kind.DO_NOT_RETRY, null);

  private final Kind kind;
  private final Throwable error;

  private RetryResult(Kind kind, Throwable error) {
    this.kind = kind;
    this.error = error;
  }

  /** The request should be re-adapted and sent again. */
  public static RetryResult retry() {
    return RETRY;
  }

  /** The failure is not an authentication concern; the original error stands. */
  public static RetryResult doNotRetry() {
    return DO_NOT_RETRY;
  }

  /** The request must not be retried and should fail with the given error instead. */
  public static RetryResult doNotRetryWithError(Throwable error) {
    if (error == null) {
      throw new IllegalArgumentException("error must not be null");
    }
    return new RetryResult(Kind.DO_NOT_RETRY_WITH_ERROR, error);
  }

  public Kind getKind() {
    return kind;
  }

  /** @return the error for {@link Kind#DO_NOT_RETRY_WITH_ERROR}, otherwise null. */
  public Throwable getError() {
    return error;
  }

  public boolean shouldRetry() {
    return kind == Kind.RETRY;
  }

  @Override
  public String toString() {
    return error == null ? kind.toString() : kind + "(" + error + ")";
  }
}
