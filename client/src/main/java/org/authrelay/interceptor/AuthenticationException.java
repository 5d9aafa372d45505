package org.authrelay.interceptor;

import org.authrelay.client.AuthRelayClientException;

/**
 * Raised by an {@link AuthenticationInterceptor} when it cannot authenticate a request on its
 * own terms. Errors produced by an {@link Authenticator} refresh are delivered as-is and never
 * wrapped in this type.
 */
public class AuthenticationException extends AuthRelayClientException {

  public enum Reason {
    /** No credential is set on the interceptor. */
    MISSING_CREDENTIAL,
    /** Too many refreshes happened within the refresh safety interval. */
    EXCESSIVE_REFRESH
  }

  private final Reason reason;

  public AuthenticationException(Reason reason) {
    super("Authentication failed: " + reason);
    this.reason = reason;
  }

  public Reason getReason() {
    return reason;
  }
}
