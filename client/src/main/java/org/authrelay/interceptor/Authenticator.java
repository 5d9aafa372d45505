package org.authrelay.interceptor;

import java.util.concurrent.CompletionStage;

import org.apache.http.HttpRequest;
import org.apache.http.HttpResponse;

/**
 * Applies a {@link Credential} to requests and knows how to refresh it. A concrete
 * authentication scheme (OAuth2, API keys, ...) implements this interface and is handed to an
 * {@link AuthenticationInterceptor}, which coordinates when refreshes happen.
 *
 * @param <C> the credential type this authenticator works with
 */
public interface Authenticator<C extends Credential> {

  /**
   * Authenticates the request with the credential. In the case of OAuth2, the access token of
   * the credential would be set as a Bearer token in the {@code Authorization} header.
   */
  void apply(C credential, HttpRequest request);

  /**
   * Refreshes the credential. The returned stage must complete exactly once, either with the new
   * credential or exceptionally. It may complete on any thread.
   */
  CompletionStage<C> refresh(C credential);

  /**
   * Returns whether the request failed because the authentication server rejected its
   * credential, based on the response and the error.
   *
   * <p>Only return true when the authentication layer itself rejected the request. If a
   * downstream service also answers 401 when the caller is not authorized for an operation,
   * treating that as an authentication failure would trigger a pointless refresh. If the server
   * never rejects non-expired credentials, it is safe to always return false.
   *
   * @param request the request as it was sent, may be null
   * @param response the response received, may be null if no response arrived
   * @param error the error the request failed with
   */
  boolean didRequestFailDueToAuthenticationError(
      HttpRequest request, HttpResponse response, Exception error);

  /**
   * Returns whether the request was authenticated with the given credential. If it was not, the
   * request was sent with a previous credential and can be retried right away with the current
   * one, without triggering another refresh.
   */
  boolean isRequestAuthenticatedWith(HttpRequest request, C credential);
}
