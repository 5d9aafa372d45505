package org.authrelay.oauth2;

import java.util.concurrent.CompletionStage;

import org.apache.http.Header;
import org.apache.http.HttpHeaders;
import org.apache.http.HttpRequest;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;

import org.authrelay.client.AuthRelayHttpException;
import org.authrelay.interceptor.Authenticator;

/**
 * Authenticates requests with an OAuth2 bearer token.
 *
 * <p>A failure counts as an authentication error only when the server answered 401, so this
 * authenticator should only be used against services whose 401 responses come from the
 * authorization layer.
 */
public class BearerTokenAuthenticator implements Authenticator<OAuth2Credential> {

  private final TokenRefresher tokenRefresher;

  public BearerTokenAuthenticator(TokenRefresher tokenRefresher) {
    this.tokenRefresher = tokenRefresher;
  }

  @Override
  public void apply(OAuth2Credential credential, HttpRequest request) {
    request.setHeader(HttpHeaders.AUTHORIZATION, credential.getAuthorizationHeader());
  }

  @Override
  public CompletionStage<OAuth2Credential> refresh(OAuth2Credential credential) {
    return tokenRefresher.refresh(credential);
  }

  @Override
  public boolean didRequestFailDueToAuthenticationError(
      HttpRequest request, HttpResponse response, Exception error) {
    if (response != null && response.getStatusLine() != null) {
      return response.getStatusLine().getStatusCode() == HttpStatus.SC_UNAUTHORIZED;
    }
    return error instanceof AuthRelayHttpException
      && ((AuthRelayHttpException) error).isUnauthorized();
  }

  @Override
  public boolean isRequestAuthenticatedWith(HttpRequest request, OAuth2Credential credential) {
    if (request == null) {
      return false;
    }
    Header header = request.getFirstHeader(HttpHeaders.AUTHORIZATION);
    return header != null && credential.getAuthorizationHeader().equals(header.getValue());
  }
}
