package org.authrelay.oauth2;

import java.util.concurrent.CompletionStage;

/** Exchanges an OAuth2 credential for a new one, typically via the refresh_token grant. */
public interface TokenRefresher {

  /**
   * Returns a stage that completes with the renewed credential, or exceptionally if the
   * authorization server refused the refresh.
   */
  CompletionStage<OAuth2Credential> refresh(OAuth2Credential credential);
}
