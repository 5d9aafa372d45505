package org.authrelay.oauth2;

/** Where and as whom to request OAuth2 tokens. */
public final class OAuth2Settings {
  private final String tokenUrl;
  private final String clientId;
  private final String clientSecret;
  private final String scope;
  private final boolean shouldIgnoreTlsVerification;

  public OAuth2Settings(
      String tokenUrl,
      String clientId,
      String clientSecret,
      String scope,
      boolean shouldIgnoreTlsVerification) {
    if (tokenUrl == null) {
      throw new IllegalArgumentException("tokenUrl must not be null");
    }
    this.tokenUrl = tokenUrl;
    this.clientId = clientId;
    this.clientSecret = clientSecret;
    this.scope = scope;
    this.shouldIgnoreTlsVerification = shouldIgnoreTlsVerification;
  }

  /** Token endpoint of the authorization server, e.g. https://auth.example.com/oauth2/token. */
  public String getTokenUrl() {
    return tokenUrl;
  }

  public String getClientId() {
    return clientId;
  }

  /** May be null for public clients. */
  public String getClientSecret() {
    return clientSecret;
  }

  /** Scope to request on refresh, or null to keep the originally granted scope. */
  public String getScope() {
    return scope;
  }

  /**
   * If true, the token endpoint's hostname and TLS certificate are not verified. This is useful
   * for certain testing situations, but should never be true in production.
   */
  public boolean shouldIgnoreTlsVerification() {
    return shouldIgnoreTlsVerification;
  }
}
