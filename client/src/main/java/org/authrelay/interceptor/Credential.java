package org.authrelay.interceptor;

/**
 * An opaque value used to authenticate outgoing requests. Implementations are expected to be
 * immutable: a refreshed credential replaces the previous instance rather than mutating it.
 */
public interface Credential {

  /**
   * Whether the credential must be refreshed before it is applied to another request. For an
   * OAuth2 access token this is typically true shortly before the token expires.
   */
  boolean requiresRefresh();
}
