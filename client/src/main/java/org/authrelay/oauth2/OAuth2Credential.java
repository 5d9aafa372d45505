package org.authrelay.oauth2;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

import com.google.common.annotations.VisibleForTesting;

import org.authrelay.interceptor.Credential;

/**
 * An OAuth2 access token together with the refresh token used to renew it. The credential
 * requires a refresh once it is within {@link #REFRESH_MARGIN} of expiring, or within half of
 * its lifetime for tokens issued for less than twice that margin.
 */
public final class OAuth2Credential implements Credential {
  static final Duration REFRESH_MARGIN = Duration.ofSeconds(30);

  private final String accessToken;
  private final String refreshToken;
  private final Instant expiration;
  private final Instant issuedAt;
  private final Clock clock;

  /**
   * @param refreshToken may be null if the server did not issue one.
   * @param expiration may be null if the access token does not expire.
   */
  public OAuth2Credential(String accessToken, String refreshToken, Instant expiration) {
    this(accessToken, refreshToken, expiration, Clock.systemUTC());
  }

  @VisibleForTesting
  OAuth2Credential(String accessToken, String refreshToken, Instant expiration, Clock clock) {
    if (accessToken == null) {
      throw new IllegalArgumentException("accessToken must not be null");
    }
    this.accessToken = accessToken;
    this.refreshToken = refreshToken;
    this.expiration = expiration;
    this.clock = clock;
    this.issuedAt = clock.instant();
  }

  public String getAccessToken() {
    return accessToken;
  }

  public String getRefreshToken() {
    return refreshToken;
  }

  public Instant getExpiration() {
    return expiration;
  }

  /** Value of the {@code Authorization} header for requests sent with this credential. */
  public String getAuthorizationHeader() {
    return "Bearer " + accessToken;
  }

  @Override
  public boolean requiresRefresh() {
    if (expiration == null) {
      return false;
    }
    return !clock.instant().plus(refreshMargin()).isBefore(expiration);
  }

  @VisibleForTesting
  Duration refreshMargin() {
    Duration halfLifetime = Duration.between(issuedAt, expiration).dividedBy(2);
    if (halfLifetime.isNegative()) {
      return Duration.ZERO;
    }
    return halfLifetime.compareTo(REFRESH_MARGIN) < 0 ? halfLifetime : REFRESH_MARGIN;
  }

  @Override
  public String toString() {
    // Tokens are secrets; keep them out of logs.
    return "OAuth2Credential{expiration=" + expiration
      + ", hasRefreshToken=" + (refreshToken != null) + "}";
  }
}
