package org.authrelay.oauth2;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.KeyManagementException;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

import com.google.common.annotations.VisibleForTesting;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import org.apache.http.HttpHeaders;
import org.apache.http.NameValuePair;
import org.apache.http.client.entity.UrlEncodedFormEntity;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.conn.ssl.TrustSelfSignedStrategy;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.message.BasicNameValuePair;
import org.apache.http.ssl.SSLContextBuilder;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.authrelay.client.AuthRelayClientException;
import org.authrelay.client.AuthRelayClientVersion;
import org.authrelay.client.AuthRelayHttpException;

/**
 * Refreshes OAuth2 credentials with the refresh_token grant (RFC 6749, section 6) against the
 * token endpoint in {@link OAuth2Settings}. The blocking HTTP exchange runs on the given
 * executor.
 */
public class HttpTokenRefresher implements TokenRefresher, Closeable {
  private static final Logger logger = LoggerFactory.getLogger(HttpTokenRefresher.class);

  private final OAuth2Settings settings;
  private final Executor executor;
  private final Clock clock;
  private final Gson gson = new Gson();
  private CloseableHttpClient httpClient;

  private static class TokenResponse {
    @SerializedName("access_token")
    String accessToken;

    @SerializedName("refresh_token")
    String refreshToken;

    @SerializedName("expires_in")
    Long expiresIn;

    @SerializedName("token_type")
    String tokenType;
  }

  public HttpTokenRefresher(OAuth2Settings settings) {
    this(settings, ForkJoinPool.commonPool());
  }

  public HttpTokenRefresher(OAuth2Settings settings, Executor executor) {
    this.settings = settings;
    this.executor = executor;
    this.clock = Clock.systemUTC();
  }

  @VisibleForTesting
  HttpTokenRefresher(OAuth2Settings settings,
                     Executor executor,
                     Clock clock,
                     CloseableHttpClient client) {
    this.settings = settings;
    this.executor = executor;
    this.clock = clock;
    this.httpClient = client;
  }

  @Override
  public CompletionStage<OAuth2Credential> refresh(OAuth2Credential credential) {
    if (credential.getRefreshToken() == null) {
      CompletableFuture<OAuth2Credential> failed = new CompletableFuture<>();
      failed.completeExceptionally(
        new AuthRelayClientException("Credential has no refresh token, cannot refresh it"));
      return failed;
    }
    return CompletableFuture.supplyAsync(() -> requestToken(credential), executor);
  }

  @VisibleForTesting
  OAuth2Credential requestToken(OAuth2Credential credential) {
    logger.debug("Requesting new access token from " + settings.getTokenUrl());
    HttpPost request = new HttpPost(settings.getTokenUrl());
    request.setHeader(HttpHeaders.ACCEPT, "application/json");
    request.setHeader(HttpHeaders.USER_AGENT, AuthRelayClientVersion.getUserAgent());
    request.setEntity(new UrlEncodedFormEntity(formParameters(credential), StandardCharsets.UTF_8));

    String body;
    try (CloseableHttpResponse response = getHttpClient().execute(request)) {
      int statusCode = response.getStatusLine().getStatusCode();
      body = response.getEntity() == null
        ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
      if (statusCode < 200 || statusCode > 299) {
        logger.warn("Token endpoint returned status code {}", statusCode);
        throw new AuthRelayHttpException(
          statusCode, response.getStatusLine().getReasonPhrase(), body);
      }
    } catch (IOException e) {
      throw new AuthRelayClientException("Failed to reach token endpoint " + settings.getTokenUrl(),
        e);
    }
    return parseToken(body, credential);
  }

  private List<NameValuePair> formParameters(OAuth2Credential credential) {
    List<NameValuePair> parameters = new ArrayList<>();
    parameters.add(new BasicNameValuePair("grant_type", "refresh_token"));
    parameters.add(new BasicNameValuePair("refresh_token", credential.getRefreshToken()));
    if (settings.getClientId() != null) {
      parameters.add(new BasicNameValuePair("client_id", settings.getClientId()));
    }
    if (settings.getClientSecret() != null) {
      parameters.add(new BasicNameValuePair("client_secret", settings.getClientSecret()));
    }
    if (settings.getScope() != null) {
      parameters.add(new BasicNameValuePair("scope", settings.getScope()));
    }
    return parameters;
  }

  /**
   * Servers may omit the refresh token when it is not rotated; the previous one stays valid in
   * that case.
   */
  @VisibleForTesting
  OAuth2Credential parseToken(String body, OAuth2Credential previous) {
    TokenResponse token;
    try {
      token = gson.fromJson(body, TokenResponse.class);
    } catch (JsonParseException e) {
      throw new AuthRelayClientException("Malformed token response", e);
    }
    if (token == null || token.accessToken == null) {
      throw new AuthRelayClientException("Token response has no access_token");
    }
    if (token.tokenType != null && !"bearer".equalsIgnoreCase(token.tokenType)) {
      throw new AuthRelayClientException("Unsupported token_type: " + token.tokenType);
    }

    String refreshToken = token.refreshToken != null
      ? token.refreshToken : previous.getRefreshToken();
    Instant expiration = token.expiresIn != null
      ? clock.instant().plusSeconds(token.expiresIn) : null;
    return new OAuth2Credential(token.accessToken, refreshToken, expiration);
  }

  private synchronized CloseableHttpClient getHttpClient() {
    if (httpClient != null) {
      return httpClient;
    }

    HttpClientBuilder builder = HttpClientBuilder.create();
    if (settings.shouldIgnoreTlsVerification()) {
      try {
        SSLContextBuilder sslBuilder = new SSLContextBuilder()
          .loadTrustMaterial(null, new TrustSelfSignedStrategy());
        builder.setSSLSocketFactory(
          new SSLConnectionSocketFactory(sslBuilder.build(), new NoopHostnameVerifier()));
      } catch (NoSuchAlgorithmException | KeyStoreException | KeyManagementException e) {
        logger.warn("Could not disable TLS verification for the token endpoint", e);
      }
    }
    httpClient = builder.build();
    return httpClient;
  }

  @Override
  public synchronized void close() {
    if (httpClient != null) {
      try {
        httpClient.close();
      } catch (IOException e) {
        logger.warn("Unable to close connection to token endpoint", e);
      }
    }
  }
}
