package org.authrelay.client;

import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.KeyManagementException;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import com.google.common.annotations.VisibleForTesting;
import org.apache.http.HttpResponse;
import org.apache.http.client.methods.HttpDelete;
import org.apache.http.client.methods.HttpEntityEnclosingRequestBase;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPatch;
import org.apache.http.client.methods.HttpPost;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.client.protocol.HttpClientContext;
import org.apache.http.conn.ssl.NoopHostnameVerifier;
import org.apache.http.conn.ssl.SSLConnectionSocketFactory;
import org.apache.http.conn.ssl.TrustSelfSignedStrategy;
import org.apache.http.entity.StringEntity;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.apache.http.ssl.SSLContextBuilder;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.authrelay.interceptor.AuthenticationInterceptor;
import org.authrelay.interceptor.RetryResult;

/**
 * Sends HTTP requests authenticated by an {@link AuthenticationInterceptor}.
 *
 * <p>Every attempt is adapted by the interceptor before it is sent. When a request fails, the
 * interceptor decides whether it is retried: requests rejected because of their credential are
 * re-adapted and re-sent once the credential has been refreshed, up to
 * {@code maxAuthRetryAttempts} times.
 */
public class AuthRelayHttpCaller implements Closeable {
  private static final Logger logger = LoggerFactory.getLogger(AuthRelayHttpCaller.class);
  protected CloseableHttpClient httpClient;
  private final AuthenticationInterceptor<?> interceptor;
  private final int maxAuthRetryAttempts;
  private final boolean ignoreTlsVerification;

  /** Construct a new AuthRelayHttpCaller that retries a rejected request up to 3 times. */
  public AuthRelayHttpCaller(AuthenticationInterceptor<?> interceptor) {
    this(interceptor, 3, false);
  }

  /**
   * Construct a new AuthRelayHttpCaller.
   *
   * @param maxAuthRetryAttempts The maximum number of times a single request is re-sent after the
   *                             interceptor asked for a retry.
   * @param ignoreTlsVerification If true, the server's hostname and TLS certificate are not
   *                              verified. Never set this in production.
   */
  public AuthRelayHttpCaller(AuthenticationInterceptor<?> interceptor,
                             int maxAuthRetryAttempts,
                             boolean ignoreTlsVerification) {
    this.interceptor = interceptor;
    this.maxAuthRetryAttempts = maxAuthRetryAttempts;
    this.ignoreTlsVerification = ignoreTlsVerification;
  }

  @VisibleForTesting
  AuthRelayHttpCaller(AuthenticationInterceptor<?> interceptor,
                      int maxAuthRetryAttempts,
                      CloseableHttpClient client) {
    this(interceptor, maxAuthRetryAttempts, false);
    this.httpClient = client;
  }

  public String get(String uri) {
    logger.debug("Sending GET " + uri);
    return execute(new HttpGet(URI.create(uri)));
  }

  public String delete(String uri) {
    logger.debug("Sending DELETE " + uri);
    return execute(new HttpDelete(URI.create(uri)));
  }

  public String post(String uri, String json) {
    logger.debug("Sending POST " + uri + ": " + json);
    return send(new HttpPost(URI.create(uri)), json);
  }

  public String patch(String uri, String json) {
    logger.debug("Sending PATCH " + uri + ": " + json);
    return send(new HttpPatch(URI.create(uri)), json);
  }

  private String send(HttpEntityEnclosingRequestBase request, String json) {
    request.setEntity(new StringEntity(json, StandardCharsets.UTF_8));
    request.setHeader("Content-Type", "application/json");
    return execute(request);
  }

  private String execute(HttpRequestBase request) {
    createHttpClientIfNecessary();
    request.setHeader("User-Agent", AuthRelayClientVersion.getUserAgent());
    HttpClientContext context = HttpClientContext.create();

    int attemptsRemaining = maxAuthRetryAttempts;
    while (true) {
      await(interceptor.adapt(request, context));

      HttpResponse response = null;
      Exception failure;
      try {
        response = httpClient.execute(request, context);
        int statusCode = response.getStatusLine().getStatusCode();
        String body = response.getEntity() == null
          ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
        if (!isError(statusCode)) {
          logger.debug("Response: " + body);
          return body;
        }
        failure = new AuthRelayHttpException(
          statusCode, response.getStatusLine().getReasonPhrase(), body);
      } catch (IOException e) {
        failure = e;
      }

      if (attemptsRemaining == 0) {
        if (maxAuthRetryAttempts > 0) {
          logger.warn("Giving up on {} after {} authentication retries",
                      request.getRequestLine(), maxAuthRetryAttempts);
        }
        throw asClientException(failure);
      }

      RetryResult verdict = await(interceptor.retry(request, response, context, failure));
      switch (verdict.getKind()) {
        case RETRY:
          attemptsRemaining -= 1;
          logger.debug("Retrying {} with a refreshed credential, {} attempt(s) left",
                       request.getRequestLine(), attemptsRemaining);
          continue;
        case DO_NOT_RETRY_WITH_ERROR:
          throw asClientException(verdict.getError());
        case DO_NOT_RETRY:
        default:
          throw asClientException(failure);
      }
    }
  }

  private static <T> T await(Future<T> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AuthRelayClientException("Interrupted while waiting for authentication", e);
    } catch (ExecutionException e) {
      throw asClientException(e.getCause());
    }
  }

  private static AuthRelayClientException asClientException(Throwable error) {
    if (error instanceof AuthRelayClientException) {
      return (AuthRelayClientException) error;
    }
    return new AuthRelayClientException(error);
  }

  private boolean isError(int statusCode) {
    return statusCode < 200 || statusCode > 399;
  }

  private synchronized void createHttpClientIfNecessary() {
    if (httpClient != null) {
      return;
    }

    HttpClientBuilder builder = HttpClientBuilder.create();
    if (ignoreTlsVerification) {
      try {
        SSLContextBuilder sslBuilder = new SSLContextBuilder()
          .loadTrustMaterial(null, new TrustSelfSignedStrategy());
        SSLConnectionSocketFactory connectionFactory =
          new SSLConnectionSocketFactory(sslBuilder.build(), new NoopHostnameVerifier());
        builder.setSSLSocketFactory(connectionFactory);
      } catch (NoSuchAlgorithmException | KeyStoreException | KeyManagementException e) {
        logger.warn("Could not disable TLS verification, verification will remain", e);
      }
    }

    this.httpClient = builder.build();
  }

  @Override
  public void close() {
    if (httpClient != null) {
      try {
        httpClient.close();
      } catch (IOException e) {
        logger.warn("Unable to close HTTP client", e);
      }
    }
  }
}
