package org.authrelay.oauth2;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.google.common.annotations.VisibleForTesting;
import org.ini4j.Ini;
import org.ini4j.Profile;

import org.authrelay.interceptor.AuthenticationInterceptor;

/**
 * Loads OAuth2 settings and the initial credential from an INI file, {@code ~/.authrelaycfg}
 * by default or the file named by the {@code AUTHRELAY_CONFIG_FILE} environment variable:
 *
 * <pre>
 * [DEFAULT]
 * token_url = https://auth.example.com/oauth2/token
 * client_id = my-client
 * client_secret = s3cret
 * access_token = eyJ...
 * refresh_token = def50200...
 * expires_at = 1767225600
 * </pre>
 *
 * <p>{@code client_secret}, {@code scope}, {@code refresh_token}, {@code expires_at} (epoch
 * seconds) and {@code insecure} are optional.
 *
 * <p>Interceptors created by {@link #newInterceptor()} share one token refresher owned by this
 * provider; closing the provider releases its HTTP connections.
 */
public class OAuth2ConfigProvider implements Closeable {
  private static final String CONFIG_FILE_ENV_VAR = "AUTHRELAY_CONFIG_FILE";

  private final String profile;

  private OAuth2Settings settings;
  private OAuth2Credential credential;
  private HttpTokenRefresher refresher;
  private final List<HttpTokenRefresher> createdRefreshers = new ArrayList<>();

  public OAuth2ConfigProvider(String profile) {
    this.profile = profile;
  }

  public OAuth2ConfigProvider() {
    this.profile = null;
  }

  private void loadConfigIfNecessary() {
    if (settings == null) {
      reloadConfig();
    }
  }

  private void reloadConfig() {
    String basePath = System.getenv(CONFIG_FILE_ENV_VAR);
    if (basePath == null) {
      String userHome = System.getProperty("user.home");
      basePath = Paths.get(userHome, ".authrelaycfg").toString();
    }

    if (!new File(basePath).isFile()) {
      throw new IllegalStateException("Could not find authrelay configuration file" +
        " (" + basePath + "). Create it or set " + CONFIG_FILE_ENV_VAR + ".");
    }

    Ini ini;
    try {
      ini = new Ini(new File(basePath));
    } catch (IOException e) {
      throw new IllegalStateException("Failed to load authrelay config file at " + basePath, e);
    }

    String sectionName = profile == null ? "DEFAULT" : profile;
    Profile.Section section = ini.get(sectionName);
    if (section == null) {
      throw new IllegalStateException("Could not find '" + sectionName + "' section within" +
        " config file (" + basePath + ").");
    }

    String tokenUrl = section.get("token_url");
    String clientId = section.get("client_id");
    String clientSecret = section.get("client_secret");
    String scope = section.get("scope");
    String accessToken = section.get("access_token");
    String refreshToken = section.get("refresh_token");
    String expiresAt = section.get("expires_at");
    boolean insecure = "true".equalsIgnoreCase(section.get("insecure", "false"));

    if (tokenUrl == null) {
      throw new IllegalStateException("No 'token_url' configured in section '" + sectionName +
        "' of config file (" + basePath + ").");
    }
    if (accessToken == null) {
      throw new IllegalStateException("No 'access_token' configured in section '" + sectionName +
        "' of config file (" + basePath + ").");
    }

    Instant expiration = null;
    if (expiresAt != null) {
      try {
        expiration = Instant.ofEpochSecond(Long.parseLong(expiresAt.trim()));
      } catch (NumberFormatException e) {
        throw new IllegalStateException("'expires_at' must be epoch seconds in config file" +
          " (" + basePath + "), got: " + expiresAt, e);
      }
    }

    this.settings = new OAuth2Settings(tokenUrl, clientId, clientSecret, scope, insecure);
    this.credential = new OAuth2Credential(accessToken, refreshToken, expiration);
  }

  public synchronized OAuth2Settings getSettings() {
    loadConfigIfNecessary();
    return settings;
  }

  /** The credential stored in the file; an interceptor keeps its own copy once refreshed. */
  public synchronized OAuth2Credential getCredential() {
    loadConfigIfNecessary();
    return credential;
  }

  /**
   * Create an interceptor that authenticates with the configured bearer token and refreshes it
   * against the configured token endpoint.
   */
  public synchronized AuthenticationInterceptor<OAuth2Credential> newInterceptor() {
    loadConfigIfNecessary();
    if (refresher == null) {
      refresher = newTokenRefresher(settings);
      createdRefreshers.add(refresher);
    }
    return new AuthenticationInterceptor<>(new BearerTokenAuthenticator(refresher), credential);
  }

  @VisibleForTesting
  HttpTokenRefresher newTokenRefresher(OAuth2Settings settings) {
    return new HttpTokenRefresher(settings);
  }

  /**
   * Re-read the config file. Interceptors created afterwards use the new settings; earlier ones
   * keep refreshing against the previous token endpoint until the provider is closed.
   */
  public synchronized void refresh() {
    reloadConfig();
    refresher = null;
  }

  @Override
  public synchronized void close() {
    for (HttpTokenRefresher created : createdRefreshers) {
      created.close();
    }
    createdRefreshers.clear();
    refresher = null;
  }
}
