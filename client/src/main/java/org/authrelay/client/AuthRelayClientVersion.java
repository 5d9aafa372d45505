package org.authrelay.client;

import java.io.InputStream;
import java.util.Properties;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Returns the version of the authrelay client this code was built as. */
public class AuthRelayClientVersion {
  private static final Logger logger = LoggerFactory.getLogger(AuthRelayClientVersion.class);

  // Read lazily from the jar's pom.properties so class loading does no disk IO.
  private static Supplier<String> clientVersionSupplier = Suppliers.memoize(() -> {
    Properties p = new Properties();
    try (InputStream is = AuthRelayClientVersion.class.getResourceAsStream(
        "/META-INF/maven/org.authrelay/authrelay-client/pom.properties")) {
      if (is == null) {
        return "";
      }
      p.load(is);
      return p.getProperty("version", "");
    } catch (Exception e) {
      logger.debug("Unable to read client version", e);
      return "";
    }
  });

  private AuthRelayClientVersion() {}

  /** @return client version (e.g., 0.3.0) or an empty string when running outside a jar. */
  public static String getClientVersion() {
    return clientVersionSupplier.get();
  }

  /** @return the User-Agent header value sent with every request. */
  public static String getUserAgent() {
    String userAgent = "authrelay-java-client";
    String clientVersion = getClientVersion();
    if (!clientVersion.isEmpty()) {
      userAgent += "/" + clientVersion;
    }
    return userAgent;
  }
}
