package org.authrelay.client;

public class AuthRelayClientException extends RuntimeException {
  public AuthRelayClientException(String message) {
    super(message);
  }
  public AuthRelayClientException(String message, Throwable cause) {
    super(message, cause);
  }
  public AuthRelayClientException(Throwable cause) {
    super(cause);
  }
}
