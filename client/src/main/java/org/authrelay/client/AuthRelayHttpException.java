package org.authrelay.client;

/**
 * Returned when an HTTP request sent through an {@link AuthRelayHttpCaller} or a token endpoint
 * answers with an error status code.
 */
public class AuthRelayHttpException extends AuthRelayClientException {

  public AuthRelayHttpException(int statusCode, String reasonPhrase, String bodyMessage) {
    super("statusCode=" + statusCode + " reasonPhrase=[" + reasonPhrase + "] bodyMessage=["
      + bodyMessage + "]");
    this.statusCode = statusCode;
    this.reasonPhrase = reasonPhrase;
    this.bodyMessage = bodyMessage;
  }

  private int statusCode;

  public int getStatusCode() {
    return statusCode;
  }

  private String reasonPhrase;

  public String getReasonPhrase() {
    return reasonPhrase;
  }

  private String bodyMessage;

  public String getBodyMessage() {
    return bodyMessage;
  }

  /** Whether the server rejected the request's credentials (HTTP 401). */
  public boolean isUnauthorized() {
    return statusCode == 401;
  }
}
