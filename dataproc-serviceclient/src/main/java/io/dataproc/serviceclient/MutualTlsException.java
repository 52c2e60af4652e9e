package io.dataproc.serviceclient;

/** Thrown when the mutual TLS environment settings are invalid. */
public class MutualTlsException extends RuntimeException {
  public MutualTlsException(String message) {
    super(message);
  }

  public MutualTlsException(String message, Throwable cause) {
    super(message, cause);
  }
}
