package io.firewatch.watch;

public class DocumentDecodeException extends Exception {

  public DocumentDecodeException(String message) {
    super(message);
  }

  public DocumentDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
