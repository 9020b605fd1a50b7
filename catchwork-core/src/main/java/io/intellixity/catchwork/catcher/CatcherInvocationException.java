package io.intellixity.catchwork.catcher;

/** Raised when a reflectively invoked catcher method fails with a checked exception or cannot be called. */
public final class CatcherInvocationException extends RuntimeException {
  public CatcherInvocationException(String message) {
    super(message);
  }

  public CatcherInvocationException(String message, Throwable cause) {
    super(message, cause);
  }
}
