package io.intellixity.catchwork.bridge;

/**
 * Receives runtime errors reported to a {@link RuntimeHost}.
 * <p>
 * Returns {@code true} when the error was dealt with; {@code false} lets the host fall back to its
 * standard reporting.
 */
@FunctionalInterface
public interface RuntimeErrorHandler {
  boolean onError(int severity, String message, String file, int line);
}
