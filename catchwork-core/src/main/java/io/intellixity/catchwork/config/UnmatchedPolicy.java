package io.intellixity.catchwork.config;

import java.util.Locale;

/** What {@code CatcherRegistry.handle} does when no catcher matches. */
public enum UnmatchedPolicy {
  /** Return an unmatched dispatch. */
  IGNORE,
  /** Throw {@code UnhandledFaultException}. */
  FAIL;

  public static UnmatchedPolicy parse(String raw) {
    if (raw == null || raw.isBlank()) return IGNORE;
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown unmatched policy: " + raw + " (expected ignore|fail)", e);
    }
  }
}
