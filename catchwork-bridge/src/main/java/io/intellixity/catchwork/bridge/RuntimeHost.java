package io.intellixity.catchwork.bridge;

/**
 * Process-level interception points the bridge installs itself into.\n
 *
 * Both hooks are stacks: {@code push} installs a handler and remembers the previous one, {@code pop}
 * reinstates it.\n
 */
public interface RuntimeHost {
  void pushErrorHandler(RuntimeErrorHandler handler);

  void popErrorHandler();

  void pushUncaughtHandler(Thread.UncaughtExceptionHandler handler);

  void popUncaughtHandler();

  /** Handler that was in effect before the newest {@link #pushUncaughtHandler}; null if none. */
  Thread.UncaughtExceptionHandler previousUncaughtHandler();

  /** Severities currently reported; errors whose bit is not set are to be ignored. */
  int errorReportingMask();
}
