package io.intellixity.catchwork.bridge;

import io.intellixity.catchwork.fault.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * {@link RuntimeHost} on top of the JVM.
 * <p>
 * The uncaught hook is {@link Thread#setDefaultUncaughtExceptionHandler}. The JVM has no native
 * error channel, so application code reports runtime errors through {@link #reportError}; the
 * newest pushed handler receives them and errors nobody accepts are logged.
 */
public final class JvmRuntimeHost implements RuntimeHost {
  private static final Logger log = LoggerFactory.getLogger(JvmRuntimeHost.class);

  private final Deque<RuntimeErrorHandler> errorHandlers = new ArrayDeque<>();
  // may hold null: no default handler was installed before
  private final List<Thread.UncaughtExceptionHandler> previousUncaught = new ArrayList<>();
  private volatile int errorReportingMask;

  public JvmRuntimeHost() {
    this(Severity.ALL);
  }

  public JvmRuntimeHost(int errorReportingMask) {
    this.errorReportingMask = errorReportingMask;
  }

  @Override
  public synchronized void pushErrorHandler(RuntimeErrorHandler handler) {
    errorHandlers.push(Objects.requireNonNull(handler, "handler"));
  }

  @Override
  public synchronized void popErrorHandler() {
    if (errorHandlers.isEmpty()) throw new IllegalStateException("No runtime error handler installed");
    errorHandlers.pop();
  }

  @Override
  public synchronized void pushUncaughtHandler(Thread.UncaughtExceptionHandler handler) {
    Objects.requireNonNull(handler, "handler");
    previousUncaught.add(Thread.getDefaultUncaughtExceptionHandler());
    Thread.setDefaultUncaughtExceptionHandler(handler);
  }

  @Override
  public synchronized void popUncaughtHandler() {
    if (previousUncaught.isEmpty()) throw new IllegalStateException("No uncaught exception handler installed");
    Thread.setDefaultUncaughtExceptionHandler(previousUncaught.remove(previousUncaught.size() - 1));
  }

  @Override
  public synchronized Thread.UncaughtExceptionHandler previousUncaughtHandler() {
    return previousUncaught.isEmpty() ? null : previousUncaught.get(previousUncaught.size() - 1);
  }

  @Override
  public int errorReportingMask() { return errorReportingMask; }

  public void setErrorReportingMask(int mask) { this.errorReportingMask = mask; }

  /** Report a runtime error; returns true if an installed handler accepted it. */
  public boolean reportError(int severity, String message, String file, int line) {
    RuntimeErrorHandler h;
    synchronized (this) {
      h = errorHandlers.peek();
    }
    if (h != null && h.onError(severity, message, file, line)) return true;
    logUnhandled(severity, message, file, line);
    return false;
  }

  /** Report a runtime error at the caller's location. */
  public boolean reportError(Severity severity, String message) {
    Objects.requireNonNull(severity, "severity");
    StackTraceElement caller = StackWalker.getInstance()
        .walk(s -> s.skip(1).findFirst().map(StackWalker.StackFrame::toStackTraceElement).orElse(null));
    return reportError(severity.bit(), message,
        caller == null ? null : caller.getFileName(),
        caller == null ? 0 : caller.getLineNumber());
  }

  private void logUnhandled(int severity, String message, String file, int line) {
    if ((errorReportingMask & severity) == 0) return;
    Severity s = Severity.fromCode(severity);
    String name = s == null ? String.valueOf(severity) : s.name();
    if (s == Severity.ERROR || s == Severity.USER_ERROR || s == Severity.CORE_ERROR
        || s == Severity.COMPILE_ERROR || s == Severity.RECOVERABLE_ERROR || s == Severity.PARSE) {
      log.error("catchwork.runtime_error severity={} file={} line={} message={}", name, file, line, message);
    } else if (s == Severity.NOTICE || s == Severity.USER_NOTICE || s == Severity.STRICT
        || s == Severity.DEPRECATED || s == Severity.USER_DEPRECATED) {
      log.info("catchwork.runtime_error severity={} file={} line={} message={}", name, file, line, message);
    } else {
      log.warn("catchwork.runtime_error severity={} file={} line={} message={}", name, file, line, message);
    }
  }
}
