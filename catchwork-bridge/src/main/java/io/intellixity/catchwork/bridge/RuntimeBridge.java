package io.intellixity.catchwork.bridge;

import io.intellixity.catchwork.catcher.Catcher;
import io.intellixity.catchwork.config.CatchworkSettings;
import io.intellixity.catchwork.fault.Fault;
import io.intellixity.catchwork.fault.FaultType;
import io.intellixity.catchwork.format.PrintingCatcher;
import io.intellixity.catchwork.registry.CatcherRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Installs a {@link CatcherRegistry} as the process's runtime-error and uncaught-exception handler.\n
 *
 * - Runtime errors outside {@link RuntimeHost#errorReportingMask()} are dropped.\n
 * - Reported runtime errors become {@link #RUNTIME_ERROR} faults carrying the severity as code.\n
 * - Uncaught throwables are dispatched as-is.\n
 * - Faults no catcher matches are handed back: runtime errors to the host's own reporting, uncaught\n
 *   throwables to the handler installed before the bridge (or the log when there was none).\n
 */
public final class RuntimeBridge implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(RuntimeBridge.class);

  public static final FaultType RUNTIME_ERROR = FaultType.of("RuntimeError");

  private final CatcherRegistry registry;
  private final RuntimeHost host;
  private final CatchworkSettings settings;
  private final Catcher defaultCatcher;

  private boolean installed;

  public RuntimeBridge(CatcherRegistry registry, RuntimeHost host) {
    this(registry, host, CatchworkSettings.defaults(), new PrintingCatcher());
  }

  public RuntimeBridge(CatcherRegistry registry, RuntimeHost host, CatchworkSettings settings, Catcher defaultCatcher) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.host = Objects.requireNonNull(host, "host");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.defaultCatcher = Objects.requireNonNull(defaultCatcher, "defaultCatcher");
  }

  public CatcherRegistry registry() { return registry; }

  public synchronized boolean installed() { return installed; }

  /** Hook into the host and, if enabled, register the default catch-all catcher. No-op when already installed. */
  public synchronized void registerGlobalHandlers() {
    if (installed) {
      log.debug("catchwork.bridge already installed");
      return;
    }
    host.pushErrorHandler(this::onError);
    host.pushUncaughtHandler(this::onUncaught);
    installed = true;

    if (settings.defaultCatcher()) registry.register(FaultType.ROOT_ID, defaultCatcher);
    log.debug("catchwork.bridge installed mask={} defaultCatcher={}", host.errorReportingMask(), settings.defaultCatcher());
  }

  /** Reinstate the host's previous handlers and empty the registry. No-op when not installed. */
  public synchronized void restore() {
    if (!installed) return;
    host.popErrorHandler();
    host.popUncaughtHandler();
    installed = false;
    registry.clear();
    log.debug("catchwork.bridge restored");
  }

  @Override
  public void close() {
    restore();
  }

  boolean onError(int severity, String message, String file, int line) {
    if ((host.errorReportingMask() & severity) == 0) {
      if (log.isDebugEnabled()) log.debug("catchwork.bridge dropped severity={} file={} line={}", severity, file, line);
      return false;
    }
    // unmatched errors go back to the host's standard reporting
    return registry.handle(runtimeError(severity, message, file, line)).matched();
  }

  void onUncaught(Thread thread, Throwable error) {
    String name = thread == null ? "null" : thread.getName();
    if (log.isDebugEnabled()) log.debug("catchwork.bridge uncaught thread={} type={}", name, error.getClass().getName());
    if (registry.handle(error).matched()) return;

    Thread.UncaughtExceptionHandler previous = host.previousUncaughtHandler();
    if (previous != null) {
      previous.uncaughtException(thread, error);
      return;
    }
    log.error("catchwork.bridge unhandled uncaught exception thread={}", name, error);
  }

  public static Fault runtimeError(int severity, String message, String file, int line) {
    return Fault.builder(RUNTIME_ERROR)
        .message(message)
        .code(severity)
        .file(file)
        .line(line)
        .build();
  }
}
