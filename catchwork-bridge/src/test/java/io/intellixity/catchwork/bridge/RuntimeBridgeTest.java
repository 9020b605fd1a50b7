package io.intellixity.catchwork.bridge;

import io.intellixity.catchwork.catcher.Catcher;
import io.intellixity.catchwork.config.CatchworkSettings;
import io.intellixity.catchwork.fault.Fault;
import io.intellixity.catchwork.fault.FaultType;
import io.intellixity.catchwork.fault.Severity;
import io.intellixity.catchwork.registry.CatcherRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class RuntimeBridgeTest {
  private Thread.UncaughtExceptionHandler original;

  @BeforeEach
  void saveDefaultHandler() {
    original = Thread.getDefaultUncaughtExceptionHandler();
  }

  @AfterEach
  void restoreDefaultHandler() {
    Thread.setDefaultUncaughtExceptionHandler(original);
  }

  private static RuntimeBridge bridge(CatcherRegistry registry, JvmRuntimeHost host, List<Fault> defaults) {
    Catcher recording = f -> {
      defaults.add(f);
      return null;
    };
    return new RuntimeBridge(registry, host, CatchworkSettings.defaults(), recording);
  }

  @Test
  void install_registersDefaultCatchAllAndHooks() {
    CatcherRegistry registry = new CatcherRegistry();
    JvmRuntimeHost host = new JvmRuntimeHost();
    List<Fault> seen = new ArrayList<>();
    RuntimeBridge b = bridge(registry, host, seen);

    b.registerGlobalHandlers();

    assertTrue(b.installed());
    assertEquals(List.of(FaultType.ROOT_ID), registry.targets());
    assertNotNull(Thread.getDefaultUncaughtExceptionHandler());
    assertNotSame(original, Thread.getDefaultUncaughtExceptionHandler());

    assertTrue(host.reportError(Severity.WARNING.bit(), "division by zero", "calc.x", 12));
    assertEquals(1, seen.size());
    Fault f = seen.get(0);
    assertEquals("RuntimeError", f.type());
    assertEquals(Severity.WARNING.bit(), f.code());
    assertEquals("division by zero", f.message());
    assertEquals("calc.x", f.file());
    assertEquals(12, f.line());
  }

  @Test
  void runtimeErrorsOutsideMask_areDropped() {
    CatcherRegistry registry = new CatcherRegistry();
    JvmRuntimeHost host = new JvmRuntimeHost(Severity.mask(Severity.ERROR, Severity.WARNING));
    List<Fault> seen = new ArrayList<>();
    bridge(registry, host, seen).registerGlobalHandlers();

    assertFalse(host.reportError(Severity.NOTICE.bit(), "undefined index", "a.x", 1));
    assertTrue(seen.isEmpty());

    host.setErrorReportingMask(Severity.ALL);
    assertTrue(host.reportError(Severity.NOTICE.bit(), "undefined index", "a.x", 1));
    assertEquals(1, seen.size());
  }

  @Test
  void specificCatcher_overridesDefaultForRuntimeErrors() {
    CatcherRegistry registry = new CatcherRegistry();
    JvmRuntimeHost host = new JvmRuntimeHost();
    List<Fault> seen = new ArrayList<>();
    List<Integer> codes = new ArrayList<>();
    bridge(registry, host, seen).registerGlobalHandlers();
    registry.register(RuntimeBridge.RUNTIME_ERROR.id(), f -> codes.add(f.code()));

    host.reportError(Severity.USER_ERROR, "quota exceeded");

    assertEquals(List.of(Severity.USER_ERROR.bit()), codes);
    assertTrue(seen.isEmpty());
  }

  @Test
  void uncaughtThrowables_areDispatched() throws Exception {
    CatcherRegistry registry = new CatcherRegistry();
    List<Fault> seen = new ArrayList<>();
    bridge(registry, new JvmRuntimeHost(), seen).registerGlobalHandlers();
    List<String> messages = new ArrayList<>();
    registry.register(IllegalStateException.class.getName(), f -> messages.add(f.message()));

    Thread t = new Thread(() -> { throw new IllegalStateException("worker died"); });
    t.start();
    t.join();

    assertEquals(List.of("worker died"), messages);
    assertTrue(seen.isEmpty());
  }

  @Test
  void restore_uninstallsHooksAndClearsRegistry() {
    CatcherRegistry registry = new CatcherRegistry();
    JvmRuntimeHost host = new JvmRuntimeHost();
    List<Fault> seen = new ArrayList<>();
    RuntimeBridge b = bridge(registry, host, seen);
    b.registerGlobalHandlers();
    registry.register("IoFault", f -> "io");

    b.restore();

    assertFalse(b.installed());
    assertTrue(registry.isEmpty());
    assertSame(original, Thread.getDefaultUncaughtExceptionHandler());
    assertFalse(registry.handle(Fault.of(FaultType.of("IoFault"), "x")).matched());
    assertFalse(host.reportError(Severity.ERROR.bit(), "after restore", "a.x", 1));
    assertTrue(seen.isEmpty());
  }

  @Test
  void restore_reinstatesPreviousHandlers() {
    JvmRuntimeHost host = new JvmRuntimeHost();
    List<String> earlier = new ArrayList<>();
    host.pushErrorHandler((sev, msg, file, line) -> earlier.add(msg));
    Thread.UncaughtExceptionHandler previous = (th, ex) -> {};
    Thread.setDefaultUncaughtExceptionHandler(previous);

    RuntimeBridge b = bridge(new CatcherRegistry(), host, new ArrayList<>());
    b.registerGlobalHandlers();
    b.close();

    assertSame(previous, Thread.getDefaultUncaughtExceptionHandler());
    assertTrue(host.reportError(Severity.ERROR.bit(), "back to earlier", "a.x", 1));
    assertEquals(List.of("back to earlier"), earlier);
  }

  @Test
  void installTwice_isNoOpAndRestoreWhenNotInstalledToo() {
    CatcherRegistry registry = new CatcherRegistry();
    JvmRuntimeHost host = new JvmRuntimeHost();
    RuntimeBridge b = bridge(registry, host, new ArrayList<>());

    b.restore();
    b.registerGlobalHandlers();
    b.registerGlobalHandlers();
    b.restore();

    assertSame(original, Thread.getDefaultUncaughtExceptionHandler());
    assertThrows(IllegalStateException.class, host::popErrorHandler);
  }

  @Test
  void defaultCatcherDisabled_leavesRegistryEmpty() {
    CatcherRegistry registry = new CatcherRegistry();
    RuntimeBridge b = new RuntimeBridge(registry, new JvmRuntimeHost(),
        CatchworkSettings.defaults().withDefaultCatcher(false), f -> null);

    b.registerGlobalHandlers();
    try {
      assertTrue(registry.isEmpty());
    } finally {
      b.restore();
    }
  }

  @Test
  void unmatchedRuntimeError_isLeftToHost() {
    CatcherRegistry registry = new CatcherRegistry();
    JvmRuntimeHost host = new JvmRuntimeHost();
    RuntimeBridge b = new RuntimeBridge(registry, host,
        CatchworkSettings.defaults().withDefaultCatcher(false), f -> null);
    b.registerGlobalHandlers();
    try {
      registry.register("IoFault", f -> "io");

      assertFalse(host.reportError(Severity.ERROR.bit(), "nobody catches this", "a.x", 1));

      registry.register(RuntimeBridge.RUNTIME_ERROR.id(), f -> null);
      assertTrue(host.reportError(Severity.ERROR.bit(), "caught now", "a.x", 2));
    } finally {
      b.restore();
    }
  }

  @Test
  void unmatchedUncaught_isForwardedToPreviousHandler() throws Exception {
    List<Throwable> previousSaw = new ArrayList<>();
    Thread.setDefaultUncaughtExceptionHandler((th, ex) -> previousSaw.add(ex));
    CatcherRegistry registry = new CatcherRegistry();
    RuntimeBridge b = new RuntimeBridge(registry, new JvmRuntimeHost(),
        CatchworkSettings.defaults().withDefaultCatcher(false), f -> null);
    b.registerGlobalHandlers();
    List<String> caught = new ArrayList<>();
    registry.register(IllegalArgumentException.class.getName(), f -> caught.add(f.message()));
    try {
      Thread lost = new Thread(() -> { throw new IllegalStateException("lost"); });
      lost.start();
      lost.join();
      Thread matched = new Thread(() -> { throw new IllegalArgumentException("kept"); });
      matched.start();
      matched.join();
    } finally {
      b.restore();
    }

    assertEquals(1, previousSaw.size());
    assertEquals("lost", previousSaw.get(0).getMessage());
    assertEquals(List.of("kept"), caught);
  }

  @Test
  void unmatchedUncaughtWithoutPreviousHandler_isLogged() {
    Thread.setDefaultUncaughtExceptionHandler(null);
    JvmRuntimeHost host = new JvmRuntimeHost();
    RuntimeBridge b = new RuntimeBridge(new CatcherRegistry(), host,
        CatchworkSettings.defaults().withDefaultCatcher(false), f -> null);
    b.registerGlobalHandlers();
    try {
      assertNull(host.previousUncaughtHandler());
      assertDoesNotThrow(() -> b.onUncaught(Thread.currentThread(), new IllegalStateException("logged only")));
    } finally {
      b.restore();
    }
  }

  @Test
  void runtimeErrorFault_isChildOfRoot() {
    Fault f = RuntimeBridge.runtimeError(Severity.ERROR.bit(), "m", "f", 3);

    assertEquals(List.of("RuntimeError", FaultType.ROOT_ID), f.lineage());
    assertEquals(1, f.code());
  }
}
