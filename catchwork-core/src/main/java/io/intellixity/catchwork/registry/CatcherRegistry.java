package io.intellixity.catchwork.registry;

import io.intellixity.catchwork.catcher.Catcher;
import io.intellixity.catchwork.catcher.CatcherProvider;
import io.intellixity.catchwork.catcher.CatcherTypes;
import io.intellixity.catchwork.config.UnmatchedPolicy;
import io.intellixity.catchwork.fault.Fault;
import io.intellixity.catchwork.util.CatchworkFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Ordered registry of catchers keyed by fault type id.
 * <p>
 * Dispatch walks the entries newest-first by <em>first</em> insertion and runs the first catcher
 * whose target is in the fault's lineage. Re-registering a target swaps the catcher but keeps the
 * original slot. Ordering alone decides priority: a broad target registered after a narrow one
 * shadows it.
 * <p>
 * Reads and writes are synchronized; the matched catcher runs outside the lock on the caller's
 * thread. A catcher that throws is not redispatched and its exception reaches the caller. A catcher
 * that re-enters {@link #handle} with a fault matching its own target recurses without bound.
 */
public final class CatcherRegistry implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CatcherRegistry.class);

  private final LinkedHashMap<String, Catcher> catchers = new LinkedHashMap<>();
  private final UnmatchedPolicy unmatchedPolicy;

  public CatcherRegistry() {
    this(UnmatchedPolicy.IGNORE);
  }

  public CatcherRegistry(UnmatchedPolicy unmatchedPolicy) {
    this.unmatchedPolicy = Objects.requireNonNull(unmatchedPolicy, "unmatchedPolicy");
  }

  /** Registry pre-populated from every {@link CatcherProvider} listed in {@code META-INF/catchwork.factories}. */
  public static CatcherRegistry discover(UnmatchedPolicy unmatchedPolicy) {
    return discover(unmatchedPolicy, CatchworkFactoriesLoader.load(CatcherProvider.class));
  }

  static CatcherRegistry discover(UnmatchedPolicy unmatchedPolicy, List<CatcherProvider> providers) {
    CatcherRegistry r = new CatcherRegistry(unmatchedPolicy);
    for (CatcherProvider p : providers) {
      if (p == null) continue;
      Map<String, Catcher> cs = p.catchers();
      if (cs == null) continue;
      cs.forEach(r::register);
      log.debug("catchwork.discover provider={} catchers={}", p.getClass().getName(), cs.size());
    }
    return r;
  }

  public UnmatchedPolicy unmatchedPolicy() { return unmatchedPolicy; }

  /** Register {@code catcher} for {@code target}; replaces an existing entry in place. */
  public void register(String target, Catcher catcher) {
    if (target == null || target.isBlank()) {
      throw new IllegalArgumentException("target must be a catcher or the name of the fault type to be handled");
    }
    if (catcher == null) throw new IllegalArgumentException("catcher must be a valid catcher");
    String t = target.trim();
    boolean replaced;
    synchronized (this) {
      replaced = catchers.put(t, catcher) != null;
    }
    if (log.isDebugEnabled()) log.debug("catchwork.register target={} replaced={} catcher={}", t, replaced, catcher);
  }

  /** Register {@code catcher} for the target returned by {@link CatcherTypes#inferTargetType(Catcher)}. */
  public String register(Catcher catcher) {
    if (catcher == null) {
      throw new IllegalArgumentException("target must be a catcher or the name of the fault type to be handled");
    }
    String target = CatcherTypes.inferTargetType(catcher);
    register(target, catcher);
    return target;
  }

  /** Register every {@code @Catches} method of {@code bean}; returns the targets in registration order. */
  public List<String> registerAll(Object bean) {
    if (bean == null) throw new IllegalArgumentException("bean is required");
    Map<String, Catcher> found = CatcherTypes.methodCatchers(bean);
    found.forEach(this::register);
    return List.copyOf(found.keySet());
  }

  public Dispatch handle(Throwable t) {
    if (t == null) throw new IllegalArgumentException("throwable is required");
    return handle(Fault.of(t));
  }

  public Dispatch handle(Fault fault) {
    if (fault == null) throw new IllegalArgumentException("fault is required");

    List<Map.Entry<String, Catcher>> snapshot;
    synchronized (this) {
      snapshot = new ArrayList<>(catchers.size());
      for (Map.Entry<String, Catcher> e : catchers.entrySet()) snapshot.add(Map.entry(e.getKey(), e.getValue()));
    }

    for (int i = snapshot.size() - 1; i >= 0; i--) {
      Map.Entry<String, Catcher> e = snapshot.get(i);
      if (!fault.isA(e.getKey())) continue;
      if (log.isDebugEnabled()) log.debug("catchwork.dispatch type={} target={}", fault.type(), e.getKey());
      return Dispatch.handled(e.getKey(), e.getValue().handle(fault));
    }

    if (unmatchedPolicy == UnmatchedPolicy.FAIL) throw new UnhandledFaultException(fault);
    if (log.isDebugEnabled()) log.debug("catchwork.unmatched type={} catchers={}", fault.type(), snapshot.size());
    return Dispatch.unmatched();
  }

  /** Registered targets in insertion order (dispatch checks them back to front). */
  public synchronized List<String> targets() {
    return List.copyOf(catchers.keySet());
  }

  public synchronized boolean contains(String target) {
    return target != null && catchers.containsKey(target.trim());
  }

  public synchronized int size() { return catchers.size(); }

  public synchronized boolean isEmpty() { return catchers.isEmpty(); }

  public synchronized void clear() {
    catchers.clear();
  }

  @Override
  public void close() {
    clear();
  }
}
