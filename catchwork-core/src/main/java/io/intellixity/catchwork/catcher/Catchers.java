package io.intellixity.catchwork.catcher;

import io.intellixity.catchwork.fault.Fault;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/** Adapters for catchers that ignore the fault or that carry their target type. */
public final class Catchers {
  private Catchers() {}

  /** Arity-0 catcher with no result. */
  public static Catcher of(Runnable action) {
    Objects.requireNonNull(action, "action");
    return fault -> {
      action.run();
      return null;
    };
  }

  /** Arity-0 catcher with a result. */
  public static Catcher of(Supplier<?> supplier) {
    Objects.requireNonNull(supplier, "supplier");
    return fault -> supplier.get();
  }

  public static TypedCatcher typed(String targetType, Catcher catcher) {
    Objects.requireNonNull(catcher, "catcher");
    if (targetType == null || targetType.isBlank()) throw new IllegalArgumentException("targetType is required");
    String t = targetType.trim();
    return new TypedCatcher() {
      @Override public String targetType() { return t; }
      @Override public Object handle(Fault fault) { return catcher.handle(fault); }
      @Override public String toString() { return "TypedCatcher[" + t + "]"; }
    };
  }

  /**
   * Catcher for a throwable type. The function receives the fault's cause when it is an instance of
   * {@code type}, {@code null} otherwise (e.g. a fault declared by type id only).
   */
  public static <E extends Throwable> TypedCatcher forThrowable(Class<E> type, Function<? super E, ?> fn) {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(fn, "fn");
    return typed(type.getName(), fault -> fn.apply(causeAs(type, fault)));
  }

  static <E extends Throwable> E causeAs(Class<E> type, Fault fault) {
    Throwable c = fault == null ? null : fault.cause();
    return type.isInstance(c) ? type.cast(c) : null;
  }
}
