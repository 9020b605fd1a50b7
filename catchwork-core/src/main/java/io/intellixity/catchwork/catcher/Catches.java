package io.intellixity.catchwork.catcher;

import java.lang.annotation.*;

/**
 * Declares the fault type a catcher handles.
 * <p>
 * Placed on a {@link Catcher} class, on the parameter of its {@code handle(Fault)} method, or on a
 * bean method picked up by {@code CatcherRegistry.registerAll(Object)}. When both {@link #value()}
 * and {@link #type()} are left empty the target is inferred (bean methods) or defaults to the root
 * type.
 * <pre>
 * &#64;Catches(type = java.io.IOException.class)
 * public String onIo(java.io.IOException e) { ... }
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD, ElementType.PARAMETER})
public @interface Catches {
  /** Fault type id. */
  String value() default "";

  /** Throwable type; its class name is used as the type id. */
  Class<? extends Throwable> type() default Throwable.class;
}
