package io.intellixity.catchwork.catcher;

import io.intellixity.catchwork.fault.Fault;

/**
 * Handler invoked with a fault it was registered for.
 * <p>
 * The return value is handed back to whoever dispatched the fault; {@code null} is a valid result.
 */
@FunctionalInterface
public interface Catcher {
  Object handle(Fault fault);
}
