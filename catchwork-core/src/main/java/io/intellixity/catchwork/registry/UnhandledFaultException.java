package io.intellixity.catchwork.registry;

import io.intellixity.catchwork.fault.Fault;

/** Thrown under {@code UnmatchedPolicy.FAIL} when no catcher matches a fault. */
public final class UnhandledFaultException extends RuntimeException {
  private final transient Fault fault;

  public UnhandledFaultException(Fault fault) {
    super("No catcher registered for " + fault.type() + " (lineage " + fault.lineage() + ")", fault.cause());
    this.fault = fault;
  }

  public Fault fault() { return fault; }
}
