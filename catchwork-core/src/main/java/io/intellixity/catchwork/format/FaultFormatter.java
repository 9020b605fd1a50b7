package io.intellixity.catchwork.format;

import io.intellixity.catchwork.fault.Fault;

import java.util.Objects;

/** Renders the one-line diagnostic used by the default catch-all catcher. */
public final class FaultFormatter {
  public static final String TEMPLATE = "Uncaught exception %s: \"%s\" [File %s | Line %d]";

  private FaultFormatter() {}

  public static String format(Fault fault) {
    Objects.requireNonNull(fault, "fault");
    String message = fault.message() == null ? "" : fault.message();
    return String.format(TEMPLATE, fault.type(), message, fault.file(), fault.line());
  }
}
