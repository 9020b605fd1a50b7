package io.intellixity.catchwork.format;

import io.intellixity.catchwork.catcher.Catcher;
import io.intellixity.catchwork.fault.Fault;

import java.io.PrintStream;
import java.util.Objects;

/** Catch-all catcher that prints {@link FaultFormatter#format(Fault)} and returns the printed line. */
public final class PrintingCatcher implements Catcher {
  private final PrintStream out;

  public PrintingCatcher() {
    this(System.err);
  }

  public PrintingCatcher(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public Object handle(Fault fault) {
    String line = FaultFormatter.format(fault);
    out.println(line);
    out.flush();
    return line;
  }
}
