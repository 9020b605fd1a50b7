package io.intellixity.catchwork.format;

import io.intellixity.catchwork.fault.Fault;
import io.intellixity.catchwork.fault.FaultType;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

final class FaultFormatterTest {

  @Test
  void formatsTypeMessageFileAndLine() {
    Fault f = Fault.builder(FaultType.of("RuntimeFault"))
        .message("disk full")
        .file("io.x")
        .line(42)
        .build();

    assertEquals("Uncaught exception RuntimeFault: \"disk full\" [File io.x | Line 42]", FaultFormatter.format(f));
  }

  @Test
  void missingMessageAndFile() {
    Fault f = Fault.of(FaultType.of("Bare"), null);

    assertEquals("Uncaught exception Bare: \"\" [File unknown | Line 0]", FaultFormatter.format(f));
  }

  @Test
  void throwableUsesClassNameAndTopFrame() {
    IllegalStateException ex = new IllegalStateException("nope");
    ex.setStackTrace(new StackTraceElement[]{new StackTraceElement("a.B", "m", "B.java", 7)});

    assertEquals("Uncaught exception java.lang.IllegalStateException: \"nope\" [File B.java | Line 7]",
        FaultFormatter.format(Fault.of(ex)));
  }

  @Test
  void printingCatcher_writesFormattedLine() {
    ByteArrayOutputStream buf = new ByteArrayOutputStream();
    PrintingCatcher c = new PrintingCatcher(new PrintStream(buf, true, StandardCharsets.UTF_8));
    Fault f = Fault.builder(FaultType.of("RuntimeFault")).message("m").file("f").line(1).build();

    Object out = c.handle(f);

    assertEquals("Uncaught exception RuntimeFault: \"m\" [File f | Line 1]", out);
    assertEquals(out + System.lineSeparator(), buf.toString(StandardCharsets.UTF_8));
  }
}
