package io.intellixity.catchwork.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CatchworkFactoriesLoaderTest {
  public interface Greeter {
    String greet();
  }

  public interface Broken {}

  public interface Unlisted {}

  public static final class Hello implements Greeter {
    @Override public String greet() { return "hello"; }
  }

  public static final class Bonjour implements Greeter {
    @Override public String greet() { return "bonjour"; }
  }

  @Test
  void loadsListedImplementations_dedupedInOrder() {
    List<Greeter> gs = CatchworkFactoriesLoader.load(Greeter.class);

    assertEquals(2, gs.size());
    assertEquals("hello", gs.get(0).greet());
    assertEquals("bonjour", gs.get(1).greet());
  }

  @Test
  void unlistedSpi_isEmpty() {
    assertTrue(CatchworkFactoriesLoader.load(Unlisted.class).isEmpty());
  }

  @Test
  void implementationOfWrongType_isRejected() {
    IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> CatchworkFactoriesLoader.load(Broken.class));
    assertTrue(e.getMessage().startsWith("Broken entry '" + Hello.class.getName() + "'"), e.getMessage());
    assertTrue(e.getMessage().contains("catchwork.factories"), e.getMessage());
    assertTrue(e.getMessage().endsWith("is not a " + Broken.class.getName()), e.getMessage());
  }
}
