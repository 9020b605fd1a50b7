package io.intellixity.catchwork.registry;

/**
 * Outcome of {@link CatcherRegistry#handle}.
 * <p>
 * {@code matched} separates "a catcher ran and returned null" from "nothing matched".
 */
public record Dispatch(boolean matched, String target, Object value) {
  private static final Dispatch UNMATCHED = new Dispatch(false, null, null);

  public static Dispatch unmatched() { return UNMATCHED; }

  public static Dispatch handled(String target, Object value) {
    return new Dispatch(true, target, value);
  }
}
