package io.intellixity.catchwork.catcher;

/** A {@link Catcher} that declares the fault type it wants. */
public interface TypedCatcher extends Catcher {
  String targetType();
}
