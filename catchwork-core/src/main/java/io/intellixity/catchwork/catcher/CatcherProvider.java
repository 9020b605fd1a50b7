package io.intellixity.catchwork.catcher;

import java.util.Map;

/**
 * SPI contributing catchers through {@code META-INF/catchwork.factories}.
 * <p>
 * Entries are registered in map iteration order, so providers should return an ordered map.
 */
public interface CatcherProvider {
  Map<String, Catcher> catchers();
}
