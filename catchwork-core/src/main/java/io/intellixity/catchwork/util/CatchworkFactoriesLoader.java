package io.intellixity.catchwork.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style discovery of SPI implementations.\n
 *
 * Every {@code META-INF/catchwork.factories} resource on the classpath is read as a Java Properties
 * file mapping an SPI interface name to comma-separated implementation class names:\n
 *\n
 * <pre>\n
 * io.intellixity.catchwork.catcher.CatcherProvider=com.acme.DbCatchers,com.acme.HttpCatchers\n
 * </pre>\n
 *
 * Implementations are instantiated through their no-arg constructor, in classpath order, each once.\n
 */
public final class CatchworkFactoriesLoader {
  public static final String RESOURCE = "META-INF/catchwork.factories";

  private CatchworkFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    ClassLoader loader = cl == null ? CatchworkFactoriesLoader.class.getClassLoader() : cl;

    // implementation class -> resource that first listed it
    Map<String, URL> listed = new LinkedHashMap<>();
    for (URL url : resources(loader)) {
      String v = read(url).getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) listed.putIfAbsent(name, url);
      }
    }

    List<T> out = new ArrayList<>(listed.size());
    listed.forEach((implName, url) -> out.add(instantiate(spiType, implName, url, loader)));
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new RuntimeException("Cannot scan the classpath for " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new RuntimeException("Unreadable catchwork factories file " + url, e);
    }
    return p;
  }

  private static <T> T instantiate(Class<T> spiType, String implName, URL listedIn, ClassLoader cl) {
    String entry = spiType.getSimpleName() + " entry '" + implName + "' in " + listedIn;
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new RuntimeException(entry + " names a class that is not on the classpath", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException(entry + " is not a " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException(entry + " needs an accessible no-arg constructor", e);
    }
  }
}
