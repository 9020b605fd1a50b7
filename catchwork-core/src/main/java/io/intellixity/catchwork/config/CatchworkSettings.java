package io.intellixity.catchwork.config;

import io.intellixity.catchwork.fault.Severity;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

/**
 * Runtime settings.\n
 *
 * Loaded from the classpath resource {@code catchwork.properties} (optional); JVM system properties
 * with the same keys override it:\n
 *\n
 * <pre>\n
 * catchwork.error-reporting=ALL|~DEPRECATED\n
 * catchwork.default-catcher=true\n
 * catchwork.unmatched=ignore\n
 * </pre>\n
 */
public record CatchworkSettings(int errorReportingMask, boolean defaultCatcher, UnmatchedPolicy unmatchedPolicy) {
  public static final String RESOURCE = "catchwork.properties";
  public static final String ERROR_REPORTING = "catchwork.error-reporting";
  public static final String DEFAULT_CATCHER = "catchwork.default-catcher";
  public static final String UNMATCHED = "catchwork.unmatched";

  public CatchworkSettings {
    if (unmatchedPolicy == null) unmatchedPolicy = UnmatchedPolicy.IGNORE;
  }

  public static CatchworkSettings defaults() {
    return new CatchworkSettings(Severity.ALL, true, UnmatchedPolicy.IGNORE);
  }

  public static CatchworkSettings load() {
    return load(Thread.currentThread().getContextClassLoader(), System.getProperties());
  }

  public static CatchworkSettings load(ClassLoader cl, Properties overrides) {
    if (cl == null) cl = CatchworkSettings.class.getClassLoader();
    Properties p = new Properties();
    URL url = cl.getResource(RESOURCE);
    if (url != null) {
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new RuntimeException("Failed to load " + RESOURCE + " from " + url, e);
      }
    }
    if (overrides != null) {
      for (String key : new String[]{ERROR_REPORTING, DEFAULT_CATCHER, UNMATCHED}) {
        String v = overrides.getProperty(key);
        if (v != null && !v.isBlank()) p.setProperty(key, v);
      }
    }
    return fromProperties(p);
  }

  public static CatchworkSettings fromProperties(Properties p) {
    String mask = p.getProperty(ERROR_REPORTING);
    String dc = p.getProperty(DEFAULT_CATCHER);
    return new CatchworkSettings(
        (mask == null || mask.isBlank()) ? Severity.ALL : Severity.parseMask(mask),
        dc == null || dc.isBlank() || Boolean.parseBoolean(dc.trim()),
        UnmatchedPolicy.parse(p.getProperty(UNMATCHED))
    );
  }

  public CatchworkSettings withErrorReportingMask(int mask) {
    return new CatchworkSettings(mask, defaultCatcher, unmatchedPolicy);
  }

  public CatchworkSettings withDefaultCatcher(boolean enabled) {
    return new CatchworkSettings(errorReportingMask, enabled, unmatchedPolicy);
  }

  public CatchworkSettings withUnmatchedPolicy(UnmatchedPolicy policy) {
    return new CatchworkSettings(errorReportingMask, defaultCatcher, policy);
  }
}
