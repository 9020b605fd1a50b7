package io.intellixity.catchwork.examples.config;

import io.intellixity.catchwork.config.CatchworkSettings;
import io.intellixity.catchwork.config.UnmatchedPolicy;
import io.intellixity.catchwork.fault.Severity;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "catchwork")
public class CatchworkProperties {
  /** Severity mask, e.g. {@code ALL|~DEPRECATED}. */
  private String errorReporting = "ALL";
  private boolean defaultCatcher = true;
  private String unmatched = "ignore";

  public String getErrorReporting() { return errorReporting; }
  public void setErrorReporting(String errorReporting) { this.errorReporting = errorReporting; }
  public boolean isDefaultCatcher() { return defaultCatcher; }
  public void setDefaultCatcher(boolean defaultCatcher) { this.defaultCatcher = defaultCatcher; }
  public String getUnmatched() { return unmatched; }
  public void setUnmatched(String unmatched) { this.unmatched = unmatched; }

  public CatchworkSettings toSettings() {
    return new CatchworkSettings(Severity.parseMask(errorReporting), defaultCatcher, UnmatchedPolicy.parse(unmatched));
  }
}
