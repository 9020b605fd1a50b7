package io.intellixity.catchwork.config;

import io.intellixity.catchwork.fault.Severity;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class CatchworkSettingsTest {

  @Test
  void loadsClasspathResource() {
    CatchworkSettings s = CatchworkSettings.load(getClass().getClassLoader(), new Properties());

    assertEquals(Severity.ALL & ~Severity.DEPRECATED.bit() & ~Severity.USER_DEPRECATED.bit(), s.errorReportingMask());
    assertTrue(s.defaultCatcher());
    assertEquals(UnmatchedPolicy.IGNORE, s.unmatchedPolicy());
  }

  @Test
  void overridesWinOverResource() {
    Properties o = new Properties();
    o.setProperty(CatchworkSettings.ERROR_REPORTING, "ERROR|WARNING");
    o.setProperty(CatchworkSettings.DEFAULT_CATCHER, "false");
    o.setProperty(CatchworkSettings.UNMATCHED, "FAIL");

    CatchworkSettings s = CatchworkSettings.load(getClass().getClassLoader(), o);

    assertEquals(3, s.errorReportingMask());
    assertFalse(s.defaultCatcher());
    assertEquals(UnmatchedPolicy.FAIL, s.unmatchedPolicy());
  }

  @Test
  void emptyProperties_yieldDefaults() {
    assertEquals(CatchworkSettings.defaults(), CatchworkSettings.fromProperties(new Properties()));
  }

  @Test
  void unknownUnmatchedPolicy_isRejected() {
    Properties p = new Properties();
    p.setProperty(CatchworkSettings.UNMATCHED, "shrug");
    assertThrows(IllegalArgumentException.class, () -> CatchworkSettings.fromProperties(p));
  }
}
