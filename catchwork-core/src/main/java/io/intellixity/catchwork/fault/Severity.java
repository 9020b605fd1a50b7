package io.intellixity.catchwork.fault;

import java.util.Locale;

/** Bit-flag severities of runtime errors; masks are OR-ed bits. */
public enum Severity {
  ERROR(1),
  WARNING(2),
  PARSE(4),
  NOTICE(8),
  CORE_ERROR(16),
  CORE_WARNING(32),
  COMPILE_ERROR(64),
  COMPILE_WARNING(128),
  USER_ERROR(256),
  USER_WARNING(512),
  USER_NOTICE(1024),
  STRICT(2048),
  RECOVERABLE_ERROR(4096),
  DEPRECATED(8192),
  USER_DEPRECATED(16384);

  public static final int ALL = 32767;

  private final int bit;

  Severity(int bit) {
    this.bit = bit;
  }

  public int bit() { return bit; }

  /** Severity for an exact bit, or null for unknown/compound codes. */
  public static Severity fromCode(int code) {
    for (Severity s : values()) {
      if (s.bit == code) return s;
    }
    return null;
  }

  public static int mask(Severity... severities) {
    int m = 0;
    if (severities != null) for (Severity s : severities) if (s != null) m |= s.bit;
    return m;
  }

  /**
   * Parse a mask such as {@code "ALL"}, {@code "32767"} or {@code "ERROR|WARNING|USER_ERROR"}.
   * A leading {@code ~} on a name removes that bit ({@code "ALL|~NOTICE"}).
   */
  public static int parseMask(String raw) {
    if (raw == null || raw.isBlank()) throw new IllegalArgumentException("error reporting mask is blank");
    String s = raw.trim();
    if (s.chars().allMatch(Character::isDigit)) return Integer.parseInt(s);

    int mask = 0;
    for (String part : s.split("\\|")) {
      String p = part.trim().toUpperCase(Locale.ROOT);
      if (p.isEmpty()) continue;
      boolean negate = p.startsWith("~");
      if (negate) p = p.substring(1).trim();
      int bits = "ALL".equals(p) ? ALL : bitOf(p, raw);
      mask = negate ? (mask & ~bits) : (mask | bits);
    }
    return mask;
  }

  private static int bitOf(String name, String raw) {
    String n = name.startsWith("E_") ? name.substring(2) : name;
    try {
      return valueOf(n).bit;
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown severity '" + name + "' in mask: " + raw, e);
    }
  }
}
