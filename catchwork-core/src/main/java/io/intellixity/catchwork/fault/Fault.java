package io.intellixity.catchwork.fault;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.*;

/**
 * Uniform, immutable representation of a raised fault.\n
 *
 * The fault's type hierarchy is declared up front as {@link #lineage()}: the fault's own type id
 * first and {@link FaultType#ROOT_ID} last. Matching against a catcher target is a membership test
 * on that chain, no runtime type reflection involved.\n
 */
@JsonSerialize(using = FaultJsonSerializer.class)
@JsonDeserialize(using = FaultJsonDeserializer.class)
public final class Fault {
  public static final String UNKNOWN_FILE = "unknown";

  private final List<String> lineage;
  private final String message;
  private final String file;
  private final int line;
  private final Integer code;
  private final Throwable cause;

  private Fault(Builder b) {
    this.lineage = normalizeLineage(b.lineage);
    this.message = b.message;
    this.file = (b.file == null || b.file.isBlank()) ? UNKNOWN_FILE : b.file;
    this.line = Math.max(b.line, 0);
    this.code = b.code;
    this.cause = b.cause;
  }

  public static Builder builder(FaultType type) {
    Objects.requireNonNull(type, "type");
    return new Builder(type.lineage());
  }

  /** Builder for a fault whose lineage is given explicitly; the root id is appended if missing. */
  public static Builder builder(List<String> lineage) {
    Objects.requireNonNull(lineage, "lineage");
    if (lineage.isEmpty()) throw new IllegalArgumentException("lineage is empty");
    return new Builder(lineage);
  }

  public static Fault of(FaultType type, String message) {
    return builder(type).message(message).build();
  }

  /**
   * Wrap a {@link Throwable}. Lineage is the throwable's class, its superclasses and the interfaces
   * they implement, preceded by the declared type's lineage for {@link FaultTyped} throwables; file
   * and line come from the top stack frame.
   */
  public static Fault of(Throwable t) {
    Objects.requireNonNull(t, "t");
    List<String> lineage = new ArrayList<>();
    if (t instanceof FaultTyped ft && ft.faultType() != null) lineage.addAll(ft.faultType().lineage());
    lineage.addAll(lineageOf(t.getClass()));
    Builder b = new Builder(lineage).message(t.getMessage()).cause(t);
    StackTraceElement[] st = t.getStackTrace();
    if (st != null && st.length > 0 && st[0] != null) {
      b.file(st[0].getFileName()).line(st[0].getLineNumber());
    }
    return b.build();
  }

  static List<String> lineageOf(Class<?> type) {
    LinkedHashSet<String> classes = new LinkedHashSet<>();
    LinkedHashSet<String> interfaces = new LinkedHashSet<>();
    for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
      if (c != Throwable.class) classes.add(c.getName());
      collectInterfaces(c, interfaces);
    }
    List<String> out = new ArrayList<>(classes);
    out.addAll(interfaces);
    out.add(FaultType.ROOT_ID);
    return out;
  }

  private static void collectInterfaces(Class<?> c, Set<String> out) {
    for (Class<?> i : c.getInterfaces()) {
      if (out.add(i.getName())) collectInterfaces(i, out);
    }
  }

  private static List<String> normalizeLineage(List<String> raw) {
    LinkedHashSet<String> uniq = new LinkedHashSet<>();
    for (String s : raw) {
      if (s == null || s.isBlank()) throw new IllegalArgumentException("lineage contains a blank type id: " + raw);
      if (!FaultType.ROOT_ID.equals(s)) uniq.add(s.trim());
    }
    uniq.add(FaultType.ROOT_ID);
    return List.copyOf(uniq);
  }

  public String type() { return lineage.get(0); }

  public List<String> lineage() { return lineage; }

  public String message() { return message; }

  public String file() { return file; }

  public int line() { return line; }

  /** Optional numeric code; runtime errors carry their severity here. */
  public Integer code() { return code; }

  /** The wrapped throwable, if this fault was built from one. */
  public Throwable cause() { return cause; }

  /** True if {@code typeId} is this fault's own type or one of its ancestors. */
  public boolean isA(String typeId) {
    return typeId != null && lineage.contains(typeId);
  }

  @Override
  public String toString() {
    return "Fault{type=" + type() + ", message=" + message + ", file=" + file + ", line=" + line +
        (code == null ? "" : ", code=" + code) + "}";
  }

  public static final class Builder {
    private final List<String> lineage;
    private String message;
    private String file;
    private int line;
    private Integer code;
    private Throwable cause;

    private Builder(List<String> lineage) {
      this.lineage = List.copyOf(lineage);
    }

    public Builder message(String message) { this.message = message; return this; }
    public Builder file(String file) { this.file = file; return this; }
    public Builder line(int line) { this.line = line; return this; }
    public Builder code(Integer code) { this.code = code; return this; }
    public Builder cause(Throwable cause) { this.cause = cause; return this; }

    public Fault build() { return new Fault(this); }
  }
}
