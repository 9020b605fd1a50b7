package io.intellixity.catchwork.fault;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Node of an application-declared fault hierarchy.\n
 *
 * Every hierarchy hangs off {@link #ROOT}; a fault created from a type carries the type's
 * {@link #lineage()} and matches a catcher target when the target appears in that lineage.\n
 */
public final class FaultType {
  /** Root type id; a catcher registered for it matches every fault. */
  public static final String ROOT_ID = Throwable.class.getName();

  public static final FaultType ROOT = new FaultType(ROOT_ID, null);

  private final String id;
  private final FaultType parent;
  private final List<String> lineage;

  private FaultType(String id, FaultType parent) {
    this.id = id;
    this.parent = parent;
    List<String> l = new ArrayList<>();
    l.add(id);
    if (parent != null) l.addAll(parent.lineage);
    this.lineage = Collections.unmodifiableList(l);
  }

  /** Declare a direct child of {@link #ROOT}. */
  public static FaultType of(String id) {
    return ROOT.child(id);
  }

  public FaultType child(String childId) {
    Objects.requireNonNull(childId, "childId");
    String s = childId.trim();
    if (s.isEmpty()) throw new IllegalArgumentException("childId is blank");
    if (lineage.contains(s)) throw new IllegalArgumentException("Cyclic fault type: " + s + " already in " + lineage);
    return new FaultType(s, this);
  }

  public String id() { return id; }

  public FaultType parent() { return parent; }

  public boolean isRoot() { return parent == null; }

  /** Own id first, {@link #ROOT_ID} last. */
  public List<String> lineage() { return lineage; }

  public boolean isA(String typeId) {
    return typeId != null && lineage.contains(typeId);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FaultType other)) return false;
    return lineage.equals(other.lineage);
  }

  @Override
  public int hashCode() { return lineage.hashCode(); }

  @Override
  public String toString() { return String.join(" < ", lineage); }
}
