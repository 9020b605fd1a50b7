package io.intellixity.catchwork.fault;

/**
 * Implemented by throwables that belong to an application-declared {@link FaultType}.
 * <p>
 * {@link Fault#of(Throwable)} puts the declared lineage ahead of the throwable's class hierarchy.
 */
public interface FaultTyped {
  FaultType faultType();
}
