package io.intellixity.catchwork.examples.catchers;

import io.intellixity.catchwork.fault.FaultType;
import io.intellixity.catchwork.fault.FaultTyped;

/** Fault hierarchy of the inventory example. */
public final class InventoryFaults {
  private InventoryFaults() {}

  public static final FaultType INVENTORY = FaultType.of("InventoryFault");
  public static final FaultType OUT_OF_STOCK = INVENTORY.child("OutOfStock");
  public static final FaultType UNKNOWN_SKU = INVENTORY.child("UnknownSku");

  public static final class InventoryException extends RuntimeException implements FaultTyped {
    private final FaultType type;

    public InventoryException(FaultType type, String message) {
      super(message);
      this.type = type;
    }

    @Override
    public FaultType faultType() { return type; }
  }
}
