package io.intellixity.catchwork.examples.web;

import io.intellixity.catchwork.bridge.JvmRuntimeHost;
import io.intellixity.catchwork.examples.catchers.InventoryFaults;
import io.intellixity.catchwork.examples.catchers.InventoryFaults.InventoryException;
import io.intellixity.catchwork.fault.Severity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@RestController
@RequestMapping("/api/inventory")
public final class InventoryController {
  private final Map<String, Integer> stock = new ConcurrentHashMap<>(Map.of("sku-1", 5, "sku-2", 0));
  private final JvmRuntimeHost host;

  public InventoryController(JvmRuntimeHost host) {
    this.host = host;
  }

  public record StockLevel(String sku, int available) {}

  @GetMapping("/{sku}")
  public StockLevel get(@PathVariable("sku") String sku) {
    return new StockLevel(sku, available(sku));
  }

  @PostMapping("/{sku}/reserve")
  public StockLevel reserve(@PathVariable("sku") String sku, @RequestParam("qty") int qty) {
    if (qty <= 0) throw new IllegalArgumentException("qty must be > 0");
    int left = stock.compute(sku, (k, have) -> {
      if (have == null) throw new InventoryException(InventoryFaults.UNKNOWN_SKU, "Unknown sku: " + k);
      if (have < qty) throw new InventoryException(InventoryFaults.OUT_OF_STOCK, "Only " + have + " of " + k + " left");
      return have - qty;
    });
    return new StockLevel(sku, left);
  }

  /** Legacy endpoint; still works but reports a deprecation through the runtime bridge. */
  @PostMapping("/{sku}/add")
  public StockLevel add(@PathVariable("sku") String sku, @RequestParam("qty") int qty) {
    host.reportError(Severity.DEPRECATED, "POST /{sku}/add is deprecated, use /{sku}/restock");
    return restock(sku, qty);
  }

  @PostMapping("/{sku}/restock")
  public StockLevel restock(@PathVariable("sku") String sku, @RequestParam("qty") int qty) {
    if (qty <= 0) throw new IllegalArgumentException("qty must be > 0");
    return new StockLevel(sku, stock.merge(sku, qty, Integer::sum));
  }

  private int available(String sku) {
    Integer have = stock.get(sku);
    if (have == null) throw new InventoryException(InventoryFaults.UNKNOWN_SKU, "Unknown sku: " + sku);
    return have;
  }
}
