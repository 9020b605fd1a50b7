package io.intellixity.catchwork.examples.catchers;

import io.intellixity.catchwork.catcher.Catches;
import io.intellixity.catchwork.fault.Fault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class InventoryCatchers {
  private static final Logger log = LoggerFactory.getLogger(InventoryCatchers.class);

  @Catches("InventoryFault")
  public ResponseEntity<Map<String, Object>> onInventory(Fault f) {
    HttpStatus status = f.isA("UnknownSku") ? HttpStatus.NOT_FOUND : HttpStatus.CONFLICT;
    return ResponseEntity.status(status).body(body(f, status));
  }

  @Catches
  public ResponseEntity<Map<String, Object>> onIllegalArgument(IllegalArgumentException e) {
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("status", HttpStatus.BAD_REQUEST.value());
    b.put("error", e == null ? null : e.getMessage());
    return ResponseEntity.badRequest().body(b);
  }

  @Catches("RuntimeError")
  public Boolean onRuntimeError(Fault f) {
    log.warn("inventory.runtime_error code={} file={} line={} message={}", f.code(), f.file(), f.line(), f.message());
    return Boolean.TRUE;
  }

  private static Map<String, Object> body(Fault f, HttpStatus status) {
    Map<String, Object> b = new LinkedHashMap<>();
    b.put("status", status.value());
    b.put("fault", f);
    return b;
  }
}
