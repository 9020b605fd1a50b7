package io.intellixity.catchwork.examples.web;

import io.intellixity.catchwork.fault.Fault;
import io.intellixity.catchwork.registry.CatcherRegistry;
import io.intellixity.catchwork.registry.Dispatch;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routes application exceptions through the {@link CatcherRegistry}.
 * <p>
 * Spring MVC's own exceptions (unknown path, missing or malformed parameters, ...) keep their
 * standard 4xx problem responses from {@link ResponseEntityExceptionHandler} and never reach the
 * registry. For everything else a catcher returning a {@link ResponseEntity} decides the response;
 * any other result (including the default catch-all's printed line) falls back to a 500 carrying
 * the fault as JSON.
 */
@RestControllerAdvice
public final class FaultRoutingAdvice extends ResponseEntityExceptionHandler {
  private final CatcherRegistry registry;

  public FaultRoutingAdvice(CatcherRegistry registry) {
    this.registry = registry;
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<?> route(Exception ex) {
    Fault fault = Fault.of(ex);
    Dispatch d = registry.handle(fault);
    if (d.matched() && d.value() instanceof ResponseEntity<?> re) return re;

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("status", HttpStatus.INTERNAL_SERVER_ERROR.value());
    body.put("handled", d.matched());
    body.put("fault", fault);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
  }
}
