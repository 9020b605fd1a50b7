package io.intellixity.catchwork.examples.web;

import io.intellixity.catchwork.bridge.JvmRuntimeHost;
import io.intellixity.catchwork.examples.catchers.InventoryCatchers;
import io.intellixity.catchwork.fault.FaultType;
import io.intellixity.catchwork.format.PrintingCatcher;
import io.intellixity.catchwork.registry.CatcherRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

final class InventoryControllerTest {
  private final ByteArrayOutputStream printed = new ByteArrayOutputStream();
  private MockMvc mvc;

  @BeforeEach
  void setUp() {
    CatcherRegistry registry = new CatcherRegistry();
    registry.register(FaultType.ROOT_ID, new PrintingCatcher(new PrintStream(printed, true, StandardCharsets.UTF_8)));
    registry.registerAll(new InventoryCatchers());
    mvc = MockMvcBuilders.standaloneSetup(new InventoryController(new JvmRuntimeHost()))
        .setControllerAdvice(new FaultRoutingAdvice(registry))
        .build();
  }

  private String printedText() {
    return printed.toString(StandardCharsets.UTF_8);
  }

  @Test
  void missingQty_isBadRequestWithoutReachingCatchers() throws Exception {
    mvc.perform(post("/api/inventory/sku-1/reserve"))
        .andExpect(status().isBadRequest());

    assertEquals("", printedText());
  }

  @Test
  void nonNumericQty_isBadRequestWithoutReachingCatchers() throws Exception {
    mvc.perform(post("/api/inventory/sku-1/reserve").param("qty", "lots"))
        .andExpect(status().isBadRequest());

    assertEquals("", printedText());
  }

  @Test
  void unknownPath_isNotFoundWithoutReachingCatchers() throws Exception {
    mvc.perform(get("/api/inventory/sku-1/nope"))
        .andExpect(status().isNotFound());

    assertEquals("", printedText());
  }

  @Test
  void nonPositiveQty_isRoutedToIllegalArgumentCatcher() throws Exception {
    mvc.perform(post("/api/inventory/sku-1/reserve").param("qty", "0"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("qty must be > 0"));
  }

  @Test
  void inventoryFaults_areRoutedToInventoryCatcher() throws Exception {
    mvc.perform(post("/api/inventory/sku-9/reserve").param("qty", "1"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.fault.type").value("UnknownSku"));

    mvc.perform(post("/api/inventory/sku-2/reserve").param("qty", "1"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.fault.type").value("OutOfStock"));

    assertEquals("", printedText());
  }

  @Test
  void reserve_decrementsStock() throws Exception {
    mvc.perform(post("/api/inventory/sku-1/reserve").param("qty", "2"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.available").value(3));
  }
}
