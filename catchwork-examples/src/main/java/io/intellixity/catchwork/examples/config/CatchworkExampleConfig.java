package io.intellixity.catchwork.examples.config;

import io.intellixity.catchwork.bridge.JvmRuntimeHost;
import io.intellixity.catchwork.bridge.RuntimeBridge;
import io.intellixity.catchwork.config.CatchworkSettings;
import io.intellixity.catchwork.examples.catchers.InventoryCatchers;
import io.intellixity.catchwork.format.PrintingCatcher;
import io.intellixity.catchwork.registry.CatcherRegistry;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CatchworkProperties.class)
public class CatchworkExampleConfig {

  @Bean
  public CatchworkSettings catchworkSettings(CatchworkProperties props) {
    return props.toSettings();
  }

  @Bean
  public CatcherRegistry catcherRegistry(CatchworkSettings settings) {
    // Picks up CatcherProviders from META-INF/catchwork.factories on the classpath.
    return CatcherRegistry.discover(settings.unmatchedPolicy());
  }

  @Bean
  public JvmRuntimeHost jvmRuntimeHost(CatchworkSettings settings) {
    return new JvmRuntimeHost(settings.errorReportingMask());
  }

  @Bean
  public RuntimeBridge runtimeBridge(CatcherRegistry registry,
                                     JvmRuntimeHost host,
                                     CatchworkSettings settings,
                                     InventoryCatchers inventoryCatchers) {
    RuntimeBridge bridge = new RuntimeBridge(registry, host, settings, new PrintingCatcher());
    bridge.registerGlobalHandlers();
    // Registered after the default catch-all so they are checked before it.
    registry.registerAll(inventoryCatchers);
    return bridge;
  }
}
