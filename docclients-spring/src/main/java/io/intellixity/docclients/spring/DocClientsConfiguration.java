package io.intellixity.docclients.spring;

import io.intellixity.docclients.ClientRegistry;
import io.intellixity.docclients.DefaultClientRegistry;
import io.intellixity.docclients.mongo.MongoConnection;
import io.intellixity.docclients.mongo.MongoConnectionDriver;
import io.intellixity.docclients.spi.ConnectionDriver;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Registers the clients configured under {@code docclients.clients.*}.\n
 *
 * <pre>\n
 * docclients.clients.primary.uri=mongodb://localhost:27017/app\n
 * docclients.clients.primary.options.appName=orders\n
 * docclients.disconnect-policy=ATTEMPT_ALL\n
 * docclients.connect-on-startup=false\n
 * docclients.force-on-shutdown=false\n
 * </pre>\n
 *
 * The Mongo driver is the fallback; any other {@link ConnectionDriver} bean replaces it and types the registry.\n
 */
@AutoConfiguration
@EnableConfigurationProperties(DocClientsProperties.class)
public class DocClientsConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionDriver.class)
  public ConnectionDriver<MongoConnection> mongoConnectionDriver() {
    return new MongoConnectionDriver();
  }

  @Bean
  @ConditionalOnMissingBean(ClientRegistry.class)
  public ClientRegistry<?> clientRegistry(DocClientsProperties props, ConnectionDriver<?> driver) {
    return newRegistry(props, driver);
  }

  @Bean
  public ClientRegistryLifecycle clientRegistryLifecycle(ClientRegistry<?> registry, DocClientsProperties props) {
    return new ClientRegistryLifecycle(registry, props.isConnectOnStartup(), props.isForceOnShutdown());
  }

  static <C> ClientRegistry<C> newRegistry(DocClientsProperties props, ConnectionDriver<C> driver) {
    ClientRegistry<C> registry = DefaultClientRegistry.create(driver, props.getDisconnectPolicy());
    for (var e : props.getClients().entrySet()) {
      registry.add(e.getKey(), e.getValue().toConfig());
    }
    return registry;
  }
}
