package org.waabox.vecino.spring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.waabox.vecino.metrics.SyncMetrics;
import org.waabox.vecino.server.SyncCoordinator;
import org.waabox.vecino.store.ListingStore;

/**
 * Spring Boot auto-configuration for the listings sync server.
 *
 * <p>Creates the {@link ListingStore} selected by
 * {@code vecino.store.*} unless the application defines its own, the
 * {@link SyncCoordinator} over it, and the WebSocket endpoint at
 * {@code vecino.path}. An optional {@link SyncMetrics} bean is wired into
 * the coordinator.
 *
 * <p>The coordinator loads the stored listings through a
 * {@link SmartLifecycle} that runs before the embedded web server starts,
 * so no client connects to an empty replica.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@AutoConfiguration
@EnableConfigurationProperties(VecinoProperties.class)
public class VecinoAutoConfiguration {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      VecinoAutoConfiguration.class);

  /**
   * Creates the listing store selected by the properties.
   *
   * @param properties the configuration properties, never null
   * @return the listing store, never null
   */
  @Bean
  @ConditionalOnMissingBean
  public ListingStore vecinoListingStore(final VecinoProperties properties) {
    return ListingStores.create(properties.getStore());
  }

  /**
   * Creates the singleton {@link SyncCoordinator} bean.
   *
   * @param properties the configuration properties, never null
   * @param store the listing store, never null
   * @param metricsProvider provider for an optional SyncMetrics bean
   * @return the coordinator, never null
   */
  @Bean
  public SyncCoordinator syncCoordinator(final VecinoProperties properties,
      final ListingStore store,
      final ObjectProvider<SyncMetrics> metricsProvider) {

    final SyncCoordinator.Builder builder = SyncCoordinator.builder()
        .store(store)
        .persistencePolicy(properties.getPersistencePolicy());

    metricsProvider.ifAvailable(metrics -> {
      builder.metrics(metrics);
      log.info("Sync coordinator using custom SyncMetrics: {}",
          metrics.getClass().getSimpleName());
    });

    log.info("Sync coordinator created with store {} and policy {}",
        store.getClass().getSimpleName(), properties.getPersistencePolicy());

    return builder.build();
  }

  /**
   * Creates a {@link SmartLifecycle} bean that starts and stops the
   * coordinator.
   *
   * <p>Runs in phase 0, ahead of the embedded web server, and therefore
   * stops after it.
   *
   * @param coordinator the coordinator to manage, never null
   * @return the lifecycle bean, never null
   */
  @Bean
  public SmartLifecycle syncCoordinatorLifecycle(
      final SyncCoordinator coordinator) {
    return new SmartLifecycle() {

      /** Whether the lifecycle is currently running. */
      private volatile boolean running = false;

      @Override
      public void start() {
        log.info("Starting sync coordinator...");
        coordinator.start();
        running = true;
        log.info("Sync coordinator started with {} listing(s)",
            coordinator.listings().size());
      }

      @Override
      public void stop() {
        log.info("Stopping sync coordinator...");
        coordinator.stop();
        running = false;
        log.info("Sync coordinator stopped.");
      }

      @Override
      public boolean isRunning() {
        return running;
      }

      @Override
      public int getPhase() {
        return 0;
      }
    };
  }

  /**
   * Creates the WebSocket handler.
   *
   * @param coordinator the coordinator, never null
   * @param properties the configuration properties, never null
   * @return the handler, never null
   */
  @Bean
  public SyncWebSocketHandler syncWebSocketHandler(
      final SyncCoordinator coordinator, final VecinoProperties properties) {
    return new SyncWebSocketHandler(coordinator, properties);
  }

  /**
   * Registers the sync handler at {@code vecino.path} in servlet web
   * applications.
   *
   * @author waabox(waabox[at]gmail[dot]com)
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
  @EnableWebSocket
  static class SyncEndpointConfiguration implements WebSocketConfigurer {

    /** The handler to register, never null. */
    private final SyncWebSocketHandler handler;

    /** The configuration properties, never null. */
    private final VecinoProperties properties;

    /** Creates the endpoint configuration.
     *
     * @param theHandler the handler to register, never null.
     * @param theProperties the configuration properties, never null.
     */
    SyncEndpointConfiguration(final SyncWebSocketHandler theHandler,
        final VecinoProperties theProperties) {
      handler = theHandler;
      properties = theProperties;
    }

    @Override
    public void registerWebSocketHandlers(
        final WebSocketHandlerRegistry registry) {
      registry.addHandler(handler, properties.getPath())
          .setAllowedOriginPatterns(
              properties.getAllowedOrigins().toArray(new String[0]));
      log.info("Sync endpoint registered at {}", properties.getPath());
    }
  }
}
