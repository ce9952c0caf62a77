package io.intellixity.docclients.spring;

import io.intellixity.docclients.Client;
import io.intellixity.docclients.ClientRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/** Ties a {@link ClientRegistry} to the application context: optional connect on start, disconnectAll on close. */
public final class ClientRegistryLifecycle implements InitializingBean, DisposableBean {
  private static final Logger log = LoggerFactory.getLogger(ClientRegistryLifecycle.class);

  private final ClientRegistry<?> registry;
  private final boolean connectOnStartup;
  private final boolean forceOnShutdown;

  public ClientRegistryLifecycle(ClientRegistry<?> registry, boolean connectOnStartup, boolean forceOnShutdown) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.connectOnStartup = connectOnStartup;
    this.forceOnShutdown = forceOnShutdown;
  }

  /** Connects every client with a uri; on the first failure, disconnects what was already connected and rethrows. */
  @Override
  public void afterPropertiesSet() {
    if (!connectOnStartup) return;
    try {
      connectConfigured();
    } catch (RuntimeException e) {
      log.warn("docclients.startup state=failed error={} cleanup=disconnectAll force={}", e.toString(), forceOnShutdown);
      try {
        await(registry.disconnectAll(forceOnShutdown));
      } catch (RuntimeException cleanup) {
        e.addSuppressed(cleanup);
      }
      throw e;
    }
  }

  private void connectConfigured() {
    for (Client<?> c : registry.values()) {
      if (c.uri() == null) {
        log.info("docclients.startup client={} state=skipped reason=no_uri", c.name());
        continue;
      }
      await(registry.connect(c.name()));
      log.info("docclients.startup client={} state=connected", c.name());
    }
  }

  @Override
  public void destroy() {
    log.info("docclients.shutdown clients={} force={}", registry.size(), forceOnShutdown);
    await(registry.disconnectAll(forceOnShutdown));
  }

  private static void await(CompletableFuture<?> f) {
    try {
      f.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException re) throw re;
      throw e;
    }
  }
}
