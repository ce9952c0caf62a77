package io.intellixity.docclients.spring;

import io.intellixity.docclients.ClientConfig;
import io.intellixity.docclients.DisconnectPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "docclients")
public class DocClientsProperties {
  private final Map<String, ClientProps> clients = new LinkedHashMap<>();
  private DisconnectPolicy disconnectPolicy = DisconnectPolicy.ATTEMPT_ALL;

  /** Connect every client that has a uri when the context starts. */
  private boolean connectOnStartup;

  /** Pass force=true to disconnectAll on context shutdown. */
  private boolean forceOnShutdown;

  public Map<String, ClientProps> getClients() { return clients; }
  public DisconnectPolicy getDisconnectPolicy() { return disconnectPolicy; }
  public void setDisconnectPolicy(DisconnectPolicy disconnectPolicy) { this.disconnectPolicy = disconnectPolicy; }
  public boolean isConnectOnStartup() { return connectOnStartup; }
  public void setConnectOnStartup(boolean connectOnStartup) { this.connectOnStartup = connectOnStartup; }
  public boolean isForceOnShutdown() { return forceOnShutdown; }
  public void setForceOnShutdown(boolean forceOnShutdown) { this.forceOnShutdown = forceOnShutdown; }

  public static class ClientProps {
    private String uri;
    private final Map<String, Object> options = new LinkedHashMap<>();

    public String getUri() { return uri; }
    public void setUri(String uri) { this.uri = uri; }
    public Map<String, Object> getOptions() { return options; }

    public ClientConfig toConfig() {
      String u = (uri == null || uri.isBlank()) ? null : uri;
      return ClientConfig.of(u, options);
    }
  }
}
