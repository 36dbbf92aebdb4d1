package com.chatrelay.chatstore.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * {@code chat-store.*} settings.
 *
 * <p>Remote credentials are validated by the remote client itself, not here, so a missing value
 * surfaces as a {@link com.chatrelay.chatstore.store.StoreConfigurationException} when the remote
 * backend is selected and is ignored otherwise.
 */
@ConfigurationProperties(prefix = "chat-store")
public record ChatStoreProperties(Backend backend, Remote remote, Local local) {

  public ChatStoreProperties {
    if (backend == null) backend = Backend.REMOTE;
    if (remote == null) remote = new Remote(null, null, null, null, null, 0);
    if (local == null) local = new Local(null);
  }

  public enum Backend {
    REMOTE,
    LOCAL
  }

  public record Remote(
      String baseUrl,
      String accessKey,
      String restPath,
      Duration timeout,
      String channel,
      long cacheMaxSize) {

    public Remote {
      if (restPath == null) restPath = "/rest/v1";
      if (timeout == null) timeout = Duration.ofSeconds(30);
      if (channel == null || channel.isBlank()) channel = "whatsapp";
      if (cacheMaxSize <= 0) cacheMaxSize = 10_000;
    }
  }

  public record Local(String path) {

    public Local {
      if (path == null || path.isBlank()) path = "./store/messages";
    }
  }
}
