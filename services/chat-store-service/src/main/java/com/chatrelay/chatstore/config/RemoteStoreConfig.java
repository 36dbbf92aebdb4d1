package com.chatrelay.chatstore.config;

import com.chatrelay.chatstore.remote.ConversationResolver;
import com.chatrelay.chatstore.remote.MessageWriter;
import com.chatrelay.chatstore.remote.RemoteMessageStore;
import com.chatrelay.chatstore.remote.RemoteStoreClient;
import com.chatrelay.chatstore.store.MessageStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.http.HttpClient;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/** Remote REST backend, the default. Fails startup when the URL or key is missing. */
@Configuration
@Slf4j
@ConditionalOnProperty(
    prefix = "chat-store",
    name = "backend",
    havingValue = "remote",
    matchIfMissing = true)
public class RemoteStoreConfig {

  @Bean
  public RemoteStoreClient remoteStoreClient(
      RestClient.Builder builder, ChatStoreProperties properties, ObjectMapper objectMapper) {
    Duration timeout = properties.remote().timeout();
    // JDK client: PATCH is not available on HttpURLConnection
    JdkClientHttpRequestFactory requestFactory =
        new JdkClientHttpRequestFactory(HttpClient.newBuilder().connectTimeout(timeout).build());
    requestFactory.setReadTimeout(timeout);
    return new RemoteStoreClient(
        builder.requestFactory(requestFactory), properties.remote(), objectMapper);
  }

  @Bean
  public ConversationResolver conversationResolver(
      RemoteStoreClient client, ChatStoreProperties properties) {
    return new ConversationResolver(
        client, properties.remote().channel(), properties.remote().cacheMaxSize());
  }

  @Bean
  public MessageWriter messageWriter(
      RemoteStoreClient client,
      ConversationResolver conversationResolver,
      ChatStoreProperties properties) {
    return new MessageWriter(client, conversationResolver, properties.remote().channel());
  }

  @Bean(destroyMethod = "close")
  public MessageStore remoteMessageStore(
      ConversationResolver conversationResolver, MessageWriter messageWriter) {
    log.info("Chat store backend: remote");
    return new RemoteMessageStore(conversationResolver, messageWriter);
  }
}
