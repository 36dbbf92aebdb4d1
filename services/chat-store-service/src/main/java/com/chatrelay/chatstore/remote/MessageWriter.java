package com.chatrelay.chatstore.remote;

import com.chatrelay.chatstore.store.IncomingMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;

/**
 * Persists message events as rows of the remote {@code messages} table.
 *
 * <p>The message insert is the primary effect and its failure propagates. Refreshing the owning
 * conversation's {@code last_message_at} afterwards is best-effort: a failure is logged and the
 * call still succeeds.
 */
@Slf4j
public class MessageWriter {

  static final String MESSAGES = "messages";

  private final RemoteStoreClient client;
  private final ConversationResolver conversations;
  private final String channel;

  public MessageWriter(
      RemoteStoreClient client, ConversationResolver conversations, String channel) {
    this.client = client;
    this.conversations = conversations;
    this.channel = channel;
  }

  /**
   * @return {@code false} if the message had neither text nor media and nothing was written
   */
  public boolean storeMessage(String conversationId, IncomingMessage message) {
    if (message.isEmpty()) {
      log.debug("Skipping empty message {} in {}", message.id(), message.chatJid());
      return false;
    }

    MessageRecord row = MessageRecord.from(conversationId, channel, message);
    client.execute(HttpMethod.POST, MESSAGES, row);

    try {
      conversations.updateLastMessageAt(conversationId, message.timestamp());
    } catch (Exception e) {
      log.warn(
          "Stored message {} but failed to refresh last_message_at of conversation {}: {}",
          message.id(),
          conversationId,
          e.getMessage());
    }
    return true;
  }
}
