package com.chatrelay.chatstore.remote;

import com.chatrelay.chatstore.store.IncomingMessage;
import com.chatrelay.chatstore.store.MediaInfo;
import com.chatrelay.chatstore.store.MediaInfoUnavailableException;
import com.chatrelay.chatstore.store.MessageStore;
import com.chatrelay.chatstore.store.StoreCapability;
import com.chatrelay.chatstore.store.StoredMessage;
import com.chatrelay.chatstore.store.UnsupportedStoreOperationException;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Write-only backend on top of the remote REST store.
 *
 * <p>Reads are served by whatever queries the remote store directly, so message and chat listing
 * are reported as unsupported here instead of answering with empty data.
 */
@Slf4j
@RequiredArgsConstructor
public class RemoteMessageStore implements MessageStore {

  static final String BACKEND = "remote";

  private static final Set<StoreCapability> CAPABILITIES =
      EnumSet.of(StoreCapability.STORE_CHAT, StoreCapability.STORE_MESSAGE);

  private final ConversationResolver conversations;
  private final MessageWriter writer;

  @Override
  public void storeChat(String chatJid, String name, Instant lastMessageTime) {
    String conversationId = conversations.refreshConversation(chatJid, name);

    if (name != null && !name.isEmpty()) {
      try {
        conversations.updateName(chatJid, name);
      } catch (Exception e) {
        log.warn("Failed to update contact name of {}: {}", chatJid, e.getMessage());
      }
    }

    conversations.updateLastMessageAt(conversationId, lastMessageTime);
  }

  @Override
  public boolean storeMessage(IncomingMessage message) {
    if (message.isEmpty()) {
      return false;
    }
    String conversationId = conversations.resolveConversation(message.chatJid(), null);
    return writer.storeMessage(conversationId, message);
  }

  @Override
  public List<StoredMessage> getMessages(String chatJid, int limit) {
    throw new UnsupportedStoreOperationException(StoreCapability.GET_MESSAGES, BACKEND);
  }

  @Override
  public Map<String, Instant> getChats() {
    throw new UnsupportedStoreOperationException(StoreCapability.GET_CHATS, BACKEND);
  }

  @Override
  public MediaInfo getMediaInfo(String messageId, String chatJid) {
    throw new MediaInfoUnavailableException("media info not available in the remote store");
  }

  @Override
  public boolean supports(StoreCapability capability) {
    return CAPABILITIES.contains(capability);
  }

  @Override
  public String backendName() {
    return BACKEND;
  }

  @Override
  public void close() {
    // nothing held open
  }
}
