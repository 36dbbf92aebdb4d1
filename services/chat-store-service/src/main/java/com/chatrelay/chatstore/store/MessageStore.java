package com.chatrelay.chatstore.store;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Storage capability set the ingestion pipeline is written against. One implementation is active
 * per process, selected by {@code chat-store.backend}.
 *
 * <p>Backends may be partial. Callers check {@link #supports(StoreCapability)} or handle {@link
 * UnsupportedStoreOperationException}; an unsupported read never degrades into an empty result.
 */
public interface MessageStore extends AutoCloseable {

  /** Creates the chat when unseen, then refreshes its name and last message time. */
  void storeChat(String chatJid, String name, Instant lastMessageTime);

  /**
   * Persists a message.
   *
   * @return {@code false} when the message carried neither text nor media and was skipped
   */
  boolean storeMessage(IncomingMessage message);

  /** Most recent first. */
  List<StoredMessage> getMessages(String chatJid, int limit);

  /** Chat identifier to last message time. */
  Map<String, Instant> getChats();

  MediaInfo getMediaInfo(String messageId, String chatJid);

  boolean supports(StoreCapability capability);

  /** Backend label used in logs and error messages. */
  String backendName();

  @Override
  void close();
}
