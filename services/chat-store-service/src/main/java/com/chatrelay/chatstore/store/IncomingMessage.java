package com.chatrelay.chatstore.store;

import java.time.Instant;

/**
 * A message event handed over by the messaging client.
 *
 * @param id native message id of the messaging client, may be blank
 * @param chatJid contact identifier of the owning chat
 * @param recipient optional, the chat identifier is used when blank
 * @param media optional media descriptor
 */
public record IncomingMessage(
    String id,
    String chatJid,
    String sender,
    String recipient,
    String content,
    Instant timestamp,
    boolean fromMe,
    MediaAttachment media) {

  public String contentOrEmpty() {
    return content == null ? "" : content;
  }

  public String mediaTypeOrEmpty() {
    return media == null || media.mediaType() == null ? "" : media.mediaType();
  }

  /** Nothing worth persisting: no text and no media. */
  public boolean isEmpty() {
    return contentOrEmpty().isEmpty() && mediaTypeOrEmpty().isEmpty();
  }

  public String effectiveRecipient() {
    return recipient == null || recipient.isBlank() ? chatJid : recipient;
  }
}
