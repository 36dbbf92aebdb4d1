package com.chatrelay.chatstore.remote;

import com.chatrelay.chatstore.store.IncomingMessage;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/** Row of the remote {@code messages} table. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageRecord(
    @JsonProperty("id") String id,
    @JsonProperty("conversation_id") String conversationId,
    @JsonProperty("channel") String channel,
    @JsonProperty("direction") Direction direction,
    @JsonProperty("sender") String sender,
    @JsonProperty("recipient") String recipient,
    @JsonProperty("body") String body,
    @JsonProperty("external_id") String externalId,
    @JsonProperty("metadata") Map<String, Object> metadata,
    @JsonProperty("is_read") Boolean isRead,
    @JsonProperty("status") String status) {

  public static final String MEDIA_TYPE_KEY = "media_type";

  /** Body, external id and metadata are only set when the event carries them. */
  public static MessageRecord from(String conversationId, String channel, IncomingMessage m) {
    String content = m.contentOrEmpty();
    String mediaType = m.mediaTypeOrEmpty();
    String externalId = m.id() == null || m.id().isEmpty() ? null : m.id();
    return new MessageRecord(
        null,
        conversationId,
        channel,
        Direction.of(m.fromMe()),
        m.sender(),
        m.effectiveRecipient(),
        content.isEmpty() ? null : content,
        externalId,
        mediaType.isEmpty() ? null : Map.of(MEDIA_TYPE_KEY, mediaType),
        null,
        null);
  }
}
