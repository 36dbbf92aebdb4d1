package com.chatrelay.chatstore.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Row of the remote {@code conversations} table. Absent values are left out of the JSON. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ConversationRecord(
    @JsonProperty("id") String id,
    @JsonProperty("channel") String channel,
    @JsonProperty("contact_identifier") String contactIdentifier,
    @JsonProperty("contact_name") String contactName,
    @JsonProperty("last_message_at") String lastMessageAt,
    @JsonProperty("status") String status,
    @JsonProperty("unread_count") Integer unreadCount) {

  public static final String STATUS_ACTIVE = "active";

  public static ConversationRecord newConversation(
      String channel, String contactIdentifier, String contactName) {
    String name = contactName == null || contactName.isEmpty() ? null : contactName;
    return new ConversationRecord(
        null, channel, contactIdentifier, name, null, STATUS_ACTIVE, null);
  }
}
