package com.chatrelay.chatstore.api.dto;

import com.chatrelay.chatstore.store.IncomingMessage;
import com.chatrelay.chatstore.store.MediaAttachment;
import com.chatrelay.chatstore.store.StoreCapability;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class ChatStoreDtos {

  private ChatStoreDtos() {}

  public record StoreChatRequest(
      @NotBlank String chatJid, String name, @NotNull Instant lastMessageTime) {}

  public record MediaDto(
      @NotBlank String mediaType,
      String filename,
      String url,
      byte[] mediaKey,
      byte[] fileSha256,
      byte[] fileEncSha256,
      long fileLength) {

    public MediaAttachment toAttachment() {
      return new MediaAttachment(
          mediaType, filename, url, mediaKey, fileSha256, fileEncSha256, fileLength);
    }
  }

  public record StoreMessageRequest(
      String id,
      @NotBlank String chatJid,
      @NotBlank String sender,
      String recipient,
      String content,
      @NotNull Instant timestamp,
      boolean fromMe,
      @Valid MediaDto media) {

    public IncomingMessage toIncomingMessage() {
      return new IncomingMessage(
          id,
          chatJid,
          sender,
          recipient,
          content,
          timestamp,
          fromMe,
          media == null ? null : media.toAttachment());
    }
  }

  public record StoreMessageResponse(boolean stored) {}

  public record ChatDto(String chatJid, Instant lastMessageTime) {}

  public record ChatsResponse(List<ChatDto> chats) {}

  public record CapabilitiesResponse(String backend, Map<StoreCapability, Boolean> capabilities) {}
}
