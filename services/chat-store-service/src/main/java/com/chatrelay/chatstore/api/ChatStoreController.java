package com.chatrelay.chatstore.api;

import com.chatrelay.chatstore.api.dto.ChatStoreDtos.CapabilitiesResponse;
import com.chatrelay.chatstore.api.dto.ChatStoreDtos.ChatDto;
import com.chatrelay.chatstore.api.dto.ChatStoreDtos.ChatsResponse;
import com.chatrelay.chatstore.api.dto.ChatStoreDtos.StoreChatRequest;
import com.chatrelay.chatstore.api.dto.ChatStoreDtos.StoreMessageRequest;
import com.chatrelay.chatstore.api.dto.ChatStoreDtos.StoreMessageResponse;
import com.chatrelay.chatstore.store.MediaInfo;
import com.chatrelay.chatstore.store.MessageStore;
import com.chatrelay.chatstore.store.StoreCapability;
import com.chatrelay.chatstore.store.StoredMessage;
import jakarta.validation.Valid;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Entry point for the messaging client: chat and message events in, plus the read operations the
 * active backend may or may not support.
 */
@RestController
@RequestMapping("/internal")
@RequiredArgsConstructor
@Slf4j
public class ChatStoreController {

  private final MessageStore store;

  @PostMapping("/chats")
  @ResponseStatus(HttpStatus.NO_CONTENT)
  public void storeChat(@Valid @RequestBody StoreChatRequest req) {
    store.storeChat(req.chatJid(), req.name(), req.lastMessageTime());
  }

  @PostMapping("/messages")
  public StoreMessageResponse storeMessage(@Valid @RequestBody StoreMessageRequest req) {
    boolean stored = store.storeMessage(req.toIncomingMessage());
    if (!stored) {
      log.debug("Message {} in {} skipped: no content and no media", req.id(), req.chatJid());
    }
    return new StoreMessageResponse(stored);
  }

  @GetMapping("/chats")
  public ChatsResponse chats() {
    List<ChatDto> chats =
        store.getChats().entrySet().stream()
            .map(e -> new ChatDto(e.getKey(), e.getValue()))
            .collect(Collectors.toList());
    return new ChatsResponse(chats);
  }

  @GetMapping("/chats/{chatJid}/messages")
  public List<StoredMessage> messages(
      @PathVariable String chatJid, @RequestParam(defaultValue = "20") int limit) {
    if (limit < 1 || limit > 500) {
      throw new IllegalArgumentException("limit must be between 1 and 500");
    }
    return store.getMessages(chatJid, limit);
  }

  @GetMapping("/chats/{chatJid}/messages/{messageId}/media")
  public MediaInfo media(@PathVariable String chatJid, @PathVariable String messageId) {
    return store.getMediaInfo(messageId, chatJid);
  }

  @GetMapping("/capabilities")
  public CapabilitiesResponse capabilities() {
    Map<StoreCapability, Boolean> caps = new EnumMap<>(StoreCapability.class);
    for (StoreCapability c : StoreCapability.values()) {
      caps.put(c, store.supports(c));
    }
    return new CapabilitiesResponse(store.backendName(), caps);
  }
}
