package com.chatrelay.chatstore.store;

import java.time.Instant;

public record StoredMessage(
    String id,
    String chatJid,
    String sender,
    String content,
    Instant timestamp,
    boolean fromMe,
    String mediaType) {}
