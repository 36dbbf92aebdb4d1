package com.chatrelay.chatstore.store;

public enum StoreCapability {
  STORE_CHAT,
  STORE_MESSAGE,
  GET_MESSAGES,
  GET_CHATS,
  GET_MEDIA_INFO
}
