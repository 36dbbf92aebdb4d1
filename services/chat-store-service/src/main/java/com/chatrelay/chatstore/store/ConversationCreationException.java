package com.chatrelay.chatstore.store;

/** The store accepted a conversation create request but returned no row. */
public class ConversationCreationException extends ChatStoreException {
  public ConversationCreationException(String message) {
    super(message);
  }
}
