package com.chatrelay.chatstore.store;

/** Base of every failure raised by a {@link MessageStore} backend. */
public class ChatStoreException extends RuntimeException {
  public ChatStoreException(String message) {
    super(message);
  }

  public ChatStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
