package com.chatrelay.chatstore.remote;

import com.chatrelay.chatstore.store.ChatStoreException;

public class RemoteSerializationException extends ChatStoreException {
  public RemoteSerializationException(String message, Throwable cause) {
    super(message, cause);
  }
}
