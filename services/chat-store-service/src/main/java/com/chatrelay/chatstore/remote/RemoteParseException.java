package com.chatrelay.chatstore.remote;

import com.chatrelay.chatstore.store.ChatStoreException;

public class RemoteParseException extends ChatStoreException {
  public RemoteParseException(String message) {
    super(message);
  }

  public RemoteParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
