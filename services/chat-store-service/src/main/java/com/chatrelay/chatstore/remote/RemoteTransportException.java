package com.chatrelay.chatstore.remote;

import com.chatrelay.chatstore.store.ChatStoreException;

/** The request could not be built or the network call failed, timeouts included. */
public class RemoteTransportException extends ChatStoreException {
  public RemoteTransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
