package com.chatrelay.chatstore.store;

/** A required backend setting is missing. Raised once, while the backend is being built. */
public class StoreConfigurationException extends ChatStoreException {
  public StoreConfigurationException(String message) {
    super(message);
  }
}
