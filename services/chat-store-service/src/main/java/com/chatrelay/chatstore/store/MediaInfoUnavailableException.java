package com.chatrelay.chatstore.store;

/** 404 with a stable JSON payload via ApiExceptionHandler. */
public class MediaInfoUnavailableException extends ChatStoreException {
  public MediaInfoUnavailableException(String message) {
    super(message);
  }
}
