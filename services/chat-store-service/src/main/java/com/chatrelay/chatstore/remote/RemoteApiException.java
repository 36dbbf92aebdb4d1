package com.chatrelay.chatstore.remote;

import com.chatrelay.chatstore.store.ChatStoreException;
import lombok.Getter;

/** The remote store answered with a status of 400 or above. */
@Getter
public class RemoteApiException extends ChatStoreException {

  private final int statusCode;
  private final String responseBody;

  public RemoteApiException(int statusCode, String responseBody) {
    super("API error (status " + statusCode + "): " + responseBody);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }
}
