package com.chatrelay.chatstore.store;

/**
 * Media descriptor as emitted by the messaging client. Only {@code mediaType} reaches the remote
 * store (folded into message metadata); the local backend keeps every field.
 */
public record MediaAttachment(
    String mediaType,
    String filename,
    String url,
    byte[] mediaKey,
    byte[] fileSha256,
    byte[] fileEncSha256,
    long fileLength) {

  public static MediaAttachment ofType(String mediaType) {
    return new MediaAttachment(mediaType, null, null, null, null, null, 0L);
  }
}
