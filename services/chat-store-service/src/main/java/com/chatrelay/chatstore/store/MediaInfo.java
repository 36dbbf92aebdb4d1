package com.chatrelay.chatstore.store;

public record MediaInfo(
    String mediaType,
    String filename,
    String url,
    byte[] mediaKey,
    byte[] fileSha256,
    byte[] fileEncSha256,
    long fileLength) {}
