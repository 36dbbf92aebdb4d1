package com.chatrelay.chatstore.remote;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Direction {
  INBOUND("inbound"),
  OUTBOUND("outbound");

  private final String wireValue;

  Direction(String wireValue) {
    this.wireValue = wireValue;
  }

  public static Direction of(boolean fromMe) {
    return fromMe ? OUTBOUND : INBOUND;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }
}
