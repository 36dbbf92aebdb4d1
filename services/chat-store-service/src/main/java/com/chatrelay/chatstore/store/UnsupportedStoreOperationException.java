package com.chatrelay.chatstore.store;

import java.util.Locale;
import lombok.Getter;

/**
 * The active backend cannot answer this operation at all.
 *
 * <p>Distinct from an empty result: an empty list means "no data", this means "ask another
 * backend".
 */
@Getter
public class UnsupportedStoreOperationException extends ChatStoreException {

  private final StoreCapability capability;

  public UnsupportedStoreOperationException(StoreCapability capability, String backend) {
    super(
        capability.name().toLowerCase(Locale.ROOT)
            + " is not supported by the "
            + backend
            + " backend");
    this.capability = capability;
  }
}
