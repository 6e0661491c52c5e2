package com.codeheadsystems.onepass.model.entry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminal outcome of a single entry validation.
 */
public enum EntryStatus {
  ACCEPTED("accepted"),
  REJECTED("rejected");

  private final String wireValue;

  EntryStatus(String wireValue) {
    this.wireValue = wireValue;
  }

  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  @JsonCreator
  public static EntryStatus fromWireValue(String value) {
    for (EntryStatus status : values()) {
      if (status.wireValue.equalsIgnoreCase(value)) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown entry status: " + value);
  }
}
