package io.b2mash.meetings.pointtracker.closure;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.b2mash.meetings.pointtracker.exception.InvalidStateException;

/** What happens to the unresolved points of a container being closed. */
public enum ClosureMode {
  /** Re-parent each unresolved point to a target meeting or series. */
  MOVE("move"),
  /** Force each unresolved point to CLOSED. */
  CLOSE("close");

  private final String value;

  ClosureMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static ClosureMode fromValue(String value) {
    for (ClosureMode mode : values()) {
      if (mode.value.equalsIgnoreCase(value)) {
        return mode;
      }
    }
    throw new InvalidStateException(
        "Invalid closure mode", "Closure mode must be 'move' or 'close', got '" + value + "'");
  }
}
