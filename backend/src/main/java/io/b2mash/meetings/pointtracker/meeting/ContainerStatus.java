package io.b2mash.meetings.pointtracker.meeting;

import java.util.Map;
import java.util.Set;

/** Lifecycle of a meeting or a meeting series. */
public enum ContainerStatus {
  SCHEDULED,
  CLOSED;

  private static final Map<ContainerStatus, Set<ContainerStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          SCHEDULED, Set.of(CLOSED),
          CLOSED, Set.of(SCHEDULED));

  public boolean canTransitionTo(ContainerStatus target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }
}
