package io.b2mash.meetings.pointtracker.meeting;

import java.util.Map;
import java.util.Set;

/** Lifecycle of one occurrence of a series. */
public enum OccurrenceStatus {
  SCHEDULED,
  COMPLETED,
  CANCELLED;

  private static final Map<OccurrenceStatus, Set<OccurrenceStatus>> ALLOWED_TRANSITIONS =
      Map.of(
          SCHEDULED, Set.of(COMPLETED, CANCELLED),
          COMPLETED, Set.of(SCHEDULED),
          CANCELLED, Set.of());

  public boolean canTransitionTo(OccurrenceStatus target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }
}
