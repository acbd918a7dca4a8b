package io.b2mash.meetings.pointtracker.point;

import java.util.EnumSet;
import java.util.Set;

public enum PointStatus {
  NEW,
  OPEN,
  ONGOING,
  CLOSED,
  POSTPONED;

  /** Statuses a closure must dispose of. POSTPONED is deliberately not among them. */
  public static final Set<PointStatus> UNRESOLVED = EnumSet.of(NEW, OPEN, ONGOING);

  public boolean isUnresolved() {
    return UNRESOLVED.contains(this);
  }
}
