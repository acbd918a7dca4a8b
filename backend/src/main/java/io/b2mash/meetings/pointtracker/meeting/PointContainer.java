package io.b2mash.meetings.pointtracker.meeting;

import java.time.Instant;
import java.util.UUID;

/** A meeting or a series: something that owns points and can be closed and reopened. */
public interface PointContainer {

  UUID getId();

  UUID getProjectId();

  String getTitle();

  ContainerStatus getStatus();

  Instant getClosedAt();

  /** Lower-case noun used in status update texts, e.g. {@code meeting} or {@code series}. */
  String kind();

  /** Closes the container. Throws a conflict if it is already closed. */
  void close(Instant when);

  void reopen();

  default boolean isOpen() {
    return getStatus() == ContainerStatus.SCHEDULED;
  }
}
