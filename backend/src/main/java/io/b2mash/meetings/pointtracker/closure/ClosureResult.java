package io.b2mash.meetings.pointtracker.closure;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of a close or reopen.
 *
 * @param containerId the meeting, series or occurrence acted on
 * @param containerType {@code meeting}, {@code meeting_series} or {@code meeting_occurrence}
 * @param status the container's status afterwards
 * @param closedAt set after a close, null after a reopen
 * @param mode the closure mode; null for reopen and for occurrences
 * @param targetId meeting or series the points were moved to; null unless mode is MOVE
 * @param affectedPointIds points moved or force-closed, one status update each
 */
public record ClosureResult(
    UUID containerId,
    String containerType,
    String status,
    Instant closedAt,
    ClosureMode mode,
    UUID targetId,
    List<UUID> affectedPointIds) {

  public ClosureResult {
    affectedPointIds = affectedPointIds == null ? List.of() : List.copyOf(affectedPointIds);
  }
}
