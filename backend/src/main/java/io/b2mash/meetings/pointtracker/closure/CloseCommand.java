package io.b2mash.meetings.pointtracker.closure;

import java.util.UUID;

/**
 * Request to close a meeting or series. In {@link ClosureMode#MOVE} exactly one of the two target
 * ids must be set; in {@link ClosureMode#CLOSE} both are ignored.
 */
public record CloseCommand(ClosureMode mode, UUID targetMeetingId, UUID targetSeriesId) {

  public static CloseCommand closeAll() {
    return new CloseCommand(ClosureMode.CLOSE, null, null);
  }

  public static CloseCommand moveToMeeting(UUID meetingId) {
    return new CloseCommand(ClosureMode.MOVE, meetingId, null);
  }

  public static CloseCommand moveToSeries(UUID seriesId) {
    return new CloseCommand(ClosureMode.MOVE, null, seriesId);
  }
}
