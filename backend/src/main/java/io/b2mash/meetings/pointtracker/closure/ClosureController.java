package io.b2mash.meetings.pointtracker.closure;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ClosureController {

  private final ClosureService closureService;

  public ClosureController(ClosureService closureService) {
    this.closureService = closureService;
  }

  @PostMapping("/api/meetings/{id}/close")
  public ResponseEntity<ClosureResult> closeMeeting(
      @PathVariable UUID id, @Valid @RequestBody CloseRequest request) {
    return ResponseEntity.ok(closureService.closeMeeting(id, request.toCommand()));
  }

  @PostMapping("/api/meetings/{id}/reopen")
  public ResponseEntity<ClosureResult> reopenMeeting(@PathVariable UUID id) {
    return ResponseEntity.ok(closureService.reopenMeeting(id));
  }

  @PostMapping("/api/meeting-series/{id}/close")
  public ResponseEntity<ClosureResult> closeSeries(
      @PathVariable UUID id, @Valid @RequestBody CloseRequest request) {
    return ResponseEntity.ok(closureService.closeSeries(id, request.toCommand()));
  }

  @PostMapping("/api/meeting-series/{id}/reopen")
  public ResponseEntity<ClosureResult> reopenSeries(@PathVariable UUID id) {
    return ResponseEntity.ok(closureService.reopenSeries(id));
  }

  /** Occurrences have no points; a request body, if sent, is ignored. */
  @PostMapping("/api/meeting-occurrences/{id}/close")
  public ResponseEntity<ClosureResult> closeOccurrence(@PathVariable UUID id) {
    return ResponseEntity.ok(closureService.completeOccurrence(id));
  }

  @PostMapping("/api/meeting-occurrences/{id}/reopen")
  public ResponseEntity<ClosureResult> reopenOccurrence(@PathVariable UUID id) {
    return ResponseEntity.ok(closureService.reopenOccurrence(id));
  }

  public record CloseRequest(
      @NotNull(message = "mode is required") ClosureMode mode,
      UUID targetMeetingId,
      UUID targetSeriesId) {

    CloseCommand toCommand() {
      return new CloseCommand(mode, targetMeetingId, targetSeriesId);
    }
  }
}
