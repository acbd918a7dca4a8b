package io.b2mash.meetings.pointtracker.point;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class PointController {

  private final PointService pointService;

  public PointController(PointService pointService) {
    this.pointService = pointService;
  }

  @PatchMapping("/api/points/{id}/status")
  public ResponseEntity<PointResponse> updateStatus(
      @PathVariable UUID id, @Valid @RequestBody UpdateStatusRequest request) {
    var point = pointService.updateStatus(id, request.status(), request.comment());
    return ResponseEntity.ok(PointResponse.from(point));
  }

  @GetMapping("/api/points/{id}/status-updates")
  public ResponseEntity<List<StatusUpdateResponse>> listStatusUpdates(@PathVariable UUID id) {
    return ResponseEntity.ok(
        pointService.listStatusUpdates(id).stream().map(StatusUpdateResponse::from).toList());
  }

  // --- DTOs ---

  public record UpdateStatusRequest(
      @NotNull(message = "status is required") PointStatus status,
      @Size(max = 4000, message = "comment must be at most 4000 characters") String comment) {}

  public record PointResponse(
      UUID id,
      UUID meetingId,
      UUID seriesId,
      String title,
      String assignedTo,
      String assignedToRef,
      LocalDate dueDate,
      PointStatus status,
      Instant updatedAt) {

    public static PointResponse from(Point point) {
      return new PointResponse(
          point.getId(),
          point.getMeetingId(),
          point.getSeriesId(),
          point.getTitle(),
          point.getAssignedTo(),
          point.getAssignedToRef(),
          point.getDueDate(),
          point.getStatus(),
          point.getUpdatedAt());
    }
  }

  public record StatusUpdateResponse(
      UUID id, UUID pointId, LocalDate date, String status, String actionOn, Instant createdAt) {

    public static StatusUpdateResponse from(StatusUpdate update) {
      return new StatusUpdateResponse(
          update.getId(),
          update.getPointId(),
          update.getDate(),
          update.getStatus(),
          update.getActionOn(),
          update.getCreatedAt());
    }
  }
}
