package io.b2mash.meetings.pointtracker.meeting;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class MeetingController {

  private final MeetingQueryService meetingQueryService;

  public MeetingController(MeetingQueryService meetingQueryService) {
    this.meetingQueryService = meetingQueryService;
  }

  @GetMapping("/api/projects/{projectId}/open-meetings")
  public ResponseEntity<List<MeetingSummary>> listOpenMeetings(
      @PathVariable UUID projectId, @RequestParam(required = false) UUID exclude) {
    return ResponseEntity.ok(
        meetingQueryService.listOpenMeetings(projectId, exclude).stream()
            .map(MeetingSummary::from)
            .toList());
  }

  @GetMapping("/api/projects/{projectId}/open-series")
  public ResponseEntity<List<SeriesSummary>> listOpenSeries(
      @PathVariable UUID projectId, @RequestParam(required = false) UUID exclude) {
    return ResponseEntity.ok(
        meetingQueryService.listOpenSeries(projectId, exclude).stream()
            .map(SeriesSummary::from)
            .toList());
  }

  public record MeetingSummary(UUID id, String title, LocalDate date, ContainerStatus status) {

    public static MeetingSummary from(Meeting meeting) {
      return new MeetingSummary(
          meeting.getId(), meeting.getTitle(), meeting.getMeetingDate(), meeting.getStatus());
    }
  }

  public record SeriesSummary(
      UUID id, String title, String recurrence, ContainerStatus status, Instant createdAt) {

    public static SeriesSummary from(MeetingSeries series) {
      return new SeriesSummary(
          series.getId(),
          series.getTitle(),
          series.getRecurrence(),
          series.getStatus(),
          series.getCreatedAt());
    }
  }
}
