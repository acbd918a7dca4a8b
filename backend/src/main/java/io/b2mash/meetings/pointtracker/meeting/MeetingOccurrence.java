package io.b2mash.meetings.pointtracker.meeting;

import io.b2mash.meetings.pointtracker.exception.InvalidStateException;
import io.b2mash.meetings.pointtracker.exception.ResourceConflictException;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/** One scheduled instance of a {@link MeetingSeries}. Holds no points of its own. */
@Entity
@Table(name = "meeting_occurrences")
public class MeetingOccurrence {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "series_id", nullable = false)
  private UUID seriesId;

  @Column(name = "occurrence_date", nullable = false)
  private LocalDate occurrenceDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private OccurrenceStatus status;

  @Column(name = "closed_at")
  private Instant closedAt;

  protected MeetingOccurrence() {}

  public MeetingOccurrence(UUID seriesId, LocalDate occurrenceDate) {
    this.seriesId = seriesId;
    this.occurrenceDate = occurrenceDate;
    this.status = OccurrenceStatus.SCHEDULED;
  }

  /** Marks the occurrence completed. Cancelled occurrences cannot be completed. */
  public void complete(Instant when) {
    if (status == OccurrenceStatus.COMPLETED) {
      throw new ResourceConflictException(
          "Occurrence already completed", "Meeting occurrence " + id + " is already completed");
    }
    requireTransition(OccurrenceStatus.COMPLETED, "complete");
    this.status = OccurrenceStatus.COMPLETED;
    this.closedAt = when;
  }

  public void cancel() {
    requireTransition(OccurrenceStatus.CANCELLED, "cancel");
    this.status = OccurrenceStatus.CANCELLED;
  }

  public void reopen() {
    requireTransition(OccurrenceStatus.SCHEDULED, "reopen");
    this.status = OccurrenceStatus.SCHEDULED;
    this.closedAt = null;
  }

  private void requireTransition(OccurrenceStatus target, String action) {
    if (!this.status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid occurrence state",
          "Cannot " + action + " meeting occurrence in status " + this.status);
    }
  }

  public UUID getId() {
    return id;
  }

  public UUID getSeriesId() {
    return seriesId;
  }

  public LocalDate getOccurrenceDate() {
    return occurrenceDate;
  }

  public OccurrenceStatus getStatus() {
    return status;
  }

  public Instant getClosedAt() {
    return closedAt;
  }
}
