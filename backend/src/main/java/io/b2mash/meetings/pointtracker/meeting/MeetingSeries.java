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
import java.util.UUID;

/** Recurring meeting template. Points of a series live on the series, not on its occurrences. */
@Entity
@Table(name = "meeting_series")
public class MeetingSeries implements PointContainer {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "project_id", nullable = false)
  private UUID projectId;

  @Column(name = "title", nullable = false, length = 500)
  private String title;

  @Column(name = "recurrence", length = 50)
  private String recurrence;

  @Enumerated(EnumType.STRING)
  @Column(name = "status", nullable = false, length = 20)
  private ContainerStatus status;

  @Column(name = "closed_at")
  private Instant closedAt;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected MeetingSeries() {}

  public MeetingSeries(UUID projectId, String title, String recurrence) {
    this.projectId = projectId;
    this.title = title;
    this.recurrence = recurrence;
    this.status = ContainerStatus.SCHEDULED;
    this.createdAt = Instant.now();
  }

  @Override
  public void close(Instant when) {
    if (status == ContainerStatus.CLOSED) {
      throw new ResourceConflictException(
          "Meeting series already closed", "Meeting series " + id + " is already closed");
    }
    requireTransition(ContainerStatus.CLOSED, "close");
    this.status = ContainerStatus.CLOSED;
    this.closedAt = when;
  }

  @Override
  public void reopen() {
    requireTransition(ContainerStatus.SCHEDULED, "reopen");
    this.status = ContainerStatus.SCHEDULED;
    this.closedAt = null;
  }

  private void requireTransition(ContainerStatus target, String action) {
    if (!this.status.canTransitionTo(target)) {
      throw new InvalidStateException(
          "Invalid meeting series state",
          "Cannot " + action + " meeting series in status " + this.status);
    }
  }

  @Override
  public String kind() {
    return "series";
  }

  @Override
  public UUID getId() {
    return id;
  }

  @Override
  public UUID getProjectId() {
    return projectId;
  }

  @Override
  public String getTitle() {
    return title;
  }

  public String getRecurrence() {
    return recurrence;
  }

  @Override
  public ContainerStatus getStatus() {
    return status;
  }

  @Override
  public Instant getClosedAt() {
    return closedAt;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
